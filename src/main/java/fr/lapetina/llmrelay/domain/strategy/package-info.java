/**
 * Channel selection.
 *
 * <p>{@link fr.lapetina.llmrelay.domain.strategy.LoadBalancer} narrows a channel snapshot to the
 * candidates for a request and delegates the pick to a
 * {@link fr.lapetina.llmrelay.domain.strategy.LoadBalancingStrategy}:
 * <ul>
 *   <li>{@link fr.lapetina.llmrelay.domain.strategy.WeightedStrategy} - static weights</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.strategy.AdaptiveStrategy} - rolling health scores
 *       with cooldown after failures</li>
 * </ul>
 * An empty result means no channel is eligible; it is not an error.
 */
package fr.lapetina.llmrelay.domain.strategy;
