/**
 * Domain model for the relay.
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.Request} - one inbound client call</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.RequestExecution} - one attempt against one channel</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.Channel} - an upstream back-end with its shared
 *       {@link fr.lapetina.llmrelay.domain.model.ChannelHealth}</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.RetryPolicy} - immutable per-request retry snapshot</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.UsageLog} - upstream token counts</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.model.ErrorType} - error taxonomy</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Requests, executions and policies are immutable records. Channel configuration is immutable;
 * its health is updated concurrently through atomic counters.
 */
package fr.lapetina.llmrelay.domain.model;
