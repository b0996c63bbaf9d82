/**
 * LLM relay - retry and failover orchestration in front of several model-serving channels.
 *
 * <p>A request is accepted once, then attempted against one channel after another until an
 * attempt succeeds, the retry budget runs out, or the caller cancels. Every attempt is kept
 * as a {@link fr.lapetina.llmrelay.domain.model.RequestExecution}; the request's terminal
 * state is written exactly once.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrelay.RelayFactory} - wires the relay from YAML configuration</li>
 *   <li>{@link fr.lapetina.llmrelay.LlmRelayApplication} - standalone HTTP server with an
 *       OpenAI-compatible chat completions endpoint</li>
 *   <li>{@link fr.lapetina.llmrelay.retry.RetryCoordinator} - the attempt loop</li>
 *   <li>{@link fr.lapetina.llmrelay.domain.strategy.LoadBalancer} - adaptive and weighted channel selection</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RelayFactory factory = RelayFactory.create("config.yaml").start()) {
 *     CompletableFuture<Request> future = factory.getPipeline()
 *             .submit(Request.create("gpt-4o", "{\"model\":\"gpt-4o\",\"messages\":[]}"));
 *     Request terminal = future.get();
 * }
 * }</pre>
 *
 * @see fr.lapetina.llmrelay.RelayFactory
 * @see fr.lapetina.llmrelay.disruptor.RequestPipeline
 */
package fr.lapetina.llmrelay;
