/**
 * Request intake built on the LMAX Disruptor.
 *
 * <p>Requests are published into a pre-allocated ring buffer by the HTTP threads and flow
 * through three handlers:
 * <pre>
 * Validation → Admission → Coordination
 * </pre>
 *
 * <p>Validation checks the model and body limits. Admission bounds the number of requests
 * whose attempt loop is running. Coordination hands admitted requests to a fixed worker
 * pool where {@link fr.lapetina.llmrelay.retry.RetryCoordinator} drives them to a terminal
 * state, and completes rejected ones with a {@code BackpressureException} or a
 * {@code RequestRejectedException}.
 *
 * @see fr.lapetina.llmrelay.disruptor.RequestPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.llmrelay.disruptor;
