/**
 * Attempt loop of a relayed request.
 *
 * <p>{@link fr.lapetina.llmrelay.retry.RetryCoordinator} drives one request through repeated
 * {@link fr.lapetina.llmrelay.retry.Dispatcher} calls. Transient errors are retried on the same
 * channel until its budget is spent, then another channel is picked.
 * Every attempt is recorded before the next one starts.
 */
package fr.lapetina.llmrelay.retry;
