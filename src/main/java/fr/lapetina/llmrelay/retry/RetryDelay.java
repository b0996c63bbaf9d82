package fr.lapetina.llmrelay.retry;

/**
 * Waits between two attempts on the same channel.
 */
@FunctionalInterface
public interface RetryDelay {

    /**
     * Fixed delay that wakes up early when the request is cancelled.
     */
    RetryDelay CANCELLABLE = (delayMs, token) -> delayMs <= 0
            ? !token.isCancelled()
            : !token.awaitCancellation(delayMs);

    /**
     * @return true if the delay elapsed, false if the request was cancelled while waiting
     */
    boolean await(long delayMs, CancellationToken token) throws InterruptedException;
}
