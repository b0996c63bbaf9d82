package fr.lapetina.llmrelay.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal for one request.
 *
 * The coordinator polls it before every attempt and waits on it during retry delays.
 * Dispatchers register callbacks to abort the in-flight call when it fires.
 * Cancelling is idempotent; only the first reason is kept.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Signals cancellation.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "canceled")) {
            return false;
        }
        latch.countDown();
        for (Callback callback : callbacks) {
            callback.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Registers an action to run on cancellation. Runs immediately if already cancelled.
     *
     * @return handle that unregisters the action
     */
    public Registration onCancel(Runnable action) {
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits until cancelled or the timeout elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean awaitCancellation(long timeoutMs) throws InterruptedException {
        return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Callback {
        private final Runnable action;
        private final AtomicBoolean ran = new AtomicBoolean(false);

        Callback(Runnable action) {
            this.action = action;
        }

        void run() {
            if (!ran.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed", e);
            }
        }
    }
}
