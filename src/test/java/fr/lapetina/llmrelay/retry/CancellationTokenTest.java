package fr.lapetina.llmrelay.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    @DisplayName("should keep the first reason only")
    void shouldKeepFirstReason() {
        CancellationToken token = new CancellationToken();

        assertThat(token.cancel("client gone")).isTrue();
        assertThat(token.cancel("timeout")).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.getReason()).hasValue("client gone");
    }

    @Test
    @DisplayName("should run callbacks once, including ones registered after cancellation")
    void shouldRunCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger before = new AtomicInteger();
        AtomicInteger after = new AtomicInteger();

        token.onCancel(before::incrementAndGet);
        token.cancel(null);
        token.cancel("again");
        token.onCancel(after::incrementAndGet);

        assertThat(before).hasValue(1);
        assertThat(after).hasValue(1);
        assertThat(token.getReason()).hasValue("canceled");
    }

    @Test
    @DisplayName("should not run a callback whose registration was closed")
    void shouldUnregisterCallback() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);
        registration.close();
        token.cancel("user");

        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should keep running callbacks when one throws")
    void shouldIsolateFailingCallback() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);
        token.cancel("user");

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("should wake up a cancellable delay early")
    void shouldWakeUpDelayEarly() throws Exception {
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> token.cancel("user"), 50, TimeUnit.MILLISECONDS);

            long start = System.nanoTime();
            boolean elapsed = RetryDelay.CANCELLABLE.await(10_000, token);
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsed).isFalse();
            assertThat(waitedMs).isLessThan(5_000);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("should report an elapsed delay when nobody cancels")
    void shouldElapseDelay() throws Exception {
        CancellationToken token = new CancellationToken();

        assertThat(RetryDelay.CANCELLABLE.await(20, token)).isTrue();
        assertThat(RetryDelay.CANCELLABLE.await(0, token)).isTrue();

        token.cancel("user");
        assertThat(RetryDelay.CANCELLABLE.await(0, token)).isFalse();
    }
}
