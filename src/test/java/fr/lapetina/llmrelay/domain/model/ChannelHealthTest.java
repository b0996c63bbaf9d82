package fr.lapetina.llmrelay.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChannelHealthTest {

    // 10 buckets of 1s, 500ms cooldown, breaker opens at 3 failures, 2s recovery
    private static final ChannelHealth.Settings SETTINGS = new ChannelHealth.Settings(
            Duration.ofSeconds(10), 10, Duration.ofMillis(500), 3, Duration.ofSeconds(2), 1);

    private static final long T0 = 1_700_000_000_000L;

    private ChannelHealth health;

    @BeforeEach
    void setUp() {
        health = new ChannelHealth("ch-test", SETTINGS);
    }

    @Nested
    @DisplayName("Window aggregation")
    class WindowTests {

        @Test
        @DisplayName("should report a channel without history as fully healthy")
        void shouldReportEmptyHistoryAsHealthy() {
            ChannelHealth.Snapshot snapshot = health.snapshot(T0);

            assertThat(snapshot.total()).isZero();
            assertThat(snapshot.successRate()).isEqualTo(1.0);
            assertThat(snapshot.averageLatencyMs()).isZero();
            assertThat(snapshot.coolingDown()).isFalse();
        }

        @Test
        @DisplayName("should aggregate successes, failures and mean latency")
        void shouldAggregateOutcomes() {
            health.recordSuccess(100, T0);
            health.recordSuccess(300, T0 + 1_500);
            health.recordFailure(T0 + 2_500);
            health.recordSuccess(200, T0 + 3_500);

            ChannelHealth.Snapshot snapshot = health.snapshot(T0 + 4_000);

            assertThat(snapshot.successes()).isEqualTo(3);
            assertThat(snapshot.failures()).isEqualTo(1);
            assertThat(snapshot.successRate()).isCloseTo(0.75, within(1e-9));
            assertThat(snapshot.averageLatencyMs()).isCloseTo(200.0, within(1e-9));
        }

        @Test
        @DisplayName("should forget outcomes older than the window")
        void shouldForgetOldOutcomes() {
            health.recordFailure(T0);
            health.recordFailure(T0);
            health.recordSuccess(50, T0 + 9_000);

            ChannelHealth.Snapshot snapshot = health.snapshot(T0 + 12_000);

            assertThat(snapshot.failures()).isZero();
            assertThat(snapshot.successes()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reuse a bucket when its slot comes round again")
        void shouldReuseBucket() {
            health.recordSuccess(10, T0);
            health.recordFailure(T0 + 10_000);

            ChannelHealth.Snapshot snapshot = health.snapshot(T0 + 10_000);

            assertThat(snapshot.successes()).isZero();
            assertThat(snapshot.failures()).isEqualTo(1);
        }

        @Test
        @DisplayName("should drop a late sample instead of wiping the newer slot of its bucket")
        void shouldDropLateSample() {
            health.recordSuccess(10, T0 + 10_000);
            health.recordFailure(T0);

            ChannelHealth.Snapshot snapshot = health.snapshot(T0 + 10_000);

            assertThat(snapshot.successes()).isEqualTo(1);
            assertThat(snapshot.failures()).isZero();
            assertThat(health.getConsecutiveFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Failure tracking")
    class FailureTests {

        @Test
        @DisplayName("should count consecutive failures until a success")
        void shouldCountConsecutiveFailures() {
            health.recordFailure(T0);
            health.recordFailure(T0);
            assertThat(health.getConsecutiveFailures()).isEqualTo(2);

            health.recordSuccess(10, T0);

            assertThat(health.getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should be cooling down right after a failure")
        void shouldCoolDownAfterFailure() {
            health.recordFailure(T0);

            assertThat(health.snapshot(T0 + 100).coolingDown()).isTrue();
            assertThat(health.snapshot(T0 + 500).coolingDown()).isFalse();
        }

        @Test
        @DisplayName("should open the breaker after consecutive failures")
        void shouldOpenBreaker() {
            health.recordFailure(T0);
            health.recordFailure(T0);
            health.recordFailure(T0);

            assertThat(health.snapshot(T0).breakerState()).isEqualTo(ChannelCircuitBreaker.State.OPEN);
            assertThat(health.snapshot(T0 + 2_000).breakerState()).isEqualTo(ChannelCircuitBreaker.State.HALF_OPEN);
        }

        @Test
        @DisplayName("should count upstream statuses separately until a success")
        void shouldCountErrorStatuses() {
            assertThat(health.recordErrorStatus(429)).isEqualTo(1);
            assertThat(health.recordErrorStatus(429)).isEqualTo(2);
            assertThat(health.recordErrorStatus(401)).isEqualTo(1);

            health.recordSuccess(10, T0);

            assertThat(health.getErrorStatusCount(429)).isZero();
            assertThat(health.getErrorStatusCount(401)).isZero();
        }
    }

    @Test
    @DisplayName("should not lose updates under concurrency")
    void shouldNotLoseConcurrentUpdates() throws InterruptedException {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        long now = System.currentTimeMillis();

        for (int t = 0; t < threads; t++) {
            int index = t;
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    if (index % 2 == 0) {
                        health.recordSuccess(10, now);
                    } else {
                        health.recordFailure(now);
                    }
                }
                latch.countDown();
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        ChannelHealth.Snapshot snapshot = health.snapshot(now);
        assertThat(snapshot.successes()).isEqualTo(4_000);
        assertThat(snapshot.failures()).isEqualTo(4_000);
    }
}
