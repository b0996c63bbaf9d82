package fr.lapetina.llmrelay.domain.model;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling health of one channel, shared by every request that routes through it.
 *
 * <p>Outcomes are counted in a ring of time buckets covering the trailing window. Each bucket
 * holds atomic counters; a bucket is only locked when it rolls over to a new time slot, so
 * concurrent outcome updates never contend on a channel-wide lock. A sample older than the
 * slot its bucket already holds is dropped from the window.
 *
 * <p>Failures that carried an upstream HTTP status are also counted per status, outside the
 * window, until the next success or an explicit reset.
 */
public final class ChannelHealth {

    private final Settings settings;
    private final long bucketMillis;
    private final Bucket[] buckets;
    private final ChannelCircuitBreaker circuitBreaker;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong lastFailureAtMillis = new AtomicLong(0);
    private final Map<Integer, AtomicInteger> errorStatusCounts = new ConcurrentHashMap<>();

    public ChannelHealth(String channelId, Settings settings) {
        this.settings = settings;
        this.bucketMillis = Math.max(1, settings.window().toMillis() / settings.bucketCount());
        this.buckets = new Bucket[settings.bucketCount()];
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new Bucket();
        }
        this.circuitBreaker = new ChannelCircuitBreaker(
                channelId,
                settings.failureThreshold(),
                settings.recovery(),
                settings.halfOpenSuccessThreshold()
        );
    }

    public ChannelHealth(String channelId) {
        this(channelId, Settings.defaults());
    }

    public void recordSuccess(long latencyMs, long nowMillis) {
        Bucket bucket = bucketFor(nowMillis);
        if (bucket != null) {
            bucket.recordSuccess(Math.max(0, latencyMs));
        }
        consecutiveFailures.set(0);
        errorStatusCounts.clear();
        circuitBreaker.recordSuccess(nowMillis);
    }

    public void recordSuccess(long latencyMs) {
        recordSuccess(latencyMs, System.currentTimeMillis());
    }

    public void recordFailure(long nowMillis) {
        Bucket bucket = bucketFor(nowMillis);
        if (bucket != null) {
            bucket.recordFailure();
        }
        consecutiveFailures.incrementAndGet();
        lastFailureAtMillis.accumulateAndGet(nowMillis, Math::max);
        circuitBreaker.recordFailure(nowMillis);
    }

    public void recordFailure() {
        recordFailure(System.currentTimeMillis());
    }

    /**
     * Aggregates the buckets that fall inside the trailing window ending at {@code nowMillis}.
     */
    public Snapshot snapshot(long nowMillis) {
        long currentSlot = nowMillis / bucketMillis;
        long oldestSlot = currentSlot - buckets.length + 1;
        long successes = 0;
        long failures = 0;
        long latencySum = 0;

        for (Bucket bucket : buckets) {
            long slot = bucket.slot.get();
            if (slot >= oldestSlot && slot <= currentSlot) {
                successes += bucket.successes.get();
                failures += bucket.failures.get();
                latencySum += bucket.latencySumMs.get();
            }
        }

        long lastFailure = lastFailureAtMillis.get();
        boolean coolingDown = lastFailure > 0 && nowMillis - lastFailure < settings.cooldown().toMillis();

        return new Snapshot(
                successes,
                failures,
                successes > 0 ? (double) latencySum / successes : 0.0,
                consecutiveFailures.get(),
                circuitBreaker.getState(nowMillis),
                coolingDown
        );
    }

    public Snapshot snapshot() {
        return snapshot(System.currentTimeMillis());
    }

    /**
     * Counts one more failure with the given upstream status.
     *
     * @return occurrences of the status since the last success or reset
     */
    public int recordErrorStatus(int statusCode) {
        return errorStatusCounts.computeIfAbsent(statusCode, code -> new AtomicInteger()).incrementAndGet();
    }

    public int getErrorStatusCount(int statusCode) {
        AtomicInteger count = errorStatusCounts.get(statusCode);
        return count != null ? count.get() : 0;
    }

    public void resetErrorStatuses() {
        errorStatusCounts.clear();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public ChannelCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Settings getSettings() {
        return settings;
    }

    /**
     * Bucket holding {@code nowMillis}, or null when the bucket already moved on to a later slot.
     */
    private Bucket bucketFor(long nowMillis) {
        long slot = nowMillis / bucketMillis;
        Bucket bucket = buckets[(int) Math.floorMod(slot, (long) buckets.length)];
        long current = bucket.slot.get();
        if (current == slot) {
            return bucket;
        }
        if (current > slot) {
            return null;
        }
        synchronized (bucket) {
            if (bucket.slot.get() < slot) {
                bucket.reset(slot);
            }
            return bucket.slot.get() == slot ? bucket : null;
        }
    }

    private static final class Bucket {
        private final AtomicLong slot = new AtomicLong(Long.MIN_VALUE);
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong latencySumMs = new AtomicLong();

        void recordSuccess(long latencyMs) {
            successes.incrementAndGet();
            latencySumMs.addAndGet(latencyMs);
        }

        void recordFailure() {
            failures.incrementAndGet();
        }

        void reset(long newSlot) {
            successes.set(0);
            failures.set(0);
            latencySumMs.set(0);
            slot.set(newSlot);
        }
    }

    /**
     * Point-in-time view of a channel's health.
     *
     * @param successes           successful attempts inside the window
     * @param failures            failed attempts inside the window
     * @param averageLatencyMs    mean latency of successful attempts, 0 without samples
     * @param consecutiveFailures failures since the last success
     * @param breakerState        circuit breaker state
     * @param coolingDown         whether the last failure is within the cooldown period
     */
    public record Snapshot(
            long successes,
            long failures,
            double averageLatencyMs,
            int consecutiveFailures,
            ChannelCircuitBreaker.State breakerState,
            boolean coolingDown
    ) {
        public long total() {
            return successes + failures;
        }

        /**
         * Success ratio inside the window. A channel without history is assumed healthy.
         */
        public double successRate() {
            long total = total();
            return total == 0 ? 1.0 : (double) successes / total;
        }
    }

    /**
     * Tuning for the health window and breaker.
     */
    public record Settings(
            Duration window,
            int bucketCount,
            Duration cooldown,
            int failureThreshold,
            Duration recovery,
            int halfOpenSuccessThreshold
    ) {
        public Settings {
            if (window.isNegative() || window.isZero()) {
                throw new IllegalArgumentException("window must be positive");
            }
            if (bucketCount < 1) {
                throw new IllegalArgumentException("bucketCount must be >= 1");
            }
        }

        public static Settings defaults() {
            return new Settings(
                    Duration.ofSeconds(600),
                    60,
                    Duration.ofSeconds(5),
                    5,
                    Duration.ofSeconds(60),
                    3
            );
        }
    }
}
