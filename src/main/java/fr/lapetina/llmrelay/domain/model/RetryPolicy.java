package fr.lapetina.llmrelay.domain.model;

import java.util.Objects;

/**
 * Immutable snapshot of the retry configuration, captured once when a request starts.
 *
 * @param enabled                 when false, exactly one attempt is made and nothing is retried
 * @param maxChannelRetries       maximum number of distinct channels to try
 * @param maxSingleChannelRetries repeated attempts on the same channel after the first one
 * @param retryDelayMs            fixed delay between attempts on the same channel
 * @param loadBalancerStrategy    channel selection algorithm
 * @param autoDisableChannel      upstream statuses that disable a channel once repeated
 */
public record RetryPolicy(
        boolean enabled,
        int maxChannelRetries,
        int maxSingleChannelRetries,
        long retryDelayMs,
        LoadBalancerStrategyType loadBalancerStrategy,
        AutoDisablePolicy autoDisableChannel
) {
    public static final int DEFAULT_MAX_CHANNEL_RETRIES = 3;
    public static final int DEFAULT_MAX_SINGLE_CHANNEL_RETRIES = 2;
    public static final long DEFAULT_RETRY_DELAY_MS = 1000;

    public RetryPolicy {
        if (maxChannelRetries < 0) {
            throw new IllegalArgumentException("maxChannelRetries must be >= 0: " + maxChannelRetries);
        }
        if (maxSingleChannelRetries < 0) {
            throw new IllegalArgumentException("maxSingleChannelRetries must be >= 0: " + maxSingleChannelRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0: " + retryDelayMs);
        }
        Objects.requireNonNull(loadBalancerStrategy, "loadBalancerStrategy is required");
        if (autoDisableChannel == null) {
            autoDisableChannel = AutoDisablePolicy.disabled();
        }
    }

    public RetryPolicy(
            boolean enabled,
            int maxChannelRetries,
            int maxSingleChannelRetries,
            long retryDelayMs,
            LoadBalancerStrategyType loadBalancerStrategy
    ) {
        this(enabled, maxChannelRetries, maxSingleChannelRetries, retryDelayMs, loadBalancerStrategy,
                AutoDisablePolicy.disabled());
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(
                true,
                DEFAULT_MAX_CHANNEL_RETRIES,
                DEFAULT_MAX_SINGLE_CHANNEL_RETRIES,
                DEFAULT_RETRY_DELAY_MS,
                LoadBalancerStrategyType.ADAPTIVE
        );
    }

    /**
     * Attempts allowed on one channel: the first try plus its retries.
     */
    public int attemptsPerChannel() {
        return maxSingleChannelRetries + 1;
    }

    /**
     * Upper bound on attempts for one request under this policy.
     */
    public int maxAttempts() {
        if (!enabled) {
            return 1;
        }
        return maxChannelRetries * attemptsPerChannel();
    }

    public RetryPolicy withEnabled(boolean value) {
        return new RetryPolicy(value, maxChannelRetries, maxSingleChannelRetries, retryDelayMs, loadBalancerStrategy,
                autoDisableChannel);
    }

    public RetryPolicy withAutoDisableChannel(AutoDisablePolicy value) {
        return new RetryPolicy(enabled, maxChannelRetries, maxSingleChannelRetries, retryDelayMs, loadBalancerStrategy,
                value);
    }
}
