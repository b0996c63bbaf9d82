package fr.lapetina.llmrelay.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Disables a channel once an upstream HTTP status has been returned by it a given number of times.
 *
 * <p>Counts are kept per channel and per status. A successful attempt resets every count of its
 * channel, and so does disabling it. Canceled attempts and failures without an HTTP status
 * are not counted.
 *
 * @param enabled  whether channels are disabled at all
 * @param statuses thresholds, at most one per status code
 */
public record AutoDisablePolicy(boolean enabled, List<StatusThreshold> statuses) {

    public AutoDisablePolicy {
        statuses = statuses != null ? List.copyOf(statuses) : List.of();
        Set<Integer> seen = new HashSet<>();
        for (StatusThreshold threshold : statuses) {
            if (!seen.add(threshold.status())) {
                throw new IllegalArgumentException("Duplicate auto-disable status: " + threshold.status());
            }
        }
    }

    public static AutoDisablePolicy disabled() {
        return new AutoDisablePolicy(false, List.of());
    }

    /**
     * Number of occurrences of {@code statusCode} that disables a channel, empty when the
     * status is not watched or the policy is off.
     */
    public OptionalInt thresholdFor(int statusCode) {
        if (!enabled) {
            return OptionalInt.empty();
        }
        for (StatusThreshold threshold : statuses) {
            if (threshold.status() == statusCode) {
                return OptionalInt.of(threshold.times());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @param status HTTP status code returned by the upstream
     * @param times  occurrences before the channel is disabled
     */
    public record StatusThreshold(int status, int times) {
        public StatusThreshold {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("status must be an HTTP status code: " + status);
            }
            if (times < 1) {
                throw new IllegalArgumentException("times must be >= 1: " + times);
            }
        }
    }
}
