package fr.lapetina.llmrelay.domain.metrics;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Derived performance of one attempt or request. Every value may be absent ("no data").
 */
public record PerformanceMetrics(
        OptionalLong latencyMs,
        OptionalLong firstTokenLatencyMs,
        OptionalDouble tokensPerSecond
) {
    public Long latencyMsOrNull() {
        return latencyMs.isPresent() ? latencyMs.getAsLong() : null;
    }

    public Long firstTokenLatencyMsOrNull() {
        return firstTokenLatencyMs.isPresent() ? firstTokenLatencyMs.getAsLong() : null;
    }

    public Double tokensPerSecondOrNull() {
        return tokensPerSecond.isPresent() ? tokensPerSecond.getAsDouble() : null;
    }
}
