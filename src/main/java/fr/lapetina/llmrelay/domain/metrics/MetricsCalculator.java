package fr.lapetina.llmrelay.domain.metrics;

import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.UsageLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Derives latency, time-to-first-token and tokens per second from recorded timestamps.
 *
 * <p>All functions are pure. A negative interval is treated as clock skew: the value is
 * reported as absent instead of negative. Tokens per second is absent whenever there are
 * no completion tokens or no generation time; it is never zero by default, negative or infinite.
 */
public final class MetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

    private MetricsCalculator() {
        // Utility class
    }

    /**
     * Milliseconds between two instants, absent when either is missing or the interval is negative.
     */
    public static OptionalLong latencyMs(Instant start, Instant end) {
        if (start == null || end == null) {
            return OptionalLong.empty();
        }
        long millis = Duration.between(start, end).toMillis();
        if (millis < 0) {
            log.debug("Clock skew, latency omitted: start={}, end={}", start, end);
            return OptionalLong.empty();
        }
        return OptionalLong.of(millis);
    }

    /**
     * Time to first token. Only defined for streaming attempts that produced a chunk.
     */
    public static OptionalLong firstTokenLatencyMs(boolean stream, Instant start, Instant firstChunkAt) {
        if (!stream) {
            return OptionalLong.empty();
        }
        return latencyMs(start, firstChunkAt);
    }

    /**
     * Seconds spent generating tokens: latency minus TTFT for streams, the whole latency otherwise.
     */
    public static OptionalDouble effectiveGenerationSeconds(
            boolean stream,
            OptionalLong latencyMs,
            OptionalLong firstTokenLatencyMs
    ) {
        if (latencyMs.isEmpty()) {
            return OptionalDouble.empty();
        }
        long generationMs = latencyMs.getAsLong();
        if (stream && firstTokenLatencyMs.isPresent()) {
            generationMs = Math.max(0, generationMs - firstTokenLatencyMs.getAsLong());
        }
        return OptionalDouble.of(generationMs / 1000.0);
    }

    public static OptionalDouble tokensPerSecond(long completionTokens, OptionalDouble effectiveGenerationSeconds) {
        if (completionTokens <= 0 || effectiveGenerationSeconds.isEmpty()) {
            return OptionalDouble.empty();
        }
        double seconds = effectiveGenerationSeconds.getAsDouble();
        if (seconds <= 0) {
            return OptionalDouble.empty();
        }
        double value = completionTokens / seconds;
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * Metrics of a single attempt, measured from its start to its own last update.
     *
     * @param usage token usage for the attempt, or null when unknown
     */
    public static PerformanceMetrics forExecution(RequestExecution execution, boolean stream, UsageLog usage) {
        return compute(stream, execution.createdAt(), execution.updatedAt(), execution.firstChunkAt(), usage);
    }

    /**
     * Metrics of a terminal request, measured from the start of its successful attempt
     * to the request's terminal update.
     *
     * @param usage token usage for the attempt, or null when unknown
     */
    public static PerformanceMetrics forRequest(Request terminal, RequestExecution execution, UsageLog usage) {
        return compute(terminal.stream(), execution.createdAt(), terminal.updatedAt(), execution.firstChunkAt(), usage);
    }

    private static PerformanceMetrics compute(
            boolean stream,
            Instant start,
            Instant end,
            Instant firstChunkAt,
            UsageLog usage
    ) {
        OptionalLong latency = latencyMs(start, end);
        OptionalLong ttft = firstTokenLatencyMs(stream, start, firstChunkAt);
        OptionalDouble tps = usage == null
                ? OptionalDouble.empty()
                : tokensPerSecond(usage.completionTokens(), effectiveGenerationSeconds(stream, latency, ttft));
        return new PerformanceMetrics(latency, ttft, tps);
    }
}
