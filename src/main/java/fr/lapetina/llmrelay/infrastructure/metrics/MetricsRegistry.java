package fr.lapetina.llmrelay.infrastructure.metrics;

import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.ExecutionStatus;
import fr.lapetina.llmrelay.domain.model.RequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized operational metrics using Micrometer.
 *
 * Provides:
 * - Attempt counters per channel and outcome
 * - Attempt latency and TTFT timers per channel
 * - Request counters per terminal status and attempts-per-request distribution
 * - Tokens per second distribution
 * - In-flight and intake gauges, channel score gauges
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> ttftTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> throughputSummaries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Gauge> channelGauges = new ConcurrentHashMap<>();
    private final DistributionSummary attemptsPerRequest;

    // Global gauges
    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;

        Gauge.builder(prefix + "_inflight_requests_total", globalInFlight, AtomicInteger::get)
                .description("Requests currently being coordinated")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the intake ring buffer")
                .register(registry);

        this.attemptsPerRequest = DistributionSummary.builder(prefix + "_request_attempts")
                .description("Attempts made per terminal request")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Creates a Prometheus-backed registry with JVM metrics.
     */
    public MetricsRegistry(String prefix) {
        this(prefix, prometheusRegistry());
    }

    public MetricsRegistry() {
        this("llm_relay");
    }

    private static PrometheusMeterRegistry prometheusRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        return registry;
    }

    /**
     * Counts one finished attempt and records its latency when known.
     */
    public void recordAttempt(String channelId, ExecutionStatus status, ErrorType errorType, Long latencyMs) {
        String type = errorType != null ? errorType.name() : "NONE";
        String key = channelId + ":" + status.name() + ":" + type;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of upstream attempts")
                        .tag("channel", channelId)
                        .tag("status", status.name())
                        .tag("error_type", type)
                        .register(registry)
        ).increment();

        if (latencyMs != null) {
            latencyTimers.computeIfAbsent(channelId, k ->
                    Timer.builder(prefix + "_attempt_latency")
                            .description("Upstream attempt latency")
                            .tag("channel", channelId)
                            .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                            .register(registry)
            ).record(Duration.ofMillis(latencyMs));
        }
    }

    public void recordFirstTokenLatency(String channelId, long ttftMs) {
        ttftTimers.computeIfAbsent(channelId, k ->
                Timer.builder(prefix + "_attempt_ttft")
                        .description("Time to first streamed chunk")
                        .tag("channel", channelId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(Duration.ofMillis(ttftMs));
    }

    public void recordTokensPerSecond(String channelId, double tokensPerSecond) {
        throughputSummaries.computeIfAbsent(channelId, k ->
                DistributionSummary.builder(prefix + "_tokens_per_second")
                        .description("Completion tokens per second of generation")
                        .tag("channel", channelId)
                        .register(registry)
        ).record(tokensPerSecond);
    }

    /**
     * Counts one terminal request.
     */
    public void recordRequest(RequestStatus status, int attempts) {
        requestCounters.computeIfAbsent(status.name(), k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of terminal requests")
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
        attemptsPerRequest.record(attempts);
    }

    /**
     * Counts a request refused before coordination (validation, capacity).
     */
    public void incrementRejected(ErrorType errorType) {
        rejectionCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_rejected_total")
                        .description("Requests refused at intake")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a channel's adaptive score. Re-registering the same channel is a no-op.
     */
    public void registerChannelScore(String channelId, Supplier<Number> score) {
        channelGauges.computeIfAbsent(channelId, k ->
                Gauge.builder(prefix + "_channel_score", score, s -> s.get().doubleValue())
                        .description("Adaptive selection score per channel")
                        .tag("channel", channelId)
                        .register(registry)
        );
    }

    public void setGlobalInFlight(int value) {
        globalInFlight.set(value);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for non-Prometheus registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
