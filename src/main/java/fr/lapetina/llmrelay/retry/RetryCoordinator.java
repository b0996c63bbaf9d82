package fr.lapetina.llmrelay.retry;

import fr.lapetina.llmrelay.domain.metrics.MetricsCalculator;
import fr.lapetina.llmrelay.domain.metrics.PerformanceMetrics;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.ExecutionStatus;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;
import fr.lapetina.llmrelay.domain.strategy.LoadBalancer;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.infrastructure.persistence.ExecutionRecorder;
import fr.lapetina.llmrelay.infrastructure.persistence.UsageLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Drives one request through its attempts until success, exhaustion or cancellation.
 *
 * <p>With retries enabled, channels are tried one after the other, up to
 * {@code maxChannelRetries} distinct channels. Each channel gets one attempt plus up to
 * {@code maxSingleChannelRetries} retries separated by {@code retryDelayMs}. A non-retryable
 * failure moves straight to the next channel, and so does a channel that was just auto-disabled.
 * With retries disabled exactly one attempt is made.
 *
 * <p>Attempts of one request are strictly sequential. Every attempt is recorded exactly once
 * and the request's terminal state is recorded exactly once, after its last attempt.
 * The coordinator is stateless; all per-request state lives in a {@link Run}, so one instance
 * serves any number of concurrent requests.
 */
public final class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final LoadBalancer loadBalancer;
    private final Dispatcher dispatcher;
    private final ExecutionRecorder recorder;
    private final UsageLogRepository usageLogs;
    private final MetricsRegistry metricsRegistry;
    private final RetryDelay retryDelay;
    private final ChannelDisabler channelDisabler;

    public RetryCoordinator(
            LoadBalancer loadBalancer,
            Dispatcher dispatcher,
            ExecutionRecorder recorder,
            UsageLogRepository usageLogs,
            MetricsRegistry metricsRegistry,
            RetryDelay retryDelay,
            ChannelDisabler channelDisabler
    ) {
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "LoadBalancer is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher is required");
        this.recorder = Objects.requireNonNull(recorder, "ExecutionRecorder is required");
        this.usageLogs = Objects.requireNonNull(usageLogs, "UsageLogRepository is required");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "MetricsRegistry is required");
        this.retryDelay = Objects.requireNonNull(retryDelay, "RetryDelay is required");
        this.channelDisabler = Objects.requireNonNull(channelDisabler, "ChannelDisabler is required");
    }

    public RetryCoordinator(
            LoadBalancer loadBalancer,
            Dispatcher dispatcher,
            ExecutionRecorder recorder,
            UsageLogRepository usageLogs,
            MetricsRegistry metricsRegistry,
            RetryDelay retryDelay
    ) {
        this(loadBalancer, dispatcher, recorder, usageLogs, metricsRegistry, retryDelay, ChannelDisabler.NOOP);
    }

    public RetryCoordinator(
            LoadBalancer loadBalancer,
            Dispatcher dispatcher,
            ExecutionRecorder recorder,
            UsageLogRepository usageLogs,
            MetricsRegistry metricsRegistry
    ) {
        this(loadBalancer, dispatcher, recorder, usageLogs, metricsRegistry, RetryDelay.CANCELLABLE);
    }

    /**
     * Runs a pending request to its terminal state.
     *
     * @param request  pending request
     * @param policy   retry policy snapshot taken when the request started
     * @param channels channel snapshot taken when the request started
     * @param token    cancellation signal of the request
     * @param listener receives streamed chunks of the attempts
     * @return the terminal request, as recorded
     */
    public Request execute(
            Request request,
            RetryPolicy policy,
            List<Channel> channels,
            CancellationToken token,
            ChunkListener listener
    ) {
        MDC.put("requestId", request.id());
        try {
            Run run = new Run(request.processing(Instant.now()), policy, List.copyOf(channels), token, listener);
            log.info("Request started: requestId={}, model={}, stream={}, retryEnabled={}, strategy={}",
                    request.id(), request.modelId(), request.stream(), policy.enabled(),
                    policy.loadBalancerStrategy().value());

            Request terminal = policy.enabled() ? run.withRetries() : run.singleAttempt();

            recorder.recordTerminal(terminal);
            metricsRegistry.recordRequest(terminal.status(), run.attempts);
            log.info("Request finished: requestId={}, status={}, attempts={}, channels={}, latencyMs={}",
                    terminal.id(), terminal.status(), run.attempts, run.triedChannels, terminal.metricsLatencyMs());
            return terminal;
        } finally {
            MDC.remove("requestId");
        }
    }

    public Request execute(Request request, RetryPolicy policy, List<Channel> channels, CancellationToken token) {
        return execute(request, policy, channels, token, ChunkListener.NOOP);
    }

    /**
     * Mutable state of one request's attempt loop. Confined to the calling thread.
     */
    private final class Run {
        private final Request request;
        private final RetryPolicy policy;
        private final List<Channel> channels;
        private final CancellationToken token;
        private final ChunkListener listener;
        private final Set<String> exhausted = new HashSet<>();
        private final Set<String> triedChannels = new LinkedHashSet<>();
        private final Set<String> disabled = new HashSet<>();
        private final List<String> errors = new ArrayList<>();
        private int attempts;

        Run(Request request, RetryPolicy policy, List<Channel> channels, CancellationToken token, ChunkListener listener) {
            this.request = request;
            this.policy = policy;
            this.channels = channels;
            this.token = token;
            this.listener = listener;
        }

        Request singleAttempt() {
            if (token.isCancelled()) {
                return canceled();
            }
            Optional<Channel> channel = select(Set.of());
            if (channel.isEmpty()) {
                return noAvailableChannel();
            }

            DispatchResult result = attempt(channel.get());
            if (result.isSuccess()) {
                return completed(result.execution());
            }
            if (result.classification() == ErrorType.CANCELLED) {
                return canceled();
            }
            return failed("Attempt failed, retries disabled");
        }

        Request withRetries() {
            for (int c = 1; c <= policy.maxChannelRetries(); c++) {
                if (token.isCancelled()) {
                    return canceled();
                }

                Optional<Channel> selected = select(exhausted);
                if (selected.isEmpty()) {
                    return noAvailableChannel();
                }
                Channel channel = selected.get();

                for (int s = 1; s <= policy.attemptsPerChannel(); s++) {
                    if (token.isCancelled()) {
                        return canceled();
                    }

                    DispatchResult result = attempt(channel);
                    if (result.isSuccess()) {
                        return completed(result.execution());
                    }

                    ErrorType classification = result.classification();
                    if (classification == ErrorType.CANCELLED) {
                        return canceled();
                    }
                    if (classification.endsRequest()) {
                        return failed("Stream interrupted on channel " + channel.getId());
                    }
                    if (!classification.isRetryable()) {
                        log.warn("Non-retryable failure, switching channel: requestId={}, channelId={}, attempt={}",
                                request.id(), channel.getId(), attempts);
                        break;
                    }
                    if (disabled.contains(channel.getId())) {
                        break;
                    }
                    if (s < policy.attemptsPerChannel() && !awaitRetryDelay()) {
                        return canceled();
                    }
                }
                exhausted.add(channel.getId());
            }
            return failed("All attempts failed");
        }

        private Optional<Channel> select(Set<String> excluded) {
            return loadBalancer.selectChannel(policy.loadBalancerStrategy(), channels, request.modelId(), excluded);
        }

        private boolean awaitRetryDelay() {
            try {
                return retryDelay.await(policy.retryDelayMs(), token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel("interrupted");
                return false;
            }
        }

        private DispatchResult attempt(Channel channel) {
            attempts++;
            triedChannels.add(channel.getId());
            Instant startedAt = Instant.now();

            DispatchResult result;
            try {
                result = dispatcher.dispatch(request, channel, attempts, token, listener);
            } catch (RuntimeException e) {
                log.error("Dispatcher failed unexpectedly: requestId={}, channelId={}, attempt={}",
                        request.id(), channel.getId(), attempts, e);
                result = DispatchResult.failure(request, channel, attempts, startedAt,
                        ErrorType.TRANSIENT_PROVIDER_ERROR, "Dispatcher error: " + e.getMessage());
            }

            if (!result.isSuccess() && token.isCancelled() && result.classification() != ErrorType.CANCELLED) {
                // the failure was caused by the abort
                RequestExecution failed = result.execution();
                result = DispatchResult.failure(request, channel, attempts, failed.createdAt(),
                        failed.responseChunks(), failed.firstChunkAt(), ErrorType.CANCELLED, null);
            }

            RequestExecution execution = result.execution();
            PerformanceMetrics performance = MetricsCalculator.forExecution(execution, request.stream(), result.usage());
            execution = execution.withMetrics(performance.latencyMsOrNull(), performance.firstTokenLatencyMsOrNull());
            result = result.withExecution(execution);

            recorder.recordExecution(execution);
            if (result.usage() != null) {
                usageLogs.save(request.id(), execution.id(), result.usage());
            }
            if (loadBalancer.recordOutcome(channel, execution, policy.autoDisableChannel())) {
                disable(channel, execution.upstreamStatusCode());
            }
            recordMetrics(channel, execution, performance);

            if (execution.status() == ExecutionStatus.FAILED) {
                errors.add(channel.getId() + "#" + attempts + ": " + execution.errorType() + " " + execution.errorMessage());
                log.warn("Attempt failed: requestId={}, channelId={}, attempt={}, errorType={}, error={}",
                        request.id(), channel.getId(), attempts, execution.errorType(), execution.errorMessage());
            } else {
                log.debug("Attempt finished: requestId={}, channelId={}, attempt={}, status={}, latencyMs={}",
                        request.id(), channel.getId(), attempts, execution.status(), execution.metricsLatencyMs());
            }
            return result;
        }

        private void disable(Channel channel, int statusCode) {
            disabled.add(channel.getId());
            log.warn("Auto-disabling channel: requestId={}, channelId={}, status={}",
                    request.id(), channel.getId(), statusCode);
            try {
                channelDisabler.disable(channel, statusCode);
            } catch (RuntimeException e) {
                log.error("Failed to disable channel {}", channel.getId(), e);
            }
        }

        private void recordMetrics(Channel channel, RequestExecution execution, PerformanceMetrics performance) {
            metricsRegistry.recordAttempt(channel.getId(), execution.status(), execution.errorType(),
                    execution.metricsLatencyMs());
            performance.firstTokenLatencyMs()
                    .ifPresent(ttft -> metricsRegistry.recordFirstTokenLatency(channel.getId(), ttft));
            performance.tokensPerSecond()
                    .ifPresent(tps -> metricsRegistry.recordTokensPerSecond(channel.getId(), tps));
        }

        private Request completed(RequestExecution execution) {
            Instant now = Instant.now();
            OptionalLong latency = MetricsCalculator.latencyMs(execution.createdAt(), now);
            OptionalLong ttft = MetricsCalculator.firstTokenLatencyMs(
                    request.stream(), execution.createdAt(), execution.firstChunkAt());
            return request.completed(
                    now,
                    latency.isPresent() ? latency.getAsLong() : null,
                    ttft.isPresent() ? ttft.getAsLong() : null
            );
        }

        private Request canceled() {
            String reason = token.getReason().orElse("canceled");
            log.info("Request canceled: requestId={}, attempts={}, reason={}", request.id(), attempts, reason);
            return request.canceled(Instant.now(), reason);
        }

        private Request noAvailableChannel() {
            log.warn("No available channel: requestId={}, model={}, exhausted={}",
                    request.id(), request.modelId(), exhausted);
            return failed(ErrorType.NO_AVAILABLE_CHANNEL + ": no eligible channel left for model " + request.modelId());
        }

        private Request failed(String headline) {
            StringBuilder summary = new StringBuilder(headline)
                    .append(" (attempts=").append(attempts)
                    .append(", channels=").append(triedChannels).append(')');
            if (!errors.isEmpty()) {
                summary.append("; last error: ").append(errors.get(errors.size() - 1));
            }
            return request.failed(Instant.now(), summary.toString());
        }
    }
}
