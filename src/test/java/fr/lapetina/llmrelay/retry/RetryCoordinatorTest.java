package fr.lapetina.llmrelay.retry;

import fr.lapetina.llmrelay.domain.model.AutoDisablePolicy;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.ExecutionStatus;
import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.RequestStatus;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;
import fr.lapetina.llmrelay.domain.model.UsageLog;
import fr.lapetina.llmrelay.domain.strategy.LoadBalancer;
import fr.lapetina.llmrelay.domain.strategy.StrategySettings;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.infrastructure.persistence.ExecutionRecorder;
import fr.lapetina.llmrelay.infrastructure.persistence.InMemoryExecutionRecorder;
import fr.lapetina.llmrelay.infrastructure.persistence.InMemoryUsageLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RetryCoordinatorTest {

    private static final String MODEL = "gpt-4o";

    private InMemoryExecutionRecorder store;
    private InMemoryUsageLogRepository usageLogs;
    private ScriptedDispatcher dispatcher;
    private RecordingDelay delay;
    private CancellationToken token;
    private Consumer<RequestExecution> onRecorded;
    private List<String> disabledChannels;
    private RetryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionRecorder();
        usageLogs = new InMemoryUsageLogRepository();
        dispatcher = new ScriptedDispatcher();
        delay = new RecordingDelay();
        token = new CancellationToken();
        onRecorded = execution -> { };
        disabledChannels = new ArrayList<>();

        ExecutionRecorder recorder = new ExecutionRecorder() {
            @Override
            public void recordExecution(RequestExecution execution) {
                store.recordExecution(execution);
                onRecorded.accept(execution);
            }

            @Override
            public void recordTerminal(Request request) {
                store.recordTerminal(request);
            }
        };

        coordinator = new RetryCoordinator(
                new LoadBalancer(new StrategySettings(42L, 7L, 0.1, 0.3, 0.01)),
                dispatcher,
                recorder,
                usageLogs,
                new MetricsRegistry("test", new SimpleMeterRegistry()),
                delay,
                (channel, statusCode) -> disabledChannels.add(channel.getId() + ":" + statusCode)
        );
    }

    private static Channel channel(String id, double weight) {
        return Channel.builder()
                .id(id)
                .baseUrl("http://localhost:8000/" + id)
                .models(Set.of(MODEL))
                .weight(weight)
                .build();
    }

    private static RetryPolicy policy(int maxChannelRetries, int maxSingleChannelRetries, long retryDelayMs) {
        return new RetryPolicy(true, maxChannelRetries, maxSingleChannelRetries, retryDelayMs,
                LoadBalancerStrategyType.WEIGHTED);
    }

    private static RetryPolicy autoDisabling(RetryPolicy policy, int status, int times) {
        return policy.withAutoDisableChannel(
                new AutoDisablePolicy(true, List.of(new AutoDisablePolicy.StatusThreshold(status, times))));
    }

    private Request run(RetryPolicy policy, List<Channel> channels) {
        return coordinator.execute(Request.create(MODEL, "{\"model\":\"gpt-4o\"}"), policy, channels, token);
    }

    private List<RequestExecution> executionsOf(Request request) {
        return store.findExecutions(request.id());
    }

    @Nested
    @DisplayName("Retry loop")
    class RetryLoopTests {

        @Test
        @DisplayName("should make every allowed attempt when all channels keep failing transiently")
        void shouldExhaustAllChannels() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            List<Channel> channels = List.of(channel("a", 1), channel("b", 1), channel("c", 1));

            Request result = run(policy(3, 2, 1000), channels);

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            List<RequestExecution> executions = executionsOf(result);
            assertThat(executions).hasSize(9);
            assertThat(executions).allMatch(e -> e.status() == ExecutionStatus.FAILED);
            assertThat(executions).extracting(RequestExecution::attempt)
                    .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9);
            assertThat(executions).extracting(RequestExecution::channelId)
                    .containsOnly("a", "b", "c");
            assertThat(delay.delays).hasSize(6).containsOnly(1000L);
        }

        @Test
        @DisplayName("should retry the same channel after a transient failure and complete")
        void shouldRetrySameChannel() {
            dispatcher.script("a", ErrorType.TRANSIENT_PROVIDER_ERROR, null);

            Request result = run(policy(3, 2, 1000), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.COMPLETED);
            assertThat(result.metricsLatencyMs()).isNotNull();
            assertThat(result.errorSummary()).isNull();
            assertThat(executionsOf(result))
                    .extracting(RequestExecution::channelId, RequestExecution::status)
                    .containsExactly(
                            tuple("a", ExecutionStatus.FAILED),
                            tuple("a", ExecutionStatus.COMPLETED)
                    );
            assertThat(delay.delays).containsExactly(1000L);
        }

        @Test
        @DisplayName("should switch channel right after a non-retryable failure")
        void shouldSwitchChannelOnNonRetryable() {
            dispatcher.script("a", ErrorType.NON_RETRYABLE_PROVIDER_ERROR);
            // weight 0 keeps b out of the draw while a is eligible
            List<Channel> channels = List.of(channel("a", 1), channel("b", 0));

            Request result = run(policy(3, 2, 1000), channels);

            assertThat(result.status()).isEqualTo(RequestStatus.COMPLETED);
            List<RequestExecution> executions = executionsOf(result);
            assertThat(executions).extracting(RequestExecution::channelId).containsExactly("a", "b");
            assertThat(executions.get(0).errorType()).isEqualTo(ErrorType.NON_RETRYABLE_PROVIDER_ERROR);
            assertThat(delay.delays).isEmpty();
        }

        @Test
        @DisplayName("should never retry a channel that failed non-retryably")
        void shouldNotRetryNonRetryableChannel() {
            dispatcher.failByDefault(ErrorType.NON_RETRYABLE_PROVIDER_ERROR);
            List<Channel> channels = List.of(channel("a", 1), channel("b", 1), channel("c", 1));

            Request result = run(policy(3, 2, 10), channels);

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(executionsOf(result)).extracting(RequestExecution::channelId)
                    .containsExactlyInAnyOrder("a", "b", "c");
        }

        @Test
        @DisplayName("should stay within the attempt bound for any policy")
        void shouldRespectAttemptBound() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            List<Channel> channels = List.of(channel("a", 1), channel("b", 2), channel("c", 3), channel("d", 1));

            for (int channelRetries = 0; channelRetries <= 5; channelRetries++) {
                for (int singleRetries = 0; singleRetries <= 3; singleRetries++) {
                    RetryPolicy policy = policy(channelRetries, singleRetries, 0);
                    Request result = run(policy, channels);

                    int expected = Math.min(channelRetries, channels.size()) * policy.attemptsPerChannel();
                    assertThat(executionsOf(result))
                            .hasSize(expected)
                            .hasSizeLessThanOrEqualTo(policy.maxAttempts());
                    assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
                }
            }
        }

        @Test
        @DisplayName("should fail without attempts when no channel retry is allowed")
        void shouldFailWithZeroChannelRetries() {
            Request result = run(policy(0, 2, 10), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(executionsOf(result)).isEmpty();
            assertThat(dispatcher.calls).isEmpty();
        }

        @Test
        @DisplayName("should end the request when a stream breaks mid-response")
        void shouldStopOnStreamInterruption() {
            dispatcher.failByDefault(ErrorType.STREAM_INTERRUPTED);

            Request result = run(policy(3, 2, 10), List.of(channel("a", 1), channel("b", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(result.errorSummary()).startsWith("Stream interrupted");
            assertThat(executionsOf(result)).hasSize(1);
        }

        @Test
        @DisplayName("should retry the same channel after an unexpected dispatcher exception")
        void shouldClassifyDispatcherException() {
            dispatcher.throwOnce("a");
            List<Channel> channels = List.of(channel("a", 1), channel("b", 0));

            Request result = run(policy(3, 2, 10), channels);

            assertThat(result.status()).isEqualTo(RequestStatus.COMPLETED);
            List<RequestExecution> executions = executionsOf(result);
            assertThat(executions)
                    .extracting(RequestExecution::channelId, RequestExecution::status)
                    .containsExactly(tuple("a", ExecutionStatus.FAILED), tuple("a", ExecutionStatus.COMPLETED));
            assertThat(executions.get(0).errorType()).isEqualTo(ErrorType.TRANSIENT_PROVIDER_ERROR);
            assertThat(executions.get(0).errorMessage()).contains("upstream client exploded");
            assertThat(delay.delays).containsExactly(10L);
        }

        @Test
        @DisplayName("should persist usage reported by a successful attempt")
        void shouldPersistUsage() {
            Request result = run(policy(3, 2, 10), List.of(channel("a", 1)));

            RequestExecution execution = executionsOf(result).get(0);
            assertThat(usageLogs.findByExecution(execution.id())).hasValue(UsageLog.of(12, 34));
            assertThat(usageLogs.findByRequest(result.id())).hasValue(UsageLog.of(12, 34));
        }

        @Test
        @DisplayName("should record the terminal request exactly once")
        void shouldRecordTerminalOnce() {
            dispatcher.script("a", ErrorType.TRANSIENT_PROVIDER_ERROR, ErrorType.TRANSIENT_PROVIDER_ERROR, null);

            Request result = run(policy(3, 2, 10), List.of(channel("a", 1)));

            assertThat(store.findRequest(result.id())).hasValue(result);
            assertThat(store.findRecent(10)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Auto-disable")
    class AutoDisableTests {

        @Test
        @DisplayName("should disable a channel at its status threshold and stop retrying it")
        void shouldDisableAtThreshold() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            dispatcher.answerStatus("a", 500);

            Request result = run(autoDisabling(policy(2, 3, 10), 500, 2), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(result.errorSummary()).startsWith("NO_AVAILABLE_CHANNEL");
            assertThat(dispatcher.calls).containsExactly("a", "a");
            assertThat(disabledChannels).containsExactly("a:500");
            assertThat(delay.delays).containsExactly(10L);
            assertThat(executionsOf(result)).extracting(RequestExecution::upstreamStatusCode)
                    .containsExactly(500, 500);
        }

        @Test
        @DisplayName("should start counting again after a success on the channel")
        void shouldResetCountOnSuccess() {
            Channel a = channel("a", 1);
            RetryPolicy policy = autoDisabling(policy(1, 3, 10), 500, 2);
            dispatcher.answerStatus("a", 500);

            dispatcher.script("a", ErrorType.TRANSIENT_PROVIDER_ERROR, null);
            assertThat(run(policy, List.of(a)).status()).isEqualTo(RequestStatus.COMPLETED);
            dispatcher.script("a", ErrorType.TRANSIENT_PROVIDER_ERROR, null);
            assertThat(run(policy, List.of(a)).status()).isEqualTo(RequestStatus.COMPLETED);

            assertThat(disabledChannels).isEmpty();
            assertThat(a.getHealth().getErrorStatusCount(500)).isZero();
        }

        @Test
        @DisplayName("should leave channels alone when the policy is off")
        void shouldIgnoreStatusesWhenOff() {
            dispatcher.failByDefault(ErrorType.NON_RETRYABLE_PROVIDER_ERROR);
            dispatcher.answerStatus("a", 401);

            Request result = run(policy(1, 3, 10), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(disabledChannels).isEmpty();
        }
    }

    @Nested
    @DisplayName("No available channel")
    class NoAvailableChannelTests {

        @Test
        @DisplayName("should fail immediately when no channel is enabled")
        void shouldFailWithoutChannels() {
            Request result = run(policy(3, 2, 10), List.of());

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(result.errorSummary()).startsWith("NO_AVAILABLE_CHANNEL");
            assertThat(executionsOf(result)).isEmpty();
        }

        @Test
        @DisplayName("should stop early once every channel is exhausted")
        void shouldStopWhenChannelsRunOut() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);

            Request result = run(policy(5, 1, 0), List.of(channel("a", 1), channel("b", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(result.errorSummary()).startsWith("NO_AVAILABLE_CHANNEL");
            assertThat(executionsOf(result)).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Retries disabled")
    class DisabledTests {

        @Test
        @DisplayName("should make exactly one attempt when it fails")
        void shouldMakeOneAttemptOnFailure() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            RetryPolicy policy = policy(3, 2, 10).withEnabled(false);

            Request result = run(policy, List.of(channel("a", 1), channel("b", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.FAILED);
            assertThat(executionsOf(result)).hasSize(1);
            assertThat(delay.delays).isEmpty();
        }

        @Test
        @DisplayName("should make exactly one attempt when it succeeds")
        void shouldMakeOneAttemptOnSuccess() {
            RetryPolicy policy = new RetryPolicy(false, 0, 0, 0, LoadBalancerStrategyType.ADAPTIVE);

            Request result = run(policy, List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.COMPLETED);
            assertThat(executionsOf(result)).hasSize(1);
        }

        @Test
        @DisplayName("should make one attempt regardless of channel health")
        void shouldIgnoreChannelHealth() {
            Channel broken = channel("a", 1);
            for (int i = 0; i < 20; i++) {
                broken.getHealth().recordFailure();
            }
            dispatcher.failByDefault(ErrorType.NON_RETRYABLE_PROVIDER_ERROR);

            Request result = run(policy(3, 2, 10).withEnabled(false), List.of(broken));

            assertThat(executionsOf(result)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("should not start any attempt when canceled before start")
        void shouldCancelBeforeStart() {
            token.cancel("client gone");

            Request result = run(policy(3, 2, 10), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.CANCELED);
            assertThat(result.errorSummary()).isEqualTo("client gone");
            assertThat(executionsOf(result)).isEmpty();
            assertThat(dispatcher.calls).isEmpty();
        }

        @Test
        @DisplayName("should not create another execution once cancellation is observed")
        void shouldStopAfterFirstExecution() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            onRecorded = execution -> token.cancel("user");

            Request result = run(policy(3, 2, 1000),
                    List.of(channel("a", 1), channel("b", 1), channel("c", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.CANCELED);
            List<RequestExecution> executions = executionsOf(result);
            assertThat(executions).hasSize(1);
            assertThat(executions.get(0).status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(dispatcher.calls).hasSize(1);
        }

        @Test
        @DisplayName("should record an aborted attempt as canceled")
        void shouldRecordAbortedAttemptAsCanceled() {
            dispatcher.onDispatch = t -> t.cancel("user");
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);

            Request result = run(policy(3, 2, 10), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.CANCELED);
            List<RequestExecution> executions = executionsOf(result);
            assertThat(executions).hasSize(1);
            assertThat(executions.get(0).status()).isEqualTo(ExecutionStatus.CANCELED);
            assertThat(executions.get(0).errorType()).isEqualTo(ErrorType.CANCELLED);
        }

        @Test
        @DisplayName("should stop when canceled during the retry delay")
        void shouldCancelDuringDelay() {
            dispatcher.failByDefault(ErrorType.TRANSIENT_PROVIDER_ERROR);
            delay.onAwait = t -> t.cancel("user");

            Request result = run(policy(3, 2, 1000), List.of(channel("a", 1)));

            assertThat(result.status()).isEqualTo(RequestStatus.CANCELED);
            assertThat(executionsOf(result)).hasSize(1);
        }

        @Test
        @DisplayName("should keep canceled attempts out of channel health")
        void shouldNotCountCanceledAttempts() {
            Channel channel = channel("a", 1);
            dispatcher.onDispatch = t -> t.cancel("user");
            dispatcher.failByDefault(ErrorType.CANCELLED);

            run(policy(3, 2, 10), List.of(channel));

            assertThat(channel.getHealth().snapshot().total()).isZero();
        }
    }

    /**
     * Dispatcher replaying a per-channel script of outcomes. A null entry is a success.
     */
    static final class ScriptedDispatcher implements Dispatcher {

        final List<String> calls = new CopyOnWriteArrayList<>();
        private final Map<String, Deque<Optional<ErrorType>>> scripts = new HashMap<>();
        private final Set<String> throwing = new HashSet<>();
        private final Map<String, Integer> statusCodes = new HashMap<>();
        private ErrorType defaultOutcome;
        Consumer<CancellationToken> onDispatch = t -> { };

        void script(String channelId, ErrorType... outcomes) {
            Deque<Optional<ErrorType>> queue = new ArrayDeque<>();
            for (ErrorType outcome : outcomes) {
                queue.add(Optional.ofNullable(outcome));
            }
            scripts.put(channelId, queue);
        }

        void failByDefault(ErrorType errorType) {
            this.defaultOutcome = errorType;
        }

        void answerStatus(String channelId, int statusCode) {
            statusCodes.put(channelId, statusCode);
        }

        void throwOnce(String channelId) {
            throwing.add(channelId);
        }

        @Override
        public DispatchResult dispatch(Request request, Channel channel, int attempt,
                                       CancellationToken token, ChunkListener listener) {
            calls.add(channel.getId());
            Instant startedAt = Instant.now();
            onDispatch.accept(token);
            if (throwing.remove(channel.getId())) {
                throw new IllegalStateException("upstream client exploded");
            }

            Deque<Optional<ErrorType>> script = scripts.get(channel.getId());
            ErrorType outcome = script != null && !script.isEmpty() ? script.poll().orElse(null) : defaultOutcome;
            if (outcome == null) {
                listener.onChunk("data: {\"ok\":true}");
                RequestExecution execution = RequestExecution.builder()
                        .request(request)
                        .channelId(channel.getId())
                        .attempt(attempt)
                        .status(ExecutionStatus.COMPLETED)
                        .responseBody("{\"choices\":[]}")
                        .createdAt(startedAt)
                        .updatedAt(Instant.now())
                        .build();
                return DispatchResult.success(execution, UsageLog.of(12, 34));
            }
            Integer statusCode = statusCodes.get(channel.getId());
            if (statusCode != null) {
                return DispatchResult.httpFailure(request, channel, attempt, startedAt, statusCode, outcome,
                        "HTTP " + statusCode);
            }
            return DispatchResult.failure(request, channel, attempt, startedAt, outcome, "scripted " + outcome);
        }
    }

    static final class RecordingDelay implements RetryDelay {

        final List<Long> delays = new ArrayList<>();
        Consumer<CancellationToken> onAwait = t -> { };

        @Override
        public boolean await(long delayMs, CancellationToken token) {
            delays.add(delayMs);
            onAwait.accept(token);
            return !token.isCancelled();
        }
    }
}
