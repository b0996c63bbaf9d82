package fr.lapetina.llmrelay.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmrelay.domain.metrics.MetricsCalculator;
import fr.lapetina.llmrelay.domain.metrics.PerformanceMetrics;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.UsageLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Read view of a request: its terminal state, every attempt, and the derived metrics.
 * Request and response bodies are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestView {

    private String id;
    private String source;

    @JsonProperty("model_id")
    private String modelId;

    private boolean stream;
    private String status;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("latency_ms")
    private Long latencyMs;

    @JsonProperty("first_token_latency_ms")
    private Long firstTokenLatencyMs;

    @JsonProperty("tokens_per_second")
    private Double tokensPerSecond;

    @JsonProperty("error_summary")
    private String errorSummary;

    private UsageView usage;

    private List<ExecutionView> executions = new ArrayList<>();

    /**
     * Builds the view.
     *
     * @param usageByExecution usage of an execution id, or null when none was reported
     */
    public static RequestView from(
            Request request,
            List<RequestExecution> executions,
            Function<String, UsageLog> usageByExecution
    ) {
        RequestView view = new RequestView();
        view.id = request.id();
        view.source = request.source().value();
        view.modelId = request.modelId();
        view.stream = request.stream();
        view.status = request.status().name();
        view.createdAt = request.createdAt();
        view.updatedAt = request.updatedAt();
        view.latencyMs = request.metricsLatencyMs();
        view.firstTokenLatencyMs = request.metricsFirstTokenLatencyMs();
        view.errorSummary = request.errorSummary();

        for (RequestExecution execution : executions) {
            UsageLog usage = usageByExecution.apply(execution.id());
            view.executions.add(ExecutionView.from(execution, request.stream(), usage));

            if (execution.isSuccess() && request.isTerminal()) {
                view.usage = usage != null ? UsageView.from(usage) : null;
                PerformanceMetrics metrics = MetricsCalculator.forRequest(request, execution, usage);
                view.tokensPerSecond = metrics.tokensPerSecondOrNull();
            }
        }
        return view;
    }

    public String getId() { return id; }
    public String getSource() { return source; }
    public String getModelId() { return modelId; }
    public boolean isStream() { return stream; }
    public String getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getLatencyMs() { return latencyMs; }
    public Long getFirstTokenLatencyMs() { return firstTokenLatencyMs; }
    public Double getTokensPerSecond() { return tokensPerSecond; }
    public String getErrorSummary() { return errorSummary; }
    public UsageView getUsage() { return usage; }
    public List<ExecutionView> getExecutions() { return executions; }

    /**
     * One attempt of the request.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExecutionView {

        private String id;

        @JsonProperty("channel_id")
        private String channelId;

        private int attempt;
        private String status;

        @JsonProperty("error_type")
        private String errorType;

        @JsonProperty("error_message")
        private String errorMessage;

        @JsonProperty("chunk_count")
        private int chunkCount;

        @JsonProperty("created_at")
        private Instant createdAt;

        @JsonProperty("updated_at")
        private Instant updatedAt;

        @JsonProperty("latency_ms")
        private Long latencyMs;

        @JsonProperty("first_token_latency_ms")
        private Long firstTokenLatencyMs;

        @JsonProperty("tokens_per_second")
        private Double tokensPerSecond;

        private UsageView usage;

        static ExecutionView from(RequestExecution execution, boolean stream, UsageLog usage) {
            ExecutionView view = new ExecutionView();
            view.id = execution.id();
            view.channelId = execution.channelId();
            view.attempt = execution.attempt();
            view.status = execution.status().name();
            view.errorType = execution.errorType() != null ? execution.errorType().name() : null;
            view.errorMessage = execution.errorMessage();
            view.chunkCount = execution.responseChunks().size();
            view.createdAt = execution.createdAt();
            view.updatedAt = execution.updatedAt();
            view.latencyMs = execution.metricsLatencyMs();
            view.firstTokenLatencyMs = execution.metricsFirstTokenLatencyMs();
            view.usage = usage != null ? UsageView.from(usage) : null;
            if (usage != null) {
                view.tokensPerSecond = MetricsCalculator.forExecution(execution, stream, usage).tokensPerSecondOrNull();
            }
            return view;
        }

        public String getId() { return id; }
        public String getChannelId() { return channelId; }
        public int getAttempt() { return attempt; }
        public String getStatus() { return status; }
        public String getErrorType() { return errorType; }
        public String getErrorMessage() { return errorMessage; }
        public int getChunkCount() { return chunkCount; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
        public Long getLatencyMs() { return latencyMs; }
        public Long getFirstTokenLatencyMs() { return firstTokenLatencyMs; }
        public Double getTokensPerSecond() { return tokensPerSecond; }
        public UsageView getUsage() { return usage; }
    }

    /**
     * Token usage in OpenAI field names.
     */
    public static class UsageView {

        @JsonProperty("prompt_tokens")
        private long promptTokens;

        @JsonProperty("completion_tokens")
        private long completionTokens;

        @JsonProperty("reasoning_tokens")
        private long reasoningTokens;

        @JsonProperty("audio_tokens")
        private long audioTokens;

        @JsonProperty("total_tokens")
        private long totalTokens;

        static UsageView from(UsageLog usage) {
            UsageView view = new UsageView();
            view.promptTokens = usage.promptTokens();
            view.completionTokens = usage.completionTokens();
            view.reasoningTokens = usage.completionReasoningTokens();
            view.audioTokens = usage.completionAudioTokens();
            view.totalTokens = usage.totalTokens();
            return view;
        }

        public long getPromptTokens() { return promptTokens; }
        public long getCompletionTokens() { return completionTokens; }
        public long getReasoningTokens() { return reasoningTokens; }
        public long getAudioTokens() { return audioTokens; }
        public long getTotalTokens() { return totalTokens; }
    }
}
