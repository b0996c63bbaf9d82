package fr.lapetina.llmrelay.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One attempt to fulfil a {@link Request} against one channel.
 *
 * <p>Response chunks are copied into an unmodifiable list, so a terminated execution
 * can never be appended to. An error message and the upstream status code are only carried
 * by failed executions; the status code is null when the failure happened below HTTP.
 */
public record RequestExecution(
        String id,
        String requestId,
        String channelId,
        String modelId,
        int attempt,
        ExecutionStatus status,
        String requestBody,
        String responseBody,
        List<String> responseChunks,
        ErrorType errorType,
        String errorMessage,
        Integer upstreamStatusCode,
        Instant createdAt,
        Instant firstChunkAt,
        Instant updatedAt,
        Long metricsLatencyMs,
        Long metricsFirstTokenLatencyMs
) {
    public RequestExecution {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(channelId, "Channel ID is required");
        Objects.requireNonNull(status, "Status is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        responseChunks = responseChunks != null ? List.copyOf(responseChunks) : List.of();
        if (status != ExecutionStatus.FAILED) {
            errorMessage = null;
            upstreamStatusCode = null;
        }
        if (status == ExecutionStatus.COMPLETED) {
            errorType = null;
        }
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    public boolean isStreamed() {
        return !responseChunks.isEmpty();
    }

    /**
     * Returns a copy carrying the computed attempt metrics.
     */
    public RequestExecution withMetrics(Long latencyMs, Long firstTokenLatencyMs) {
        return new RequestExecution(id, requestId, channelId, modelId, attempt, status, requestBody,
                responseBody, responseChunks, errorType, errorMessage, upstreamStatusCode, createdAt, firstChunkAt,
                updatedAt, latencyMs, firstTokenLatencyMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String requestId;
        private String channelId;
        private String modelId;
        private int attempt = 1;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String requestBody;
        private String responseBody;
        private List<String> responseChunks;
        private ErrorType errorType;
        private String errorMessage;
        private Integer upstreamStatusCode;
        private Instant createdAt;
        private Instant firstChunkAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder request(Request request) {
            this.requestId = request.id();
            this.modelId = request.modelId();
            this.requestBody = request.requestBody();
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder requestBody(String requestBody) {
            this.requestBody = requestBody;
            return this;
        }

        public Builder responseBody(String responseBody) {
            this.responseBody = responseBody;
            return this;
        }

        public Builder responseChunks(List<String> responseChunks) {
            this.responseChunks = responseChunks;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder upstreamStatusCode(Integer upstreamStatusCode) {
            this.upstreamStatusCode = upstreamStatusCode;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder firstChunkAt(Instant firstChunkAt) {
            this.firstChunkAt = firstChunkAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public RequestExecution build() {
            return new RequestExecution(id, requestId, channelId, modelId, attempt, status, requestBody,
                    responseBody, responseChunks, errorType, errorMessage, upstreamStatusCode, createdAt,
                    firstChunkAt, updatedAt, null, null);
        }
    }
}
