package fr.lapetina.llmrelay.retry;

import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.ExecutionStatus;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import fr.lapetina.llmrelay.domain.model.UsageLog;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one dispatch.
 *
 * @param execution      the terminal execution of the attempt
 * @param classification error classification, null on success
 * @param usage          token usage reported by the upstream, null when unknown
 */
public record DispatchResult(
        RequestExecution execution,
        ErrorType classification,
        UsageLog usage
) {
    public DispatchResult {
        Objects.requireNonNull(execution, "Execution is required");
    }

    public boolean isSuccess() {
        return classification == null && execution.isSuccess();
    }

    public DispatchResult withExecution(RequestExecution replacement) {
        return new DispatchResult(replacement, classification, usage);
    }

    public static DispatchResult success(RequestExecution execution, UsageLog usage) {
        return new DispatchResult(execution, null, usage);
    }

    /**
     * Builds a failed (or canceled, for {@link ErrorType#CANCELLED}) result without a response.
     */
    public static DispatchResult failure(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            List<String> chunks,
            Instant firstChunkAt,
            ErrorType errorType,
            String errorMessage
    ) {
        return build(request, channel, attempt, startedAt, chunks, firstChunkAt, errorType, errorMessage, null);
    }

    public static DispatchResult failure(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            ErrorType errorType,
            String errorMessage
    ) {
        return failure(request, channel, attempt, startedAt, List.of(), null, errorType, errorMessage);
    }

    /**
     * Builds a failed result for an upstream error response, keeping its HTTP status code.
     */
    public static DispatchResult httpFailure(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            int statusCode,
            ErrorType errorType,
            String errorMessage
    ) {
        return build(request, channel, attempt, startedAt, List.of(), null, errorType, errorMessage, statusCode);
    }

    private static DispatchResult build(
            Request request,
            Channel channel,
            int attempt,
            Instant startedAt,
            List<String> chunks,
            Instant firstChunkAt,
            ErrorType errorType,
            String errorMessage,
            Integer statusCode
    ) {
        RequestExecution execution = RequestExecution.builder()
                .request(request)
                .channelId(channel.getId())
                .attempt(attempt)
                .status(errorType == ErrorType.CANCELLED ? ExecutionStatus.CANCELED : ExecutionStatus.FAILED)
                .responseChunks(chunks)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .upstreamStatusCode(statusCode)
                .createdAt(startedAt)
                .firstChunkAt(firstChunkAt)
                .updatedAt(Instant.now())
                .build();
        return new DispatchResult(execution, errorType, null);
    }
}
