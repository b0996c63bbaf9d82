package fr.lapetina.llmrelay.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One inbound client call. Immutable; every transition returns a new instance.
 *
 * <p>The status only moves forward. Metrics are set only when the request completes,
 * and the error summary only when it fails or is canceled.
 */
public record Request(
        String id,
        RequestSource source,
        String modelId,
        boolean stream,
        String requestBody,
        RequestStatus status,
        Instant createdAt,
        Instant updatedAt,
        Long metricsLatencyMs,
        Long metricsFirstTokenLatencyMs,
        String errorSummary
) {
    public Request {
        Objects.requireNonNull(modelId, "Model ID is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (source == null) {
            source = RequestSource.API;
        }
        if (status == null) {
            status = RequestStatus.PENDING;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (requestBody == null) {
            requestBody = "";
        }
    }

    /**
     * Creates a new pending request.
     */
    public static Request create(RequestSource source, String modelId, boolean stream, String requestBody) {
        return new Request(null, source, modelId, stream, requestBody,
                RequestStatus.PENDING, null, null, null, null, null);
    }

    public static Request create(String modelId, String requestBody) {
        return create(RequestSource.API, modelId, false, requestBody);
    }

    public Request processing(Instant now) {
        requireStatus(RequestStatus.PENDING);
        return new Request(id, source, modelId, stream, requestBody, RequestStatus.PROCESSING,
                createdAt, now, null, null, null);
    }

    public Request completed(Instant now, Long latencyMs, Long firstTokenLatencyMs) {
        requireNotTerminal();
        return new Request(id, source, modelId, stream, requestBody, RequestStatus.COMPLETED,
                createdAt, now, latencyMs, firstTokenLatencyMs, null);
    }

    public Request failed(Instant now, String summary) {
        requireNotTerminal();
        return new Request(id, source, modelId, stream, requestBody, RequestStatus.FAILED,
                createdAt, now, null, null, summary);
    }

    public Request canceled(Instant now, String reason) {
        requireNotTerminal();
        return new Request(id, source, modelId, stream, requestBody, RequestStatus.CANCELED,
                createdAt, now, null, null, reason);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireStatus(RequestStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Request " + id + " is " + status + ", expected " + expected);
        }
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Request " + id + " is already " + status);
        }
    }
}
