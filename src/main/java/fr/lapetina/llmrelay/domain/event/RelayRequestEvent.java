package fr.lapetina.llmrelay.domain.event;

import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.retry.CancellationToken;
import fr.lapetina.llmrelay.retry.ChunkListener;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable and reused across the ring buffer. Handlers must copy what they need before the
 * event leaves the last stage; nothing outside the pipeline may keep a reference to it.
 */
public final class RelayRequestEvent {

    private Request request;
    private CancellationToken token;
    private ChunkListener listener;
    private CompletableFuture<Request> resultFuture;

    private EventState state;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant admittedAt;

    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.token = null;
        this.listener = null;
        this.resultFuture = null;
        this.state = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.admittedAt = null;
        this.sequence = -1;
    }

    public void initialize(
            Request request,
            CancellationToken token,
            ChunkListener listener,
            CompletableFuture<Request> resultFuture
    ) {
        clear();
        this.request = request;
        this.token = token;
        this.listener = listener != null ? listener : ChunkListener.NOOP;
        this.resultFuture = resultFuture;
        this.state = EventState.ACCEPTED;
        this.acceptedAt = Instant.now();
    }

    public Request getRequest() {
        return request;
    }

    public CancellationToken getToken() {
        return token;
    }

    public ChunkListener getListener() {
        return listener;
    }

    public CompletableFuture<Request> getResultFuture() {
        return resultFuture;
    }

    public EventState getState() {
        return state;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getAdmittedAt() {
        return admittedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markAdmitted() {
        this.state = EventState.ADMITTED;
        this.admittedAt = Instant.now();
    }

    public void markHandedOff() {
        this.state = EventState.HANDED_OFF;
    }

    public void reject(EventState state, ErrorType errorType, String message) {
        this.state = state;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * True once a stage has turned the request away.
     */
    public boolean isRejected() {
        return state == EventState.VALIDATION_FAILED || state == EventState.REJECTED;
    }

    @Override
    public String toString() {
        return "RelayRequestEvent{" +
                "requestId=" + (request != null ? request.id() : "null") +
                ", state=" + state +
                ", errorType=" + errorType +
                ", seq=" + sequence +
                '}';
    }
}
