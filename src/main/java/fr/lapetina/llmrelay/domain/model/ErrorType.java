package fr.lapetina.llmrelay.domain.model;

/**
 * Error taxonomy for relayed requests and their attempts.
 * The first four values are the classifications a dispatcher may report for one attempt.
 */
public enum ErrorType {
    /** Upstream failed in a way that may succeed on retry (5xx, 429, timeouts, connection resets). */
    TRANSIENT_PROVIDER_ERROR,

    /** Upstream rejected the request (malformed body, authorization failure); do not retry on the same channel. */
    NON_RETRYABLE_PROVIDER_ERROR,

    /** A streamed response broke after chunks were already forwarded to the caller. */
    STREAM_INTERRUPTED,

    /** The request was canceled while the attempt was in flight. */
    CANCELLED,

    /** Every eligible channel was exhausted, or none was enabled. */
    NO_AVAILABLE_CHANNEL,

    /** The inbound request failed intake validation. */
    VALIDATION_ERROR,

    /** Intake refused the request (ring buffer full, in-flight limit reached). */
    CAPACITY_ERROR,

    /** Unexpected failure inside the relay. */
    INTERNAL_ERROR;

    /**
     * Whether the same channel may be tried again after this error.
     */
    public boolean isRetryable() {
        return this == TRANSIENT_PROVIDER_ERROR;
    }

    /**
     * Whether this error ends the request without trying another channel.
     */
    public boolean endsRequest() {
        return this == STREAM_INTERRUPTED || this == CANCELLED;
    }
}
