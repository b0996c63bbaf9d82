package fr.lapetina.llmrelay.disruptor.exception;

/**
 * Thrown when the relay cannot take more work.
 *
 * This occurs when the ring buffer has no free slot, or when the global in-flight limit
 * is reached by the time the request reaches admission.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        GLOBAL_LIMIT_REACHED("Global in-flight request limit reached"),
        SHUTTING_DOWN("Relay is shutting down");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
