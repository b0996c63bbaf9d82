package fr.lapetina.llmrelay.domain.model;

/**
 * Lifecycle of an inbound {@link Request}.
 *
 * <pre>
 * PENDING -> PROCESSING -> { COMPLETED | FAILED | CANCELED }
 * </pre>
 */
public enum RequestStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }
}
