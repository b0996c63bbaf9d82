package fr.lapetina.llmrelay.domain.model;

/**
 * Lifecycle of a single attempt ({@link RequestExecution}).
 */
public enum ExecutionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }
}
