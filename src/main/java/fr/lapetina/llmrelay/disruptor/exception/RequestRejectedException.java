package fr.lapetina.llmrelay.disruptor.exception;

import fr.lapetina.llmrelay.domain.model.ErrorType;

/**
 * Completes the result future of a request turned away before any attempt was made.
 */
public final class RequestRejectedException extends RuntimeException {

    private final ErrorType errorType;

    public RequestRejectedException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
