package fr.lapetina.llmrelay.infrastructure.persistence;

import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;

/**
 * Durable store for the request audit trail.
 *
 * <p>The coordinator calls {@link #recordExecution} exactly once per attempt and
 * {@link #recordTerminal} exactly once per request, after its last execution.
 */
public interface ExecutionRecorder {

    /**
     * Stores a finished attempt.
     */
    void recordExecution(RequestExecution execution);

    /**
     * Stores the terminal state of a request.
     */
    void recordTerminal(Request request);
}
