package fr.lapetina.llmrelay.infrastructure.persistence;

import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the audit trail, used by the presentation layer.
 */
public interface RequestRepository {

    Optional<Request> findRequest(String requestId);

    /**
     * Executions of a request, in attempt order.
     */
    List<RequestExecution> findExecutions(String requestId);

    /**
     * Most recent terminal requests first.
     */
    List<Request> findRecent(int limit);
}
