package fr.lapetina.llmrelay.infrastructure.persistence;

import fr.lapetina.llmrelay.domain.model.UsageLog;

import java.util.Optional;

/**
 * Token usage keyed by request and execution id.
 */
public interface UsageLogRepository {

    void save(String requestId, String executionId, UsageLog usage);

    Optional<UsageLog> findByExecution(String executionId);

    /**
     * Usage of the latest execution of the request that reported any.
     */
    Optional<UsageLog> findByRequest(String requestId);
}
