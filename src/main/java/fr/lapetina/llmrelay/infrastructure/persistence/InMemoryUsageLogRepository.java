package fr.lapetina.llmrelay.infrastructure.persistence;

import fr.lapetina.llmrelay.domain.model.UsageLog;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryUsageLogRepository implements UsageLogRepository {

    private final Map<String, UsageLog> byExecution = new ConcurrentHashMap<>();
    private final Map<String, UsageLog> byRequest = new ConcurrentHashMap<>();

    @Override
    public void save(String requestId, String executionId, UsageLog usage) {
        byExecution.put(executionId, usage);
        byRequest.put(requestId, usage);
    }

    @Override
    public Optional<UsageLog> findByExecution(String executionId) {
        return Optional.ofNullable(byExecution.get(executionId));
    }

    @Override
    public Optional<UsageLog> findByRequest(String requestId) {
        return Optional.ofNullable(byRequest.get(requestId));
    }
}
