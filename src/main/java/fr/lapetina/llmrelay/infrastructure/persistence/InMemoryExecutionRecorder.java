package fr.lapetina.llmrelay.infrastructure.persistence;

import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-backed audit trail for standalone deployments and tests.
 *
 * Executions are append-only. A request's terminal state can only be written once;
 * a second write is rejected.
 */
public final class InMemoryExecutionRecorder implements ExecutionRecorder, RequestRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionRecorder.class);

    private final Map<String, Request> requests = new ConcurrentHashMap<>();
    private final Map<String, List<RequestExecution>> executions = new ConcurrentHashMap<>();

    @Override
    public void recordExecution(RequestExecution execution) {
        if (!execution.status().isTerminal()) {
            throw new IllegalArgumentException("Execution is not terminal: " + execution.id());
        }
        executions.computeIfAbsent(execution.requestId(), id -> new CopyOnWriteArrayList<>()).add(execution);
        log.debug("Execution recorded: requestId={}, executionId={}, channelId={}, status={}",
                execution.requestId(), execution.id(), execution.channelId(), execution.status());
    }

    @Override
    public void recordTerminal(Request request) {
        if (!request.isTerminal()) {
            throw new IllegalArgumentException("Request is not terminal: " + request.id());
        }
        Request previous = requests.putIfAbsent(request.id(), request);
        if (previous != null) {
            throw new IllegalStateException("Terminal state already recorded for request " + request.id());
        }
        log.debug("Request recorded: requestId={}, status={}", request.id(), request.status());
    }

    @Override
    public Optional<Request> findRequest(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public List<RequestExecution> findExecutions(String requestId) {
        List<RequestExecution> list = executions.get(requestId);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public List<Request> findRecent(int limit) {
        List<Request> all = new ArrayList<>(requests.values());
        all.sort(Comparator.comparing(Request::updatedAt).reversed());
        return all.subList(0, Math.min(limit, all.size()));
    }

    public int executionCount() {
        return executions.values().stream().mapToInt(List::size).sum();
    }
}
