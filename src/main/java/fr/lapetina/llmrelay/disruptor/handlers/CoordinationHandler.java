package fr.lapetina.llmrelay.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrelay.disruptor.exception.BackpressureException;
import fr.lapetina.llmrelay.disruptor.exception.RequestRejectedException;
import fr.lapetina.llmrelay.domain.event.EventState;
import fr.lapetina.llmrelay.domain.event.RelayRequestEvent;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;
import fr.lapetina.llmrelay.infrastructure.config.RetryPolicyProvider;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.retry.CancellationToken;
import fr.lapetina.llmrelay.retry.ChunkListener;
import fr.lapetina.llmrelay.retry.RetryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Final stage handler: hands admitted requests to a worker running the attempt loop, and
 * completes the result future of rejected ones.
 *
 * The retry policy and the channel list are read on the worker right before the loop
 * starts, so a request sees one consistent snapshot of both for its whole life.
 */
public final class CoordinationHandler implements EventHandler<RelayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CoordinationHandler.class);

    private final RetryCoordinator coordinator;
    private final RetryPolicyProvider policyProvider;
    private final Supplier<List<Channel>> channels;
    private final AdmissionHandler admissionHandler;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService workers;
    private final Consumer<String> onFinished;

    public CoordinationHandler(
            RetryCoordinator coordinator,
            RetryPolicyProvider policyProvider,
            Supplier<List<Channel>> channels,
            AdmissionHandler admissionHandler,
            MetricsRegistry metricsRegistry,
            ExecutorService workers,
            Consumer<String> onFinished
    ) {
        this.coordinator = coordinator;
        this.policyProvider = policyProvider;
        this.channels = channels;
        this.admissionHandler = admissionHandler;
        this.metricsRegistry = metricsRegistry;
        this.workers = workers;
        this.onFinished = onFinished;
    }

    @Override
    public void onEvent(RelayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.isRejected()) {
            completeRejected(event);
        } else if (event.getState() == EventState.ADMITTED) {
            handOff(event);
        } else {
            log.error("Unexpected event state at coordination: {}", event);
            finish(event.getRequest().id(), event.getResultFuture(),
                    new IllegalStateException("Unexpected event state: " + event.getState()));
        }
        event.clear();
    }

    private void completeRejected(RelayRequestEvent event) {
        metricsRegistry.incrementRejected(event.getErrorType());
        RuntimeException error = event.getErrorType() == ErrorType.CAPACITY_ERROR
                ? new BackpressureException(BackpressureException.BackpressureReason.GLOBAL_LIMIT_REACHED,
                        event.getErrorMessage())
                : new RequestRejectedException(event.getErrorType(), event.getErrorMessage());
        finish(event.getRequest() != null ? event.getRequest().id() : null, event.getResultFuture(), error);
    }

    private void handOff(RelayRequestEvent event) {
        Request request = event.getRequest();
        CancellationToken token = event.getToken();
        ChunkListener listener = event.getListener();
        CompletableFuture<Request> future = event.getResultFuture();
        event.markHandedOff();

        try {
            workers.execute(() -> run(request, token, listener, future));
        } catch (RejectedExecutionException e) {
            admissionHandler.releaseSlot();
            log.warn("Worker pool refused request: requestId={}", request.id());
            finish(request.id(), future, new BackpressureException(
                    BackpressureException.BackpressureReason.SHUTTING_DOWN, e.getMessage()));
        }
    }

    private void run(Request request, CancellationToken token, ChunkListener listener,
                     CompletableFuture<Request> future) {
        try {
            RetryPolicy policy = policyProvider.snapshot();
            Request terminal = coordinator.execute(request, policy, channels.get(), token, listener);
            future.complete(terminal);
        } catch (RuntimeException e) {
            log.error("Attempt loop failed: requestId={}", request.id(), e);
            future.completeExceptionally(e);
        } finally {
            admissionHandler.releaseSlot();
            onFinished.accept(request.id());
        }
    }

    private void finish(String requestId, CompletableFuture<Request> future, Throwable error) {
        if (future != null) {
            future.completeExceptionally(error);
        }
        if (requestId != null) {
            onFinished.accept(requestId);
        }
    }
}
