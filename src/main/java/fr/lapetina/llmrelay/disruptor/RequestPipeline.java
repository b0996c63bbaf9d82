package fr.lapetina.llmrelay.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llmrelay.disruptor.exception.BackpressureException;
import fr.lapetina.llmrelay.disruptor.handlers.AdmissionHandler;
import fr.lapetina.llmrelay.disruptor.handlers.CoordinationHandler;
import fr.lapetina.llmrelay.disruptor.handlers.ValidationHandler;
import fr.lapetina.llmrelay.domain.event.RelayRequestEvent;
import fr.lapetina.llmrelay.domain.event.RelayRequestEventFactory;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.Request;
import fr.lapetina.llmrelay.infrastructure.config.RelayConfig;
import fr.lapetina.llmrelay.infrastructure.config.RetryPolicyProvider;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.retry.CancellationToken;
import fr.lapetina.llmrelay.retry.ChunkListener;
import fr.lapetina.llmrelay.retry.RetryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Request intake built on an LMAX Disruptor ring buffer.
 *
 * <p>HTTP threads publish requests concurrently ({@link ProducerType#MULTI}). The handler
 * chain is Validation -> Admission -> Coordination. The last stage hands each admitted
 * request to a worker of a fixed pool, where the {@link RetryCoordinator} runs its attempt
 * loop; the Disruptor threads never block on upstream calls.
 *
 * <p>Backpressure: a full ring buffer makes {@link #submit} throw a
 * {@link BackpressureException} immediately; a full global in-flight budget completes the
 * returned future with one.
 *
 * <p>Cancellation: every submitted request keeps its {@link CancellationToken} registered
 * until it is terminal, so {@link #cancel(String, String)} reaches it whether it is still
 * queued, waiting for a retry, or streaming.
 */
public final class RequestPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Disruptor<RelayRequestEvent> disruptor;
    private final RingBuffer<RelayRequestEvent> ringBuffer;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    private final ValidationHandler validationHandler;
    private final AdmissionHandler admissionHandler;
    private final CoordinationHandler coordinationHandler;
    private final MetricsRegistry metricsRegistry;

    private RequestPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.workers = Executors.newFixedThreadPool(builder.workerThreads, new NamedThreadFactory("relay-worker"));

        this.disruptor = new Disruptor<>(
                new RelayRequestEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("disruptor-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        this.validationHandler = new ValidationHandler(builder.allowedModels, builder.maxBodyBytes);
        this.admissionHandler = new AdmissionHandler(builder.maxGlobalInFlight, builder.metricsRegistry);
        this.coordinationHandler = new CoordinationHandler(
                builder.coordinator,
                builder.policyProvider,
                builder.channels,
                admissionHandler,
                builder.metricsRegistry,
                workers,
                inFlight::remove
        );

        disruptor
                .handleEventsWith(validationHandler)
                .then(admissionHandler)
                .then(coordinationHandler);
        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler(inFlight));

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RequestPipeline created: ringBufferSize={}, waitStrategy={}, maxGlobalInFlight={}, workerThreads={}",
                builder.ringBufferSize, builder.waitStrategy, builder.maxGlobalInFlight, builder.workerThreads);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RequestPipeline started");
        }
    }

    /**
     * Submits a pending request.
     *
     * @param request  pending request
     * @param token    cancellation signal of the request
     * @param listener receives streamed chunks, may be null
     * @return future completed with the terminal request
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalArgumentException if a request with the same id is still in flight
     */
    public CompletableFuture<Request> submit(Request request, CancellationToken token, ChunkListener listener) {
        if (!running.get()) {
            CompletableFuture<Request> future = new CompletableFuture<>();
            future.completeExceptionally(new IllegalStateException("Pipeline not running"));
            return future;
        }
        if (inFlight.putIfAbsent(request.id(), token) != null) {
            throw new IllegalArgumentException("Request already in flight: " + request.id());
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            inFlight.remove(request.id());
            metricsRegistry.incrementRejected(ErrorType.CAPACITY_ERROR);
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        CompletableFuture<Request> future = new CompletableFuture<>();
        try {
            ringBuffer.get(sequence).initialize(request, token, listener, future);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Request submitted: requestId={}, sequence={}", request.id(), sequence);
        return future;
    }

    public CompletableFuture<Request> submit(Request request, CancellationToken token) {
        return submit(request, token, ChunkListener.NOOP);
    }

    public CompletableFuture<Request> submit(Request request) {
        return submit(request, new CancellationToken(), ChunkListener.NOOP);
    }

    /**
     * Cancels a request that is not terminal yet.
     *
     * @return true if the request was in flight and this call cancelled it
     */
    public boolean cancel(String requestId, String reason) {
        CancellationToken token = inFlight.get(requestId);
        if (token == null) {
            log.debug("Cancel ignored, request not in flight: requestId={}", requestId);
            return false;
        }
        boolean cancelled = token.cancel(reason);
        if (cancelled) {
            log.info("Request cancel signalled: requestId={}, reason={}", requestId, reason);
        }
        return cancelled;
    }

    public boolean isInFlight(String requestId) {
        return inFlight.containsKey(requestId);
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getGlobalInFlight() {
        return admissionHandler.getGlobalInFlight();
    }

    /**
     * Drains the ring buffer, waits for running requests, then cancels the stragglers.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down RequestPipeline...");
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Disruptor shutdown timed out, halting...");
            disruptor.halt();
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Requests still running after {}s, cancelling {} of them",
                        SHUTDOWN_TIMEOUT_SECONDS, inFlight.size());
                inFlight.values().forEach(token -> token.cancel("shutdown"));
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("RequestPipeline shut down");
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using YieldingWaitStrategy", name);
                yield new YieldingWaitStrategy();
            }
        };
    }

    ValidationHandler getValidationHandler() {
        return validationHandler;
    }

    AdmissionHandler getAdmissionHandler() {
        return admissionHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Fails the result future of an event whose handler threw.
     */
    private static final class PipelineExceptionHandler implements ExceptionHandler<RelayRequestEvent> {

        private final Map<String, CancellationToken> inFlight;

        PipelineExceptionHandler(Map<String, CancellationToken> inFlight) {
            this.inFlight = inFlight;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, RelayRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
            if (event.getRequest() != null) {
                inFlight.remove(event.getRequest().id());
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";
        private int maxGlobalInFlight = 1000;
        private int workerThreads = 64;
        private int maxBodyBytes = 1_048_576;
        private Set<String> allowedModels = Set.of();
        private RetryCoordinator coordinator;
        private RetryPolicyProvider policyProvider;
        private Supplier<List<Channel>> channels;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxGlobalInFlight(int max) {
            this.maxGlobalInFlight = max;
            return this;
        }

        public Builder workerThreads(int threads) {
            this.workerThreads = threads;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder allowedModels(Set<String> models) {
            this.allowedModels = models;
            return this;
        }

        public Builder coordinator(RetryCoordinator coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        public Builder policyProvider(RetryPolicyProvider provider) {
            this.policyProvider = provider;
            return this;
        }

        public Builder channels(Supplier<List<Channel>> channels) {
            this.channels = channels;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(RelayConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.maxGlobalInFlight = config.getDisruptor().getMaxGlobalInFlight();
            this.workerThreads = config.getDisruptor().getWorkerThreads();
            this.maxBodyBytes = config.getValidation().getMaxBodyBytes();
            this.allowedModels = config.getValidation().getAllowedModels();
            return this;
        }

        public RequestPipeline build() {
            if (coordinator == null) {
                throw new IllegalStateException("RetryCoordinator is required");
            }
            if (policyProvider == null) {
                throw new IllegalStateException("RetryPolicyProvider is required");
            }
            if (channels == null) {
                throw new IllegalStateException("Channel supplier is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new RequestPipeline(this);
        }
    }
}
