package fr.lapetina.llmrelay.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrelay.domain.event.EventState;
import fr.lapetina.llmrelay.domain.event.RelayRequestEvent;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Second stage handler: bounds the number of requests running their attempt loop.
 *
 * A validated request takes one global slot, released by {@link #releaseSlot()} once the
 * request is terminal. When every slot is taken the request is rejected with
 * {@link ErrorType#CAPACITY_ERROR}.
 */
public final class AdmissionHandler implements EventHandler<RelayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionHandler.class);

    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final AtomicInteger globalInFlight = new AtomicInteger(0);
    private final int maxGlobalInFlight;
    private final MetricsRegistry metricsRegistry;
    private volatile boolean capacityWarningLogged = false;

    public AdmissionHandler(int maxGlobalInFlight, MetricsRegistry metricsRegistry) {
        if (maxGlobalInFlight <= 0) {
            throw new IllegalArgumentException("maxGlobalInFlight must be positive");
        }
        this.maxGlobalInFlight = maxGlobalInFlight;
        this.metricsRegistry = metricsRegistry;
        log.info("AdmissionHandler initialized: maxGlobalInFlight={}", maxGlobalInFlight);
    }

    @Override
    public void onEvent(RelayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.getState() != EventState.VALIDATED) {
            return;
        }

        if (!tryAcquireSlot()) {
            event.reject(EventState.REJECTED, ErrorType.CAPACITY_ERROR,
                    "Global in-flight limit reached: " + maxGlobalInFlight + "/" + maxGlobalInFlight);
            log.warn("Request rejected: requestId={}, model={}, globalInFlight={}/{}",
                    event.getRequest().id(), event.getRequest().modelId(),
                    globalInFlight.get(), maxGlobalInFlight);
            return;
        }

        event.markAdmitted();
        log.debug("Request admitted: requestId={}, globalInFlight={}/{}",
                event.getRequest().id(), globalInFlight.get(), maxGlobalInFlight);
    }

    private boolean tryAcquireSlot() {
        while (true) {
            int current = globalInFlight.get();
            if (current >= maxGlobalInFlight) {
                return false;
            }
            if (globalInFlight.compareAndSet(current, current + 1)) {
                checkCapacityThreshold(current + 1);
                metricsRegistry.setGlobalInFlight(current + 1);
                return true;
            }
        }
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxGlobalInFlight;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching global capacity threshold: globalInFlight={}/{} ({}%)",
                    current, maxGlobalInFlight, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }

    /**
     * Returns a slot taken by an admitted request.
     */
    public void releaseSlot() {
        int remaining = globalInFlight.updateAndGet(v -> Math.max(0, v - 1));
        metricsRegistry.setGlobalInFlight(remaining);
        log.debug("Global slot released: globalInFlight={}/{}", remaining, maxGlobalInFlight);
    }

    public int getGlobalInFlight() {
        return globalInFlight.get();
    }

    public int getMaxGlobalInFlight() {
        return maxGlobalInFlight;
    }
}
