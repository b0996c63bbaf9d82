package fr.lapetina.llmrelay.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-channel circuit breaker that drives the adaptive down-weighting of failing channels.
 *
 * States:
 * - CLOSED: normal operation
 * - OPEN: consecutive failures reached the threshold; the channel is scored at the floor
 * - HALF_OPEN: recovery period elapsed; the channel is tried again at a reduced weight
 *
 * The breaker never blocks a request on its own. It only informs selection weight.
 * Thread-safe via atomic operations; time is passed in explicitly.
 */
public final class ChannelCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ChannelCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String channelId;
    private final int failureThreshold;
    private final long recoveryMillis;
    private final int successThresholdInHalfOpen;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile long openedAtMillis;

    public ChannelCircuitBreaker(
            String channelId,
            int failureThreshold,
            Duration recovery,
            int successThresholdInHalfOpen
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.channelId = channelId;
        this.failureThreshold = failureThreshold;
        this.recoveryMillis = recovery.toMillis();
        this.successThresholdInHalfOpen = Math.max(1, successThresholdInHalfOpen);
    }

    public ChannelCircuitBreaker(String channelId) {
        this(channelId, 5, Duration.ofSeconds(60), 3);
    }

    /**
     * Records a successful attempt.
     */
    public void recordSuccess(long nowMillis) {
        State currentState = getState(nowMillis);

        if (currentState == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= successThresholdInHalfOpen
                    && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker CLOSED after recovery: channelId={}", channelId);
            }
        }
    }

    /**
     * Records a failed attempt.
     */
    public void recordFailure(long nowMillis) {
        State currentState = getState(nowMillis);

        if (currentState == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAtMillis = nowMillis;
                log.warn("Circuit breaker OPENED (half-open failure): channelId={}", channelId);
            }
            return;
        }

        if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAtMillis = nowMillis;
                log.warn("Circuit breaker OPENED: channelId={}, failures={}", channelId, failures);
            }
        }
    }

    /**
     * Returns the current state, moving OPEN to HALF_OPEN once the recovery period has elapsed.
     */
    public State getState(long nowMillis) {
        if (state.get() == State.OPEN && nowMillis - openedAtMillis >= recoveryMillis
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            successCountInHalfOpen.set(0);
            log.info("Circuit breaker transitioning to HALF_OPEN: channelId={}", channelId);
        }
        return state.get();
    }

    /**
     * Forces the breaker into a state. For admin use and tests.
     */
    public void forceState(State newState, long nowMillis) {
        State old = state.getAndSet(newState);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            openedAtMillis = nowMillis;
        }
        if (newState == State.HALF_OPEN) {
            successCountInHalfOpen.set(0);
        }
        log.info("Circuit breaker forced from {} to {}: channelId={}", old, newState, channelId);
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public String getChannelId() {
        return channelId;
    }

    @Override
    public String toString() {
        return "ChannelCircuitBreaker{" +
                "channelId='" + channelId + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
