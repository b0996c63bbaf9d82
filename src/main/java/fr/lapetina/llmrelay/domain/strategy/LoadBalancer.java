package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.AutoDisablePolicy;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ErrorType;
import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;
import fr.lapetina.llmrelay.domain.model.RequestExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Selects the next channel for a request and feeds attempt outcomes back into channel health.
 *
 * The candidate set is built from a channel snapshot: enabled channels serving the
 * request's model. The strategy named by the request's retry policy makes the pick.
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final Map<LoadBalancerStrategyType, LoadBalancingStrategy> strategies;

    public LoadBalancer(Map<LoadBalancerStrategyType, LoadBalancingStrategy> strategies) {
        this.strategies = new EnumMap<>(strategies);
        for (LoadBalancerStrategyType type : LoadBalancerStrategyType.values()) {
            Objects.requireNonNull(this.strategies.get(type), "Missing strategy: " + type.value());
        }
    }

    public LoadBalancer(StrategySettings settings) {
        this(StrategyFactory.createAll(settings));
    }

    /**
     * Selects a channel for a model, skipping the excluded ids.
     *
     * @param type     strategy named by the request's retry policy
     * @param channels channel snapshot taken at request start
     * @param model    model requested
     * @param excluded channels already exhausted by this request
     * @return the selected channel, or empty when none is eligible
     */
    public Optional<Channel> selectChannel(
            LoadBalancerStrategyType type,
            List<Channel> channels,
            String model,
            Set<String> excluded
    ) {
        List<Channel> candidates = candidates(channels, model);
        Optional<Channel> selected = strategyFor(type).selectChannel(candidates, excluded);

        log.debug("Channel selection: strategy={}, model={}, candidates={}, excluded={}, selected={}",
                type.value(), model, candidates.size(), excluded, selected.map(Channel::getId).orElse(null));
        return selected;
    }

    /**
     * Enabled channels serving the model, in snapshot order.
     */
    public List<Channel> candidates(List<Channel> channels, String model) {
        return channels.stream()
                .filter(Channel::isEnabled)
                .filter(channel -> channel.serves(model))
                .toList();
    }

    /**
     * Updates the channel's shared health from one finished attempt.
     * Canceled attempts say nothing about the channel and are ignored.
     */
    public void recordOutcome(Channel channel, RequestExecution execution) {
        recordOutcome(channel, execution, AutoDisablePolicy.disabled());
    }

    /**
     * Updates the channel's shared health and its per-status failure counts.
     *
     * @return true when the failure's upstream status reached its auto-disable threshold;
     *         the channel's status counts are reset in that case
     */
    public boolean recordOutcome(Channel channel, RequestExecution execution, AutoDisablePolicy autoDisable) {
        if (execution.isSuccess()) {
            long latency = execution.metricsLatencyMs() != null ? execution.metricsLatencyMs() : 0L;
            channel.getHealth().recordSuccess(latency);
            return false;
        }
        if (execution.errorType() == ErrorType.CANCELLED) {
            return false;
        }
        channel.getHealth().recordFailure();

        Integer statusCode = execution.upstreamStatusCode();
        if (statusCode == null) {
            return false;
        }
        OptionalInt threshold = autoDisable.thresholdFor(statusCode);
        if (threshold.isEmpty()) {
            return false;
        }
        int count = channel.getHealth().recordErrorStatus(statusCode);
        if (count < threshold.getAsInt()) {
            log.debug("Channel {} returned {} {}/{} times", channel.getId(), statusCode, count, threshold.getAsInt());
            return false;
        }
        channel.getHealth().resetErrorStatuses();
        return true;
    }

    public LoadBalancingStrategy strategyFor(LoadBalancerStrategyType type) {
        return strategies.get(type);
    }

    /**
     * Current adaptive scores of the enabled channels, keyed by channel id.
     * Empty when the adaptive slot holds a strategy that does not score.
     */
    public Map<String, Double> adaptiveScores(List<Channel> channels) {
        if (strategyFor(LoadBalancerStrategyType.ADAPTIVE) instanceof AdaptiveStrategy adaptive) {
            List<Channel> enabled = channels.stream().filter(Channel::isEnabled).toList();
            return adaptive.scores(enabled, System.currentTimeMillis());
        }
        return Map.of();
    }
}
