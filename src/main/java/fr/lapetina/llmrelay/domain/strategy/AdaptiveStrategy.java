package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ChannelHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Adaptive load balancing strategy.
 *
 * <p>Each channel is scored from its shared rolling health:
 * <pre>
 * score = successRate / (1 + normalizedLatency) * breakerMultiplier
 * </pre>
 * where {@code normalizedLatency} is the channel's average latency divided by the highest
 * average latency among the candidates. The multiplier is {@code cooldownPenalty} shortly
 * after a failure, {@code halfOpenWeight} while the breaker is half-open, and 0 while it is open.
 * Scores are floored at {@code minScore} so a degraded channel still gets the odd request
 * and can recover. The channel is then drawn at random proportionally to its score.
 */
public final class AdaptiveStrategy implements LoadBalancingStrategy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveStrategy.class);

    private final Random random;
    private final double cooldownPenalty;
    private final double halfOpenWeight;
    private final double minScore;

    public AdaptiveStrategy(Random random, double cooldownPenalty, double halfOpenWeight, double minScore) {
        this.random = random;
        this.cooldownPenalty = cooldownPenalty;
        this.halfOpenWeight = halfOpenWeight;
        this.minScore = minScore;
    }

    public AdaptiveStrategy(StrategySettings settings) {
        this(
                settings.adaptiveSeed() != null ? new Random(settings.adaptiveSeed()) : new Random(),
                settings.cooldownPenalty(),
                settings.halfOpenWeight(),
                settings.minScore()
        );
    }

    public AdaptiveStrategy() {
        this(StrategySettings.defaults());
    }

    @Override
    public String getName() {
        return "adaptive";
    }

    @Override
    public Optional<Channel> selectChannel(List<Channel> candidates, Set<String> excluded) {
        List<Channel> eligible = LoadBalancingStrategy.eligible(candidates, excluded);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Double> scores = scores(eligible, System.currentTimeMillis());
        Optional<Channel> selected = WeightedRandomSelector.select(
                eligible, channel -> scores.get(channel.getId()), random);

        if (log.isDebugEnabled()) {
            log.debug("Adaptive selection: selected={}, scores={}",
                    selected.map(Channel::getId).orElse(null), scores);
        }
        return selected;
    }

    /**
     * Computes the score of every channel relative to the others.
     */
    public Map<String, Double> scores(List<Channel> channels, long nowMillis) {
        Map<String, ChannelHealth.Snapshot> snapshots = new LinkedHashMap<>();
        double maxLatency = 0;
        for (Channel channel : channels) {
            ChannelHealth.Snapshot snapshot = channel.getHealth().snapshot(nowMillis);
            snapshots.put(channel.getId(), snapshot);
            maxLatency = Math.max(maxLatency, snapshot.averageLatencyMs());
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, ChannelHealth.Snapshot> entry : snapshots.entrySet()) {
            scores.put(entry.getKey(), score(entry.getValue(), maxLatency));
        }
        return scores;
    }

    double score(ChannelHealth.Snapshot snapshot, double maxLatency) {
        double normalizedLatency = maxLatency > 0 ? snapshot.averageLatencyMs() / maxLatency : 0;
        double base = snapshot.successRate() / (1 + normalizedLatency);

        double multiplier = switch (snapshot.breakerState()) {
            case OPEN -> 0.0;
            case HALF_OPEN -> halfOpenWeight;
            case CLOSED -> snapshot.coolingDown() ? cooldownPenalty : 1.0;
        };

        return Math.max(minScore, base * multiplier);
    }
}
