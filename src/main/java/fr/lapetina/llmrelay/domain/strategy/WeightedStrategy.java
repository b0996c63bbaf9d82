package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.Channel;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Weighted-random load balancing strategy.
 *
 * A channel with weight 2 receives twice as many requests as a channel with weight 1.
 * Zero-weight channels only receive traffic when they are the only ones left.
 * Selection is reproducible when the strategy is built with a fixed seed.
 */
public final class WeightedStrategy implements LoadBalancingStrategy {

    private final Random random;

    public WeightedStrategy() {
        this(new Random());
    }

    public WeightedStrategy(long seed) {
        this(new Random(seed));
    }

    public WeightedStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted";
    }

    @Override
    public Optional<Channel> selectChannel(List<Channel> candidates, Set<String> excluded) {
        List<Channel> eligible = LoadBalancingStrategy.eligible(candidates, excluded);
        return WeightedRandomSelector.select(eligible, Channel::getWeight, random);
    }
}
