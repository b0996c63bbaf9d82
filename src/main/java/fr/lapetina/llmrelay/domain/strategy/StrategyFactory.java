package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating load balancing strategies by name.
 */
public final class StrategyFactory {

    private static final Map<String, Function<StrategySettings, LoadBalancingStrategy>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        register(LoadBalancerStrategyType.ADAPTIVE.value(), AdaptiveStrategy::new);
        register(LoadBalancerStrategyType.WEIGHTED.value(), settings -> settings.weightedSeed() != null
                ? new WeightedStrategy(settings.weightedSeed())
                : new WeightedStrategy());
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a strategy under a name, replacing any previous registration.
     */
    public static void register(String name, Function<StrategySettings, LoadBalancingStrategy> factory) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * Creates a strategy by name.
     *
     * @return strategy instance, or empty if the name is unknown
     */
    public static Optional<LoadBalancingStrategy> create(String name, StrategySettings settings) {
        Function<StrategySettings, LoadBalancingStrategy> factory = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(settings));
    }

    /**
     * Creates one instance of every strategy a retry policy can name.
     */
    public static Map<LoadBalancerStrategyType, LoadBalancingStrategy> createAll(StrategySettings settings) {
        Map<LoadBalancerStrategyType, LoadBalancingStrategy> strategies = new EnumMap<>(LoadBalancerStrategyType.class);
        for (LoadBalancerStrategyType type : LoadBalancerStrategyType.values()) {
            strategies.put(type, create(type.value(), settings)
                    .orElseThrow(() -> new IllegalStateException("No strategy registered for " + type.value())));
        }
        return strategies;
    }
}
