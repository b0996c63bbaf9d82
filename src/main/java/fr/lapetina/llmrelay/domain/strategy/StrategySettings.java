package fr.lapetina.llmrelay.domain.strategy;

/**
 * Tuning for the built-in strategies.
 *
 * @param weightedSeed    fixed seed for the weighted draw, or null for a random seed
 * @param adaptiveSeed    fixed seed for the adaptive draw, or null for a random seed
 * @param cooldownPenalty score multiplier while a channel cools down after a failure
 * @param halfOpenWeight  score multiplier while a channel's breaker is half-open
 * @param minScore        lower bound of any adaptive score
 */
public record StrategySettings(
        Long weightedSeed,
        Long adaptiveSeed,
        double cooldownPenalty,
        double halfOpenWeight,
        double minScore
) {
    public StrategySettings {
        if (cooldownPenalty < 0 || cooldownPenalty > 1) {
            throw new IllegalArgumentException("cooldownPenalty must be within [0, 1]: " + cooldownPenalty);
        }
        if (halfOpenWeight < 0 || halfOpenWeight > 1) {
            throw new IllegalArgumentException("halfOpenWeight must be within [0, 1]: " + halfOpenWeight);
        }
        if (minScore < 0) {
            throw new IllegalArgumentException("minScore must be >= 0: " + minScore);
        }
    }

    public static StrategySettings defaults() {
        return new StrategySettings(null, null, 0.1, 0.3, 0.01);
    }
}
