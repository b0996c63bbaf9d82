package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.Channel;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Weighted-random draw shared by the strategies.
 *
 * Probability of a channel is its weight over the sum of weights. Channels with a
 * non-positive weight are never drawn unless every channel has one, in which case
 * the draw is uniform.
 */
final class WeightedRandomSelector {

    private WeightedRandomSelector() {
    }

    static Optional<Channel> select(List<Channel> channels, ToDoubleFunction<Channel> weightOf, Random random) {
        if (channels.isEmpty()) {
            return Optional.empty();
        }
        if (channels.size() == 1) {
            return Optional.of(channels.get(0));
        }

        double[] weights = new double[channels.size()];
        double total = 0;
        for (int i = 0; i < weights.length; i++) {
            double w = weightOf.applyAsDouble(channels.get(i));
            weights[i] = Double.isFinite(w) && w > 0 ? w : 0;
            total += weights[i];
        }

        if (total <= 0) {
            return Optional.of(channels.get(random.nextInt(channels.size())));
        }

        double target = random.nextDouble() * total;
        double cumulative = 0;
        int lastPositive = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0) {
                continue;
            }
            lastPositive = i;
            cumulative += weights[i];
            if (target < cumulative) {
                return Optional.of(channels.get(i));
            }
        }
        // rounding at the upper edge
        return Optional.of(channels.get(lastPositive));
    }
}
