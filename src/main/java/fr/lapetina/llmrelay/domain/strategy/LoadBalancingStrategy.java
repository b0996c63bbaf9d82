package fr.lapetina.llmrelay.domain.strategy;

import fr.lapetina.llmrelay.domain.model.Channel;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Strategy interface for picking the next channel of a request.
 *
 * Implementations must be thread-safe as they are called from
 * many concurrently running coordinators.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a channel among the candidates that are not excluded.
     *
     * @param candidates enabled channels that serve the request's model
     * @param excluded   ids of channels already exhausted by the current request
     * @return the selected channel, or empty when no candidate is left
     */
    Optional<Channel> selectChannel(List<Channel> candidates, Set<String> excluded);

    /**
     * Candidates minus the excluded ids, in their original order.
     */
    static List<Channel> eligible(List<Channel> candidates, Set<String> excluded) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (excluded == null || excluded.isEmpty()) {
            return candidates;
        }
        return candidates.stream()
                .filter(channel -> !excluded.contains(channel.getId()))
                .toList();
    }
}
