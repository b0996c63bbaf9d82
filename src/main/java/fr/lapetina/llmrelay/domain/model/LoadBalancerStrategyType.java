package fr.lapetina.llmrelay.domain.model;

import java.util.Locale;

/**
 * Channel selection algorithms a retry policy can choose from.
 */
public enum LoadBalancerStrategyType {
    ADAPTIVE("adaptive"),
    WEIGHTED("weighted");

    private final String value;

    LoadBalancerStrategyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static LoadBalancerStrategyType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ADAPTIVE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LoadBalancerStrategyType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown load balancer strategy: " + value);
    }
}
