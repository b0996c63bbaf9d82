package fr.lapetina.llmrelay.domain.model;

import java.util.Locale;

/**
 * Where an inbound request came from.
 */
public enum RequestSource {
    API,
    PLAYGROUND,
    TEST;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a source name, defaulting to {@link #API} when absent.
     */
    public static RequestSource fromValue(String value) {
        if (value == null || value.isBlank()) {
            return API;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "api" -> API;
            case "playground" -> PLAYGROUND;
            case "test" -> TEST;
            default -> throw new IllegalArgumentException("Unknown request source: " + value);
        };
    }
}
