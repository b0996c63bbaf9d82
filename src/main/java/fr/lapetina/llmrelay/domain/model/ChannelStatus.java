package fr.lapetina.llmrelay.domain.model;

import java.util.Locale;

/**
 * Administrative status of a channel. Only {@link #ENABLED} channels are eligible for selection.
 */
public enum ChannelStatus {
    ENABLED,
    DISABLED,
    ARCHIVED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChannelStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ENABLED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "enabled" -> ENABLED;
            case "disabled" -> DISABLED;
            case "archived" -> ARCHIVED;
            default -> throw new IllegalArgumentException("Unknown channel status: " + value);
        };
    }
}
