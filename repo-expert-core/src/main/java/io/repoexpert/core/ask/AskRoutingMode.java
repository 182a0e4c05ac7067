package io.repoexpert.core.ask;

import java.util.Locale;

public enum AskRoutingMode {
    AUTO,
    QUALITY,
    SPEED;

    public static AskRoutingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "quality" -> QUALITY;
            case "speed" -> SPEED;
            default -> throw new IllegalArgumentException(
                "Invalid routing mode \"" + value + "\". Use one of: auto, quality, speed."
            );
        };
    }
}
