package com.memquest.memory;

import java.util.Locale;

/** What a full enqueue buffer gives up: the oldest pending event or the new one. */
public enum OverflowPolicy {
    DROP_OLDEST,
    DROP_NEWEST;

    public static OverflowPolicy parse(String value) {
        if (value == null || value.isBlank()) return DROP_OLDEST;
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "drop-oldest" -> DROP_OLDEST;
            case "drop-newest" -> DROP_NEWEST;
            default -> throw new IllegalArgumentException("Unknown overflow policy: " + value);
        };
    }
}
