package com.jreinhal.concierge.hitl;

import java.util.Locale;

/**
 * Declared most urgent first; {@link #rank()} is the sort key for queue listings.
 */
public enum HitlPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public int rank() {
        return ordinal();
    }

    /**
     * The next more urgent level, or this level when already critical.
     */
    public HitlPriority raise() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() - 1];
    }

    public static HitlPriority parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Priority is required");
        }
        try {
            return HitlPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value);
        }
    }
}
