package com.consular.network.model;

import java.util.Locale;

/**
 * Influence level requested by a caller when filtering network nodes.
 */
public enum InfluenceFilter {
    ALL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parse a request value. Blank means ALL.
     *
     * @throws IllegalArgumentException for anything other than all/high/medium/low
     */
    public static InfluenceFilter parse(String value) {
        if (value == null || value.isBlank()) return ALL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid influence level: " + value + " (expected all, high, medium or low)", e);
        }
    }

    public boolean matches(int influence) {
        return switch (this) {
            case ALL -> true;
            case HIGH -> InfluenceTier.fromScore(influence) == InfluenceTier.HIGH;
            case MEDIUM -> InfluenceTier.fromScore(influence) == InfluenceTier.MEDIUM;
            case LOW -> InfluenceTier.fromScore(influence) == InfluenceTier.LOW;
        };
    }
}
