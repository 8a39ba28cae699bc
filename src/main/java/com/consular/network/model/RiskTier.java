package com.consular.network.model;

import java.util.Locale;

/**
 * Declared risk tier of an organization. Source records carry French or English labels.
 */
public enum RiskTier {
    LOW("faible"),
    MEDIUM("moyen"),
    HIGH("eleve"),
    CRITICAL("critique");

    private final String sourceLabel;

    RiskTier(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    /** Unknown or missing labels map to LOW. */
    public static RiskTier fromLabel(String label) {
        RiskTier tier = lookup(label);
        return tier != null ? tier : LOW;
    }

    /**
     * Parse a request value. Blank means no tier.
     *
     * @throws IllegalArgumentException for a label no tier carries
     */
    public static RiskTier parse(String value) {
        if (value == null || value.isBlank()) return null;
        RiskTier tier = lookup(value);
        if (tier != null) return tier;
        throw new IllegalArgumentException(
                "Invalid risk tier: " + value + " (expected faible, moyen, eleve or critique)");
    }

    /** Points this tier contributes to an organization's influence score. */
    public int influenceWeight() {
        return switch (this) {
            case CRITICAL -> 40;
            case HIGH -> 30;
            case MEDIUM -> 20;
            case LOW -> 10;
        };
    }

    public RiskLevel toRiskLevel() {
        return switch (this) {
            case CRITICAL, HIGH -> RiskLevel.HIGH;
            case MEDIUM -> RiskLevel.MEDIUM;
            case LOW -> RiskLevel.LOW;
        };
    }

    private static RiskTier lookup(String label) {
        String normalized = SourceLabels.normalize(label);
        for (RiskTier tier : values()) {
            if (tier.sourceLabel.equals(normalized) || tier.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return tier;
            }
        }
        return null;
    }
}
