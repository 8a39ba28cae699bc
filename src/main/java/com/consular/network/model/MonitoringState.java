package com.consular.network.model;

import java.util.Locale;

public enum MonitoringState {
    ACTIVE("actif"),
    PASSIVE("passif"),
    ARCHIVED("archive");

    private final String sourceLabel;

    MonitoringState(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public static MonitoringState fromLabel(String label) {
        MonitoringState state = lookup(label);
        return state != null ? state : PASSIVE;
    }

    /**
     * Parse a request value. Blank means no state.
     *
     * @throws IllegalArgumentException for a label no state carries
     */
    public static MonitoringState parse(String value) {
        if (value == null || value.isBlank()) return null;
        MonitoringState state = lookup(value);
        if (state != null) return state;
        throw new IllegalArgumentException(
                "Invalid monitoring state: " + value + " (expected actif, passif or archive)");
    }

    private static MonitoringState lookup(String label) {
        String normalized = SourceLabels.normalize(label);
        for (MonitoringState state : values()) {
            if (state.sourceLabel.equals(normalized) || state.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return state;
            }
        }
        return null;
    }
}
