package com.consular.network.model;

import java.util.Locale;

public enum AnnotationPriority {
    LOW("faible"),
    MEDIUM("moyen"),
    HIGH("eleve"),
    CRITICAL("critique");

    private final String sourceLabel;

    AnnotationPriority(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }

    public static AnnotationPriority fromLabel(String label) {
        String normalized = SourceLabels.normalize(label);
        for (AnnotationPriority priority : values()) {
            if (priority.sourceLabel.equals(normalized) || priority.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return priority;
            }
        }
        return LOW;
    }

    public boolean isHighPriority() {
        return this == HIGH || this == CRITICAL;
    }
}
