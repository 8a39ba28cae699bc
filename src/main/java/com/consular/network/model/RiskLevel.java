package com.consular.network.model;

/**
 * Coarse risk classification carried by every network node.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel forPerson(int annotationCount, boolean hasHighPriorityAnnotation) {
        if (hasHighPriorityAnnotation || annotationCount >= 10) return HIGH;
        if (annotationCount >= 5) return MEDIUM;
        return LOW;
    }
}
