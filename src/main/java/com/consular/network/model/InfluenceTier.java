package com.consular.network.model;

public enum InfluenceTier {
    LOW,
    MEDIUM,
    HIGH;

    public static InfluenceTier fromScore(double score) {
        if (score >= 80) return HIGH;
        if (score >= 50) return MEDIUM;
        return LOW;
    }
}
