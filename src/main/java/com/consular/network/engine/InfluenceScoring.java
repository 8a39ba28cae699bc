package com.consular.network.engine;

import com.consular.network.model.MonitoringState;
import com.consular.network.model.RiskLevel;
import com.consular.network.model.RiskTier;

/**
 * Influence scores (0-100) and risk levels derived from aggregated relationship counts.
 * Negative counts are treated as zero.
 */
public final class InfluenceScoring {

    private InfluenceScoring() {}

    /**
     * Person influence:
     *   min(activeMemberships × 10, 50)
     *   + 20 with 5 or more annotations
     *   + 15 for a leadership role in an active membership
     *   + 15 for any high or critical annotation
     * capped at 100.
     */
    public static int personInfluence(int activeMembershipCount, int annotationCount,
                                      boolean hasLeadershipRole, boolean hasHighPriorityAnnotation) {
        int score = Math.min(Math.max(activeMembershipCount, 0) * 10, 50);
        if (annotationCount >= 5) score += 20;
        if (hasLeadershipRole) score += 15;
        if (hasHighPriorityAnnotation) score += 15;
        return Math.min(score, 100);
    }

    /**
     * Organization influence:
     *   min(activeMembers × 10, 60) + risk tier weight (10/20/30/40) + 10 under active monitoring,
     * capped at 100.
     */
    public static int organizationInfluence(int activeMemberCount, RiskTier riskTier,
                                            MonitoringState monitoringState) {
        int score = Math.min(Math.max(activeMemberCount, 0) * 10, 60);
        score += (riskTier != null ? riskTier : RiskTier.LOW).influenceWeight();
        if (monitoringState == MonitoringState.ACTIVE) score += 10;
        return Math.min(score, 100);
    }

    public static RiskLevel personRiskLevel(int annotationCount, boolean hasHighPriorityAnnotation) {
        return RiskLevel.forPerson(annotationCount, hasHighPriorityAnnotation);
    }

    public static RiskLevel organizationRiskLevel(RiskTier riskTier) {
        return (riskTier != null ? riskTier : RiskTier.LOW).toRiskLevel();
    }
}
