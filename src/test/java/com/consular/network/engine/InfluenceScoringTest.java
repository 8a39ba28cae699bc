package com.consular.network.engine;

import com.consular.network.model.MonitoringState;
import com.consular.network.model.RiskLevel;
import com.consular.network.model.RiskTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InfluenceScoringTest {

    @Test
    void personInfluence_noActivity_isZero() {
        assertThat(InfluenceScoring.personInfluence(0, 0, false, false)).isEqualTo(0);
    }

    @Test
    void personInfluence_membershipContributionCappedAtFifty() {
        assertThat(InfluenceScoring.personInfluence(3, 0, false, false)).isEqualTo(30);
        assertThat(InfluenceScoring.personInfluence(5, 0, false, false)).isEqualTo(50);
        assertThat(InfluenceScoring.personInfluence(9, 0, false, false)).isEqualTo(50);
    }

    @Test
    void personInfluence_annotationBonusStartsAtFive() {
        assertThat(InfluenceScoring.personInfluence(1, 4, false, false)).isEqualTo(10);
        assertThat(InfluenceScoring.personInfluence(1, 5, false, false)).isEqualTo(30);
    }

    @Test
    void personInfluence_allBonuses_cappedAtHundred() {
        assertThat(InfluenceScoring.personInfluence(5, 5, true, true)).isEqualTo(100);
        assertThat(InfluenceScoring.personInfluence(20, 40, true, true)).isEqualTo(100);
    }

    @Test
    void personInfluence_annotatedWithoutMemberships() {
        // 12 annotations, one of them critical
        assertThat(InfluenceScoring.personInfluence(0, 12, false, true)).isEqualTo(35);
    }

    @Test
    void personInfluence_negativeCountsTreatedAsZero() {
        assertThat(InfluenceScoring.personInfluence(-3, -1, false, false)).isEqualTo(0);
    }

    @Test
    void organizationInfluence_combinesMembersTierAndMonitoring() {
        assertThat(InfluenceScoring.organizationInfluence(0, RiskTier.LOW, MonitoringState.PASSIVE)).isEqualTo(10);
        assertThat(InfluenceScoring.organizationInfluence(3, RiskTier.MEDIUM, MonitoringState.ACTIVE)).isEqualTo(60);
        assertThat(InfluenceScoring.organizationInfluence(4, RiskTier.HIGH, MonitoringState.ARCHIVED)).isEqualTo(70);
    }

    @Test
    void organizationInfluence_cappedAtHundred() {
        // 60 + 40 + 10
        assertThat(InfluenceScoring.organizationInfluence(8, RiskTier.CRITICAL, MonitoringState.ACTIVE)).isEqualTo(100);
    }

    @Test
    void organizationInfluence_missingTierCountsAsLow() {
        assertThat(InfluenceScoring.organizationInfluence(1, null, null)).isEqualTo(20);
    }

    @Test
    void personRiskLevel_thresholds() {
        assertThat(InfluenceScoring.personRiskLevel(0, false)).isEqualTo(RiskLevel.LOW);
        assertThat(InfluenceScoring.personRiskLevel(4, false)).isEqualTo(RiskLevel.LOW);
        assertThat(InfluenceScoring.personRiskLevel(5, false)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(InfluenceScoring.personRiskLevel(9, false)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(InfluenceScoring.personRiskLevel(10, false)).isEqualTo(RiskLevel.HIGH);
        assertThat(InfluenceScoring.personRiskLevel(1, true)).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void organizationRiskLevel_followsTier() {
        assertThat(InfluenceScoring.organizationRiskLevel(RiskTier.CRITICAL)).isEqualTo(RiskLevel.HIGH);
        assertThat(InfluenceScoring.organizationRiskLevel(RiskTier.HIGH)).isEqualTo(RiskLevel.HIGH);
        assertThat(InfluenceScoring.organizationRiskLevel(RiskTier.MEDIUM)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(InfluenceScoring.organizationRiskLevel(RiskTier.LOW)).isEqualTo(RiskLevel.LOW);
        assertThat(InfluenceScoring.organizationRiskLevel(null)).isEqualTo(RiskLevel.LOW);
    }
}
