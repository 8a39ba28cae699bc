package com.consular.network.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationStatistics {
    private int total;
    private int totalActiveMembers;
    private int averageMembers;
    private Map<RiskTier, Integer> byRiskTier;
    private Map<MonitoringState, Integer> byMonitoringState;
    // zone -> organizations, ordered by zone name
    private Map<String, Integer> byZone;
    private int activeMonitoringCount;
    private int highRiskCount;
}
