package com.consular.network.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkStats {
    private int totalNodes;
    private long totalConnections;
    private int averageInfluence;
    private int totalClusters;
}
