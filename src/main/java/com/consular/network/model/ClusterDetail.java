package com.consular.network.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterDetail {
    private NetworkCluster cluster;
    private String anchorId;
    private double averageInfluence;
    private String dominantLocation;  // null when no member has a location
    private List<NetworkNode> members;
}
