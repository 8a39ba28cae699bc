package com.consular.network.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Greedily detected group of 3+ people sharing several organizations with an anchor person")
public class NetworkCluster {

    @Schema(description = "Sequential id in detection order", example = "cluster-001")
    private String id;

    @Schema(description = "Cluster label followed by the members' most common location", example = "Réseau Paris")
    private String name;

    @Schema(description = "Number of member people", example = "4")
    private int nodes;

    @Schema(description = "Influence level of the members' average influence", example = "MEDIUM")
    private InfluenceTier influence;

    @Schema(description = "Average member connection count, rounded down", example = "5")
    private int connections;
}
