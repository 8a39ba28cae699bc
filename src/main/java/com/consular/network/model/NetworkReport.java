package com.consular.network.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Filtered node view, clusters of the full snapshot, and summary statistics")
public class NetworkReport {

    @Schema(description = "Nodes left after the name and influence filters; people first, then organizations")
    private List<NetworkNode> nodes;

    @Schema(description = "Clusters in detection order, computed over the unfiltered snapshot")
    private List<NetworkCluster> clusters;

    private NetworkStats stats;

    @Schema(description = "Capture time of the analysed snapshot in epoch milliseconds")
    private long snapshotAt;
}
