package com.consular.network.engine;

import com.consular.network.model.NetworkCluster;
import com.consular.network.model.NetworkNode;
import com.consular.network.model.NetworkStats;

import java.util.List;

public final class NetworkAggregator {

    private NetworkAggregator() {}

    /**
     * Totals over the (possibly filtered) node set. Clusters are counted as given; they
     * come from the unfiltered snapshot.
     */
    public static NetworkStats aggregate(List<NetworkNode> nodes, List<NetworkCluster> clusters) {
        long totalConnections = 0;
        long influenceSum = 0;
        for (NetworkNode node : nodes) {
            totalConnections += node.getConnections();
            influenceSum += node.getInfluence();
        }
        int averageInfluence = nodes.isEmpty()
                ? 0
                : (int) Math.round((double) influenceSum / nodes.size());

        return NetworkStats.builder()
                .totalNodes(nodes.size())
                .totalConnections(totalConnections)
                .averageInfluence(averageInfluence)
                .totalClusters(clusters.size())
                .build();
    }
}
