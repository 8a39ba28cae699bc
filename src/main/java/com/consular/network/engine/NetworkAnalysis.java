package com.consular.network.engine;

import com.consular.network.model.ClusterDetail;
import com.consular.network.model.InfluenceFilter;
import com.consular.network.model.NetworkCluster;
import com.consular.network.model.NetworkNode;
import com.consular.network.model.NetworkReport;
import com.consular.network.model.NetworkStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unfiltered result of one analysis run. Immutable; filtered views are derived per request.
 */
public final class NetworkAnalysis {

    private final List<NetworkNode> nodes;
    private final List<DetectedCluster> clusters;
    private final Map<String, NetworkNode> nodesById;
    private final Instant snapshotAt;
    private final int skippedReferences;

    public NetworkAnalysis(List<NetworkNode> nodes, List<DetectedCluster> clusters,
                           Instant snapshotAt, int skippedReferences) {
        this.nodes = List.copyOf(nodes);
        this.clusters = List.copyOf(clusters);
        this.snapshotAt = snapshotAt;
        this.skippedReferences = skippedReferences;

        Map<String, NetworkNode> byId = new LinkedHashMap<>();
        for (NetworkNode node : nodes) {
            byId.putIfAbsent(node.getId(), node);
        }
        this.nodesById = Collections.unmodifiableMap(byId);
    }

    public List<NetworkNode> getNodes() {
        return nodes;
    }

    public List<DetectedCluster> getClusters() {
        return clusters;
    }

    public List<NetworkCluster> getClusterSummaries() {
        return clusters.stream().map(DetectedCluster::getCluster).toList();
    }

    public Instant getSnapshotAt() {
        return snapshotAt;
    }

    public int getSkippedReferences() {
        return skippedReferences;
    }

    /**
     * Filtered node view plus stats. Clusters and their count are never affected by the filters.
     */
    public NetworkReport toReport(String namePattern, InfluenceFilter influence) {
        List<NetworkNode> filtered = GraphFilter.filter(nodes, namePattern, influence);
        List<NetworkCluster> summaries = getClusterSummaries();
        NetworkStats stats = NetworkAggregator.aggregate(filtered, summaries);

        return NetworkReport.builder()
                .nodes(filtered)
                .clusters(summaries)
                .stats(stats)
                .snapshotAt(snapshotAt.toEpochMilli())
                .build();
    }

    /** Null when no cluster of this run has the id. */
    public ClusterDetail findClusterDetail(String clusterId) {
        for (DetectedCluster detected : clusters) {
            if (detected.getCluster().getId().equals(clusterId)) {
                List<NetworkNode> members = new ArrayList<>();
                for (String memberId : detected.getMemberIds()) {
                    NetworkNode node = nodesById.get(memberId);
                    if (node != null) members.add(node);
                }
                return ClusterDetail.builder()
                        .cluster(detected.getCluster())
                        .anchorId(detected.getAnchorId())
                        .averageInfluence(Math.round(detected.getAverageInfluence() * 100.0) / 100.0)
                        .dominantLocation(detected.getDominantLocation())
                        .members(members)
                        .build();
            }
        }
        return null;
    }
}
