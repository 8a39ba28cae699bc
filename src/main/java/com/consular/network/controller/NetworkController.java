package com.consular.network.controller;

import com.consular.network.model.ClusterDetail;
import com.consular.network.model.InfluenceFilter;
import com.consular.network.model.NetworkReport;
import com.consular.network.service.NetworkAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/network")
@Tag(name = "Network", description = "Influence network of people and organizations, with cluster detection")
public class NetworkController {

    private final NetworkAnalysisService analysisService;

    public NetworkController(NetworkAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping
    @Operation(summary = "Compute the influence network",
               description = "Analyses a fresh snapshot of the records. Nodes are filtered by name and influence level; " +
                       "clusters and their count always cover the full snapshot.")
    public ResponseEntity<?> computeNetwork(
            @Parameter(description = "Case-insensitive substring of the node name", example = "nguema")
            @RequestParam(required = false) String search,
            @Parameter(description = "Influence level: all, high (>=80), medium (50-79), low (<50)", example = "high")
            @RequestParam(required = false, defaultValue = "all") String influence) {
        InfluenceFilter filter;
        try {
            filter = InfluenceFilter.parse(influence);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "influence"));
        }
        return ResponseEntity.ok(analysisService.computeNetwork(search, filter));
    }

    @GetMapping("/latest")
    @Operation(summary = "Get the latest background network analysis",
               description = "Same view as the compute endpoint, served from the periodically refreshed analysis")
    public ResponseEntity<?> getLatestNetwork(
            @Parameter(description = "Case-insensitive substring of the node name")
            @RequestParam(required = false) String search,
            @Parameter(description = "Influence level: all, high, medium, low")
            @RequestParam(required = false, defaultValue = "all") String influence) {
        InfluenceFilter filter;
        try {
            filter = InfluenceFilter.parse(influence);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "influence"));
        }
        NetworkReport report = analysisService.getLatestNetwork(search, filter);
        return ResponseEntity.ok(report);
    }

    @GetMapping("/status")
    @Operation(summary = "Get background analysis status",
               description = "Readiness, last refresh time, node and cluster counts, skipped dangling references")
    public ResponseEntity<Map<String, Object>> getStatus() {
        return ResponseEntity.ok(analysisService.getStatus());
    }

    @GetMapping("/clusters/{clusterId}")
    @Operation(summary = "Get cluster details",
               description = "Members of a cluster from the latest analysis, computed on demand if none exists yet")
    public ResponseEntity<ClusterDetail> getClusterDetail(
            @Parameter(description = "Cluster ID", example = "cluster-001")
            @PathVariable String clusterId) {
        ClusterDetail detail = analysisService.getClusterDetail(clusterId);
        if (detail == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(detail);
    }
}
