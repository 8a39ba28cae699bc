package com.consular.network.controller;

import com.consular.network.config.AerospikeConfig;
import com.consular.network.config.NetworkAnalysisConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime analysis configuration")
public class ConfigController {

    private final NetworkAnalysisConfig networkConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(NetworkAnalysisConfig networkConfig, AerospikeConfig aerospikeConfig) {
        this.networkConfig = networkConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Network analysis ──

    @Operation(summary = "Get network analysis configuration")
    @GetMapping("/network")
    public ResponseEntity<Map<String, Object>> getNetworkConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("leadershipKeywords", networkConfig.getLeadershipKeywords());
        response.put("unspecifiedLocation", networkConfig.getUnspecifiedLocation());
        response.put("clusterLabel", networkConfig.getClusterLabel());
        response.put("minClusterSize", networkConfig.getMinClusterSize());
        response.put("minSharedOrganizations", networkConfig.getMinSharedOrganizations());
        response.put("maxEgoOrganizations", networkConfig.getMaxEgoOrganizations());
        response.put("backgroundEnabled", networkConfig.getBackground().isEnabled());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update network analysis configuration",
            description = "Changes apply to the next analysis run but reset on restart.")
    @PutMapping("/network")
    public ResponseEntity<?> updateNetworkConfig(@RequestBody Map<String, Object> body) {
        int minClusterSize;
        int minShared;
        int maxEgo;
        try {
            minClusterSize = toInt(body, "minClusterSize", networkConfig.getMinClusterSize());
            minShared = toInt(body, "minSharedOrganizations", networkConfig.getMinSharedOrganizations());
            maxEgo = toInt(body, "maxEgoOrganizations", networkConfig.getMaxEgoOrganizations());
        } catch (InvalidFieldException e) {
            return badRequest(e.getMessage(), e.field);
        }
        String clusterLabel = toString(body, "clusterLabel", networkConfig.getClusterLabel());
        String unspecified = toString(body, "unspecifiedLocation", networkConfig.getUnspecifiedLocation());

        if (minClusterSize < 3) return badRequest("minClusterSize must be >= 3", "minClusterSize");
        if (minShared < 1) return badRequest("minSharedOrganizations must be >= 1", "minSharedOrganizations");
        if (maxEgo < 1) return badRequest("maxEgoOrganizations must be >= 1", "maxEgoOrganizations");
        if (clusterLabel.isBlank()) return badRequest("clusterLabel must not be blank", "clusterLabel");
        if (unspecified.isBlank()) return badRequest("unspecifiedLocation must not be blank", "unspecifiedLocation");

        List<String> keywords = networkConfig.getLeadershipKeywords();
        Object rawKeywords = body.get("leadershipKeywords");
        if (rawKeywords != null) {
            if (!(rawKeywords instanceof List<?> rawList) || rawList.isEmpty()) {
                return badRequest("leadershipKeywords must be a non-empty list", "leadershipKeywords");
            }
            keywords = rawList.stream()
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(k -> !k.isEmpty())
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .distinct()
                    .toList();
            if (keywords.isEmpty()) {
                return badRequest("leadershipKeywords must be a non-empty list", "leadershipKeywords");
            }
        }

        networkConfig.setMinClusterSize(minClusterSize);
        networkConfig.setMinSharedOrganizations(minShared);
        networkConfig.setMaxEgoOrganizations(maxEgo);
        networkConfig.setClusterLabel(clusterLabel.trim());
        networkConfig.setUnspecifiedLocation(unspecified.trim());
        networkConfig.setLeadershipKeywords(new ArrayList<>(keywords));

        return getNetworkConfig();
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(key + " must be an integer", key);
        }
    }

    private String toString(Map<String, Object> body, String key, String defaultVal) {
        Object v = body.get(key);
        return v != null ? v.toString() : defaultVal;
    }

    private static class InvalidFieldException extends IllegalArgumentException {
        private final String field;

        InvalidFieldException(String message, String field) {
            super(message);
            this.field = field;
        }
    }
}
