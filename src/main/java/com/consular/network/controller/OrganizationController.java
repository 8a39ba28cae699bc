package com.consular.network.controller;

import com.consular.network.model.MemberView;
import com.consular.network.model.MonitoringState;
import com.consular.network.model.OrganizationDetail;
import com.consular.network.model.OrganizationStatistics;
import com.consular.network.model.RiskTier;
import com.consular.network.service.OrganizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/organizations")
@Tag(name = "Organizations", description = "Organization listing, statistics and member lists")
public class OrganizationController {

    private final OrganizationService organizationService;

    public OrganizationController(OrganizationService organizationService) {
        this.organizationService = organizationService;
    }

    @GetMapping
    @Operation(summary = "List organizations",
               description = "All organizations in creation order, narrowed by the filters that are set")
    public ResponseEntity<?> listOrganizations(
            @Parameter(description = "Case-insensitive substring of the name or city", example = "paris")
            @RequestParam(required = false) String search,
            @Parameter(description = "Exact zone", example = "Europe")
            @RequestParam(required = false) String zone,
            @Parameter(description = "Risk tier: faible, moyen, eleve, critique (or low, medium, high, critical)",
                       example = "eleve")
            @RequestParam(required = false) String riskTier,
            @Parameter(description = "Monitoring state: actif, passif, archive (or active, passive, archived)",
                       example = "actif")
            @RequestParam(required = false) String monitoring) {
        RiskTier tier;
        try {
            tier = RiskTier.parse(riskTier);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "riskTier"));
        }
        MonitoringState state;
        try {
            state = MonitoringState.parse(monitoring);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "monitoring"));
        }
        return ResponseEntity.ok(organizationService.listOrganizations(search, zone, tier, state));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Get organization statistics",
               description = "Counts by risk tier, monitoring state and zone, active membership totals")
    public ResponseEntity<OrganizationStatistics> getStatistics() {
        return ResponseEntity.ok(organizationService.getStatistics());
    }

    @GetMapping("/{orgId}")
    @Operation(summary = "Get an organization with its active member count")
    public ResponseEntity<OrganizationDetail> getOrganization(
            @Parameter(description = "Organization ID", example = "ORG-0001")
            @PathVariable String orgId) {
        OrganizationDetail detail = organizationService.getOrganization(orgId);
        if (detail == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(detail);
    }

    @GetMapping("/{orgId}/members")
    @Operation(summary = "List organization members")
    public ResponseEntity<List<MemberView>> getMembers(
            @Parameter(description = "Organization ID", example = "ORG-0001")
            @PathVariable String orgId,
            @Parameter(description = "Only active memberships")
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        List<MemberView> members = organizationService.getMembers(orgId, activeOnly);
        if (members == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(members);
    }
}
