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
@Schema(description = "An organization (association) that people can be members of")
public class Organization {

    @Schema(description = "Unique organization identifier", example = "ORG-0001")
    private String orgId;

    @Schema(description = "Organization name", example = "Association des Étudiants")
    private String name;

    @Schema(description = "Declared risk tier", example = "HIGH")
    @Builder.Default
    private RiskTier riskTier = RiskTier.LOW;

    @Schema(description = "Monitoring state", example = "ACTIVE")
    @Builder.Default
    private MonitoringState monitoringState = MonitoringState.PASSIVE;

    @Schema(description = "City, if known", example = "Lyon")
    private String city;

    @Schema(description = "Zone, used as location when the city is unknown", example = "Europe")
    private String zone;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
