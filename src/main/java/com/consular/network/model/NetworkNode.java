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
@Schema(description = "Uniform graph view of a person or an organization, rebuilt on every analysis run")
public class NetworkNode {

    @Schema(description = "Person or organization id", example = "PER-0001")
    private String id;

    @Schema(description = "Display name", example = "Nguema Marie")
    private String name;

    @Schema(description = "Node kind", example = "PERSON")
    private NodeKind type;

    @Schema(description = "Influence score (0-100)", example = "65")
    private int influence;

    @Schema(description = "Distinct co-members for a person, active member count for an organization", example = "7")
    private int connections;

    @Schema(description = "Risk level", example = "MEDIUM")
    private RiskLevel riskLevel;

    @Schema(description = "City, zone or the unspecified-location label", example = "Paris")
    private String location;
}
