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
@Schema(description = "An organization with its current active member count")
public class OrganizationDetail {

    private Organization organization;

    @Schema(description = "Active memberships whose person is on record", example = "12")
    private int activeMemberCount;
}
