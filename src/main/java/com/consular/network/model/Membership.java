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
@Schema(description = "Link between a person and an organization. Leaving marks it inactive rather than deleting it.")
public class Membership {

    @Schema(description = "Unique membership identifier", example = "MEM-0001")
    private String membershipId;

    @Schema(description = "Member person id", example = "PER-0001")
    private String personId;

    @Schema(description = "Organization id", example = "ORG-0001")
    private String orgId;

    @Schema(description = "Whether the person is still a member", example = "true")
    @Builder.Default
    private boolean active = true;

    @Schema(description = "Role label within the organization, if any", example = "Trésorier")
    private String role;

    @Schema(description = "Join timestamp in epoch milliseconds", example = "1739886764000")
    private long joinedAt;

    @Schema(description = "Leave timestamp in epoch milliseconds, null while active")
    private Long leftAt;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
