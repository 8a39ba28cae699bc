package com.consular.network.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A membership of an organization, enriched with the member's name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberView {
    private Membership membership;
    private String personId;
    private String displayName;
}
