package com.consular.network.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A membership of a person, enriched with the organization it points to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffiliationView {
    private Membership membership;
    private String orgId;
    private String organizationName;
    private RiskTier riskTier;
    private String city;
}
