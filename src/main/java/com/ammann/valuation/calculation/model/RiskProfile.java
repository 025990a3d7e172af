/* (C)2026 */
package com.ammann.valuation.calculation.model;

import java.util.List;

/**
 * Risk assessment inputs. Premium overrides are null when extraction did not provide them,
 * in which case the configured defaults apply.
 */
public record RiskProfile(
        List<RiskFactor> factors,
        Double companySpecificRiskPremium,
        Double industryRiskPremium) {

    public RiskProfile {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public static RiskProfile empty() {
        return new RiskProfile(List.of(), null, null);
    }
}
