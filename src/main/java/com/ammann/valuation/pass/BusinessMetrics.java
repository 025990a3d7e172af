/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Risk assessment and operating metrics.
 *
 * @param overallRiskScore 1 (low) to 10 (very high)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BusinessMetrics(
        Double overallRiskScore,
        Double companySpecificRiskPremium,
        Double industryRiskPremium,
        Double customerConcentration,
        List<Factor> riskFactors) implements PassOutput {

    public BusinessMetrics {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Factor(
            String category, Integer score, String rating, Double impactOnMultiple, String description) {}
}
