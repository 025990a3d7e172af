/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.EarningsMetric;

/**
 * Multiple ranges for one NAICS industry.
 */
public record IndustryMultiples(
        String naicsCode,
        String industryName,
        MultipleRange sde,
        MultipleRange ebitda,
        MultipleRange revenue) {

    public MultipleRange rangeFor(EarningsMetric metric) {
        return switch (metric) {
            case EBITDA -> ebitda;
            case REVENUE -> revenue;
            default -> sde;
        };
    }
}
