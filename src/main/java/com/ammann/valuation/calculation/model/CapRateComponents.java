/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Build-up of the discount and capitalization rates.
 */
public record CapRateComponents(
        double riskFreeRate,
        double equityRiskPremium,
        double sizePremium,
        double industryRiskPremium,
        double companySpecificRiskPremium,
        double discountRate,
        double longTermGrowthRate,
        double capitalizationRate) {}
