/* (C)2026 */
package com.ammann.valuation.reconciliation;

/**
 * Headline financial facts of the report. Null fields were not available.
 */
public record FinancialSummary(
        Double annualRevenue,
        Double weightedSde,
        Double weightedEbitda,
        Double totalAssets,
        Double totalLiabilities) {}
