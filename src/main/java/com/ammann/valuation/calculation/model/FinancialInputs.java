/* (C)2026 */
package com.ammann.valuation.calculation.model;

import java.util.List;

/**
 * Everything the calculation engine needs, assembled from the extraction passes.
 *
 * @param companyName subject company name
 * @param naicsCode classified industry code ("000000" when unknown)
 * @param periods fiscal years in any order
 * @param balanceSheet most recent balance sheet, null when not extracted
 * @param reportedTotalAssets total assets reported outside a balance sheet, null when unknown
 * @param industry multiple ranges for the industry
 * @param risk risk factors and premium overrides
 */
public record FinancialInputs(
        String companyName,
        String naicsCode,
        List<FiscalYearFinancials> periods,
        BalanceSheet balanceSheet,
        Double reportedTotalAssets,
        IndustryMultiples industry,
        RiskProfile risk) {

    public FinancialInputs {
        periods = periods == null ? List.of() : List.copyOf(periods);
        risk = risk == null ? RiskProfile.empty() : risk;
    }
}
