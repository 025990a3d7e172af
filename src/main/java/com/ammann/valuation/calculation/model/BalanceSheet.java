/* (C)2026 */
package com.ammann.valuation.calculation.model;

import java.util.List;

/**
 * Most recent balance sheet as extracted from the financial documents.
 */
public record BalanceSheet(
        double cash,
        double accountsReceivable,
        double allowanceForDoubtfulAccounts,
        double inventory,
        double currentAssets,
        double totalAssets,
        double currentLiabilities,
        double totalLiabilities,
        double totalEquity,
        List<FairValueAdjustment> adjustments) {

    public BalanceSheet {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }

    /**
     * Book equity derived from the totals rather than the reported equity line.
     */
    public double bookEquity() {
        return totalAssets - totalLiabilities;
    }
}
