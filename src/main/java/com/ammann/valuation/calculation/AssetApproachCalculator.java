/* (C)2026 */
package com.ammann.valuation.calculation;

import static com.ammann.valuation.calculation.CalculationMath.roundToThousand;

import com.ammann.valuation.calculation.model.AssetApproachResult;
import com.ammann.valuation.calculation.model.BalanceSheet;
import com.ammann.valuation.calculation.model.FairValueAdjustment;

/**
 * Adjusted net asset method: book equity restated to fair value.
 */
public class AssetApproachCalculator {

    static final double RECEIVABLE_HAIRCUT = 0.05;
    static final double INVENTORY_HAIRCUT = 0.10;
    static final double REPORTED_ASSETS_FALLBACK_RATIO = 0.50;

    /**
     * @param balanceSheet extracted balance sheet, may be null
     * @param reportedTotalAssets total assets known from another source, may be null
     */
    public AssetApproachResult calculate(
            BalanceSheet balanceSheet, Double reportedTotalAssets, CalculationTrail trail) {
        if (balanceSheet == null || balanceSheet.totalAssets() <= 0) {
            return fallback(reportedTotalAssets, trail);
        }

        double bookEquity = balanceSheet.bookEquity();
        double imbalance = Math.abs(balanceSheet.totalAssets()
                - (balanceSheet.totalLiabilities() + balanceSheet.totalEquity()));
        if (balanceSheet.totalEquity() != 0 && imbalance > balanceSheet.totalAssets() * 0.01) {
            trail.warn("Balance sheet does not balance: assets "
                    + CalculationMath.formatCurrency(balanceSheet.totalAssets())
                    + " vs liabilities + equity "
                    + CalculationMath.formatCurrency(balanceSheet.totalLiabilities() + balanceSheet.totalEquity()));
        }

        double assetAdjustments = 0;
        double liabilityAdjustments = 0;
        if (balanceSheet.adjustments().isEmpty()) {
            if (balanceSheet.accountsReceivable() > 0 && balanceSheet.allowanceForDoubtfulAccounts() == 0) {
                assetAdjustments -= balanceSheet.accountsReceivable() * RECEIVABLE_HAIRCUT;
            }
            if (balanceSheet.inventory() > 0) {
                assetAdjustments -= balanceSheet.inventory() * INVENTORY_HAIRCUT;
            }
        } else {
            for (FairValueAdjustment adjustment : balanceSheet.adjustments()) {
                if (adjustment.liability()) {
                    liabilityAdjustments += adjustment.delta();
                } else {
                    assetAdjustments += adjustment.delta();
                }
            }
        }

        double adjustedNav = bookEquity + assetAdjustments - liabilityAdjustments;
        double value = Math.max(0, roundToThousand(adjustedNav));
        trail.step(
                "asset.adjusted_nav",
                "Adjusted net asset value",
                "book equity + asset adjustments - liability adjustments",
                adjustedNav,
                "bookEquity", bookEquity,
                "assetAdjustments", assetAdjustments,
                "liabilityAdjustments", liabilityAdjustments);
        if (adjustedNav < 0) {
            trail.warn("Adjusted net asset value is negative; asset approach floored at zero");
        }
        return new AssetApproachResult(
                bookEquity, assetAdjustments, liabilityAdjustments, adjustedNav, "balance_sheet", value);
    }

    private AssetApproachResult fallback(Double reportedTotalAssets, CalculationTrail trail) {
        if (reportedTotalAssets != null && reportedTotalAssets > 0) {
            double estimate = reportedTotalAssets * REPORTED_ASSETS_FALLBACK_RATIO;
            trail.warn("No balance sheet extracted; asset approach estimated at 50% of reported total assets");
            trail.step(
                    "asset.fallback",
                    "Asset value estimated from reported total assets",
                    "total assets x 0.50",
                    estimate,
                    "reportedTotalAssets", reportedTotalAssets);
            return new AssetApproachResult(
                    estimate, 0, 0, estimate, "reported_total_assets", roundToThousand(estimate));
        }
        trail.warn("No balance sheet data; asset approach value is zero");
        return new AssetApproachResult(0, 0, 0, 0, "none", 0);
    }
}
