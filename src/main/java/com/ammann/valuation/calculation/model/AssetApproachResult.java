/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Adjusted net asset value.
 *
 * @param bookEquity total assets minus total liabilities
 * @param assetAdjustments sum of asset fair value deltas
 * @param liabilityAdjustments sum of liability fair value deltas
 * @param adjustedNetAssetValue book equity plus asset deltas minus liability deltas
 * @param dataSource {@code balance_sheet}, {@code reported_total_assets} or {@code none}
 * @param value indicated value rounded to the thousand, never negative
 */
public record AssetApproachResult(
        double bookEquity,
        double assetAdjustments,
        double liabilityAdjustments,
        double adjustedNetAssetValue,
        String dataSource,
        double value) {}
