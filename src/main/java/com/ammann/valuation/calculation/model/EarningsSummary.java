/* (C)2026 */
package com.ammann.valuation.calculation.model;

import java.util.List;

/**
 * Per-period and recency-weighted earnings.
 *
 * @param periods normalized periods, most recent first
 * @param weights weight applied to each period, same order as {@code periods}
 * @param weightedSde weighted average SDE rounded to the dollar
 * @param weightedEbitda weighted average EBITDA rounded to the dollar
 * @param latestRevenue revenue of the most recent period
 */
public record EarningsSummary(
        List<PeriodEarnings> periods,
        List<Integer> weights,
        double weightedSde,
        double weightedEbitda,
        double latestRevenue) {

    public EarningsSummary {
        periods = periods == null ? List.of() : List.copyOf(periods);
        weights = weights == null ? List.of() : List.copyOf(weights);
    }
}
