/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.ApproachType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Complete, deterministic result of one engine run.
 */
public record CalculationEngineOutput(
        String engineVersion,
        String naicsCode,
        EarningsSummary earnings,
        AssetApproachResult assetApproach,
        IncomeApproachResult incomeApproach,
        MarketApproachResult marketApproach,
        List<ApproachSummary> approachSummary,
        Synthesis synthesis,
        List<CalculationStep> steps,
        List<String> warnings) {

    public CalculationEngineOutput {
        approachSummary = approachSummary == null ? List.of() : List.copyOf(approachSummary);
        steps = steps == null ? List.of() : List.copyOf(steps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Row of the approach summary for the given approach.
     *
     * @throws IllegalStateException if the approach is missing
     */
    public ApproachSummary approach(ApproachType type) {
        return approachSummary.stream()
                .filter(a -> a.approach() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No summary row for " + type));
    }

    @JsonIgnore
    public double weightSum() {
        return approachSummary.stream().mapToDouble(ApproachSummary::weight).sum();
    }

    @JsonIgnore
    public double finalConcludedValue() {
        return synthesis.finalConcludedValue();
    }

    @JsonIgnore
    public ValueRange valueRange() {
        return synthesis.valueRange();
    }
}
