/* (C)2026 */
package com.ammann.valuation.reconciliation;

import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.enumeration.ApproachType;

/**
 * Figures shown in the final report. Any field may be null when no source provided it.
 */
public record ValuationFigures(
        Double assetValue,
        Double incomeValue,
        Double marketValue,
        Double assetWeight,
        Double incomeWeight,
        Double marketWeight,
        Double preliminaryValue,
        Double concludedValue,
        Double rangeLow,
        Double rangeHigh,
        Double capitalizationRate,
        Double marketMultiple,
        Double weightedSde) {

    public static ValuationFigures empty() {
        return new ValuationFigures(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static ValuationFigures fromEngine(CalculationEngineOutput engine) {
        return new ValuationFigures(
                engine.approach(ApproachType.ASSET).value(),
                engine.approach(ApproachType.INCOME).value(),
                engine.approach(ApproachType.MARKET).value(),
                engine.approach(ApproachType.ASSET).weight(),
                engine.approach(ApproachType.INCOME).weight(),
                engine.approach(ApproachType.MARKET).weight(),
                engine.synthesis().preliminaryValue(),
                engine.finalConcludedValue(),
                engine.valueRange().low(),
                engine.valueRange().high(),
                engine.incomeApproach().capRate().capitalizationRate(),
                engine.marketApproach().adjustedMultiple(),
                engine.earnings().weightedSde());
    }

    public Double get(ValueField field) {
        return switch (field) {
            case CONCLUDED_VALUE -> concludedValue;
            case ASSET_APPROACH -> assetValue;
            case INCOME_APPROACH -> incomeValue;
            case MARKET_APPROACH -> marketValue;
            case SDE -> weightedSde;
        };
    }
}
