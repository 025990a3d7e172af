/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.reconciliation.ValuationFigures;
import com.ammann.valuation.support.TestDataFactory;
import java.util.Map;

/** Shared builders for gate tests. */
final class GateFixtures {

    static final CalculationEngineOutput ENGINE = TestDataFactory.engineOutput();

    private GateFixtures() {}

    static GateContext cleanContext() {
        return context(ValuationFigures.fromEngine(ENGINE), TestDataFactory.completeSections());
    }

    static GateContext context(ValuationFigures figures, Map<String, String> sections) {
        return TestDataFactory.gateContext(ENGINE, TestDataFactory.document(ENGINE, figures, sections));
    }

    static GateContext withSection(String sectionKey, String text) {
        Map<String, String> sections = TestDataFactory.completeSections();
        sections.put(sectionKey, text);
        return context(ValuationFigures.fromEngine(ENGINE), sections);
    }

    static ValuationFigures withConcluded(ValuationFigures f, double concluded) {
        return new ValuationFigures(f.assetValue(), f.incomeValue(), f.marketValue(),
                f.assetWeight(), f.incomeWeight(), f.marketWeight(), f.preliminaryValue(), concluded,
                f.rangeLow(), f.rangeHigh(), f.capitalizationRate(), f.marketMultiple(), f.weightedSde());
    }

    static ValuationFigures withMarketValue(ValuationFigures f, double marketValue) {
        return new ValuationFigures(f.assetValue(), f.incomeValue(), marketValue,
                f.assetWeight(), f.incomeWeight(), f.marketWeight(), f.preliminaryValue(), f.concludedValue(),
                f.rangeLow(), f.rangeHigh(), f.capitalizationRate(), f.marketMultiple(), f.weightedSde());
    }

    static ValuationFigures withWeights(ValuationFigures f, double asset, double income, double market) {
        return new ValuationFigures(f.assetValue(), f.incomeValue(), f.marketValue(),
                asset, income, market, f.preliminaryValue(), f.concludedValue(),
                f.rangeLow(), f.rangeHigh(), f.capitalizationRate(), f.marketMultiple(), f.weightedSde());
    }
}
