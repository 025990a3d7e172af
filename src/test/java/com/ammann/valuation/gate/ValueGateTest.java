/* (C)2026 */
package com.ammann.valuation.gate;

import static com.ammann.valuation.gate.GateFixtures.ENGINE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.valuation.reconciliation.ValuationFigures;
import com.ammann.valuation.support.TestDataFactory;
import org.junit.jupiter.api.Test;

class ValueGateTest {

    private final ValueGate gate = new ValueGate();

    @Test
    void passesMultipleWithinIndustryRange() {
        // 751,000 / 283,333
        GateResult result = gate.evaluate(GateFixtures.cleanContext());

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.metrics().get("sdeMultiple")).isCloseTo(2.65, within(0.01));
        assertThat(result.metrics().get("ceiling")).isEqualTo(4.2);
    }

    @Test
    void blocksMultipleAboveCeiling() {
        ValuationFigures shown = GateFixtures.withMarketValue(ValuationFigures.fromEngine(ENGINE), 1_500_000);

        GateResult result = gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections()));

        assertThat(result.passed()).isFalse();
        assertThat(result.score()).isZero();
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo("MULTIPLE_ABOVE_CEILING");
            assertThat(issue.message()).contains("5.29x").contains("4.20x").contains("541330");
        });
    }

    @Test
    void warnsAboveTypicalHighButBelowCeiling() {
        // 3.8x SDE
        ValuationFigures shown = GateFixtures.withMarketValue(ValuationFigures.fromEngine(ENGINE), 1_076_665);

        GateResult result = gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections()));

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(90);
        assertThat(result.warnings()).singleElement().asString().contains("above the typical industry high");
    }

    @Test
    void ceilingCheckAllowsThousandRounding() {
        // 4.22x, inside the 1% slack over 4.2x
        ValuationFigures shown = GateFixtures.withMarketValue(ValuationFigures.fromEngine(ENGINE), 1_195_665);

        assertThat(gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections())).passed()).isTrue();
    }

    @Test
    void fallsBackToEngineFiguresWhenReportShowsNone() {
        Double multiple = ValueGate.derivedSdeMultiple(ENGINE, ValuationFigures.empty());

        assertThat(multiple).isCloseTo(2.65, within(0.01));
    }
}
