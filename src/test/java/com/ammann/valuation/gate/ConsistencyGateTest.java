/* (C)2026 */
package com.ammann.valuation.gate;

import static com.ammann.valuation.gate.GateFixtures.ENGINE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.valuation.calculation.model.BalanceSheet;
import com.ammann.valuation.reconciliation.ValuationFigures;
import com.ammann.valuation.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsistencyGateTest {

    private final ConsistencyGate gate = new ConsistencyGate();

    @Test
    void passesWhenReportShowsEngineFigures() {
        GateResult result = gate.evaluate(GateFixtures.cleanContext());

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void warnsWhenApproachesDivergeWithoutBlocking() {
        // asset 490,000 against income 1,717,000
        GateResult result = gate.evaluate(GateFixtures.cleanContext());

        assertThat(result.warnings()).anyMatch(w -> w.startsWith("Approach values diverge"));
    }

    @Test
    void blocksWhenConcludedValueDriftsBeyondTolerance() {
        ValuationFigures shown =
                GateFixtures.withConcluded(ValuationFigures.fromEngine(ENGINE), ENGINE.finalConcludedValue() * 1.10);

        GateResult result = gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections()));

        assertThat(result.passed()).isFalse();
        assertThat(result.score()).isEqualTo(75);
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo("VALUE_MISMATCH");
            assertThat(issue.field()).isEqualTo("concluded_value");
            assertThat(issue.expected()).isEqualTo(ENGINE.finalConcludedValue());
        });
    }

    @Test
    void toleratesRoundingWithinOnePercent() {
        ValuationFigures shown =
                GateFixtures.withConcluded(ValuationFigures.fromEngine(ENGINE), ENGINE.finalConcludedValue() * 1.005);

        assertThat(gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections())).passed()).isTrue();
    }

    @Test
    void blocksNarrativeAmountDriftingBeyondTolerance() {
        GateResult result = gate.evaluate(GateFixtures.withSection(
                "executive_summary", "The concluded value of the business is $950,000 as of year end."));

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(GateIssue.NARRATIVE_VALUE_MISMATCH);
            assertThat(issue.field()).isEqualTo("executive_summary");
            assertThat(issue.message()).contains("concluded_value").contains("$950,000").contains("$922,000");
            assertThat(issue.expected()).isEqualTo(922_000);
            assertThat(issue.actual()).isEqualTo(950_000);
            assertThat(issue.snippet()).isEqualTo("$950,000");
        });
    }

    @Test
    void acceptsNarrativeAmountWithinTolerance() {
        GateResult result = gate.evaluate(GateFixtures.withSection(
                "executive_summary", "The concluded value of the business is $925,000 as of year end."));

        assertThat(result.passed()).isTrue();
    }

    @Test
    void blocksOnWeightMismatch() {
        ValuationFigures shown = GateFixtures.withWeights(ValuationFigures.fromEngine(ENGINE), 0.30, 0.30, 0.40);

        GateResult result = gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections()));

        assertThat(result.errors())
                .extracting(GateIssue::field)
                .containsExactly("asset_weight", "income_weight");
    }

    @Test
    void figuresTheReportDoesNotShowAreNotChecked() {
        GateResult result =
                gate.evaluate(GateFixtures.context(ValuationFigures.empty(), TestDataFactory.completeSections()));

        assertThat(result.passed()).isTrue();
    }

    @Test
    void balanceWarningWhenAssetsDoNotMatchLiabilitiesAndEquity() {
        BalanceSheet unbalanced =
                new BalanceSheet(100_000, 200_000, 0, 0, 300_000, 600_000, 50_000, 100_000, 300_000, List.of());

        assertThat(ConsistencyGate.balanceWarning(unbalanced))
                .hasValueSatisfying(w -> assertThat(w).contains("$600,000").contains("$400,000"));
        assertThat(ConsistencyGate.balanceWarning(TestDataFactory.balanceSheet())).isEmpty();
    }

    @Test
    void rejectsNonPositiveTolerance() {
        assertThatThrownBy(() -> new ConsistencyGate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
