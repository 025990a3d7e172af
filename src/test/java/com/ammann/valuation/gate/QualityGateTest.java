/* (C)2026 */
package com.ammann.valuation.gate;

import static com.ammann.valuation.gate.GateFixtures.ENGINE;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.valuation.reconciliation.ValuationFigures;
import com.ammann.valuation.support.TestDataFactory;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QualityGateTest {

    private final QualityGate gate = new QualityGate();

    @Test
    void completeReportScoresHigh() {
        GateResult result = gate.evaluate(GateFixtures.cleanContext());

        assertThat(result.passed()).isTrue();
        assertThat(result.metrics())
                .containsEntry("dataIntegrity", 100.0)
                .containsEntry("completeness", 100.0)
                .containsEntry("formatting", 100.0);
        assertThat(result.score()).isGreaterThan(95);
    }

    @Test
    void forbiddenTokenInReportDataBlocks() {
        GateContext context = TestDataFactory.gateContext(ENGINE,
                TestDataFactory.document(ENGINE, TestDataFactory.completeSections()),
                "{\"company_name\":\"Acme\",\"industry\":undefined}");

        GateResult result = gate.evaluate(context);

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).extracting(GateIssue::code).containsExactly("FORBIDDEN_TOKEN");
        assertThat(result.errors().get(0).snippet()).contains("undefined");
    }

    @Test
    void forbiddenTokenInNarrativeOnlyCostsScore() {
        GateResult result = gate.evaluate(GateFixtures.withSection("risk_assessment",
                TestDataFactory.sectionText(150) + " Customer churn was NaN in the last quarter."));

        assertThat(result.passed()).isTrue();
        assertThat(result.metrics().get("dataIntegrity")).isEqualTo(85.0);
        assertThat(result.warnings()).anyMatch(w -> w.contains("'risk_assessment' contains 'NaN' 1 time(s)"));
    }

    @Test
    void weightsThatDoNotSumToOneBlock() {
        ValuationFigures shown = GateFixtures.withWeights(ValuationFigures.fromEngine(ENGINE), 0.5, 0.5, 0.5);

        GateResult result = gate.evaluate(GateFixtures.context(shown, TestDataFactory.completeSections()));

        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).extracting(GateIssue::code).containsExactly("WEIGHTS_DO_NOT_SUM");
    }

    @Test
    void missingAndShortSectionsReduceCompleteness() {
        Map<String, String> sections = TestDataFactory.completeSections();
        sections.remove("executive_summary");
        sections.put("company_profile", "Too short.");

        GateResult result = gate.evaluate(GateFixtures.context(ValuationFigures.fromEngine(ENGINE), sections));

        assertThat(result.metrics().get("completeness")).isEqualTo(100.0 - 15 - 3);
        assertThat(result.warnings())
                .contains("Section 'executive_summary' is missing")
                .contains("Section 'company_profile' has 2 words, minimum is 200");
    }

    @Test
    void scoreBelowThresholdBlocks() {
        GateResult result = new QualityGate(80)
                .evaluate(GateFixtures.context(ValuationFigures.fromEngine(ENGINE), Map.of()));

        assertThat(result.metrics().get("completeness")).isZero();
        assertThat(result.passed()).isFalse();
        assertThat(result.errors()).extracting(GateIssue::code).containsExactly("QUALITY_BELOW_THRESHOLD");
    }

    @Test
    void notAvailableNextToCriticalFigureCostsFormatting() {
        GateResult result = gate.evaluate(GateFixtures.withSection("market_approach",
                TestDataFactory.sectionText(200) + " The market approach value is N/A for this engagement."));

        assertThat(result.metrics().get("formatting")).isEqualTo(80.0);
        assertThat(result.warnings()).anyMatch(w -> w.contains("N/A next to a critical figure"));
    }

    @Test
    void countsWords() {
        assertThat(QualityGate.wordCount("  one two\nthree  ")).isEqualTo(3);
        assertThat(QualityGate.wordCount("   ")).isZero();
    }
}
