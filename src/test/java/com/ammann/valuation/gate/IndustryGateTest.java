/* (C)2026 */
package com.ammann.valuation.gate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class IndustryGateTest {

    private final IndustryGate gate = new IndustryGate();

    @Test
    void passesCleanNarrative() {
        GateResult result = gate.evaluate(GateFixtures.cleanContext());

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(100);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void blocksKeywordOfAnotherIndustry() {
        GateResult result = gate.evaluate(GateFixtures.withSection(
                "company_profile", "The company operates a busy restaurant downtown with seasonal staff."));

        assertThat(result.passed()).isFalse();
        assertThat(result.score()).isEqualTo(75);
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo("WRONG_INDUSTRY_KEYWORD");
            assertThat(issue.field()).isEqualTo("company_profile");
            assertThat(issue.snippet()).contains("busy restaurant downtown");
        });
    }

    @Test
    void matchesWholeWordsOnly() {
        // "Barbara" and "Springfield" contain blocked keywords as substrings
        assertThat(gate.findViolations("541330",
                Map.of("company_profile", "Founded by Barbara Springfield, the firm designs bridges.")))
                .isEmpty();
    }

    @Test
    void reportsEachKeywordOncePerSection() {
        assertThat(gate.findViolations("541330", Map.of(
                "executive_summary", "HVAC design and hvac retrofits, plus a hotel wing.")))
                .extracting(IndustryViolation::keyword)
                .containsExactlyInAnyOrder("hvac", "hotel");
    }

    @Test
    void unknownIndustrySkipsTheScan() {
        assertThat(gate.findViolations("999999", Map.of("company_profile", "A restaurant."))).isEmpty();
    }

    @Test
    void snippetIsCutAroundTheMatch() {
        String text = "x".repeat(80) + " spa " + "y".repeat(80);
        int start = text.indexOf("spa");

        String snippet = IndustryGate.snippet(text, start, start + 3);

        assertThat(snippet).startsWith("...").endsWith("...").contains(" spa ");
        assertThat(snippet).hasSize(3 + IndustryGate.SNIPPET_RADIUS * 2 + 3 + 3);
    }
}
