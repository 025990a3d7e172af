/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.enumeration.PassKind;
import com.ammann.valuation.enumeration.ReportStatus;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Static table of the pipeline passes, their dependencies and budgets.
 *
 * <p>The table is validated on construction: numbers are contiguous from 0, dependencies only
 * point to lower-numbered passes and progress strictly increases.
 */
@ApplicationScoped
public class PassRegistry {

    static final int RESEARCH_TOKENS = 4_000;
    static final int EXTRACTION_TOKENS = 4_000;
    static final int NARRATIVE_TOKENS = 6_000;

    private final List<PassDefinition> passes;

    public PassRegistry() {
        this(standardPasses());
    }

    PassRegistry(List<PassDefinition> passes) {
        validate(passes);
        this.passes = List.copyOf(passes);
    }

    public int size() {
        return passes.size();
    }

    public int lastPassNumber() {
        return passes.size() - 1;
    }

    public List<PassDefinition> all() {
        return passes;
    }

    /**
     * @throws IllegalArgumentException if no pass has this number
     */
    public PassDefinition get(int number) {
        return find(number).orElseThrow(() -> new IllegalArgumentException("Unknown pass " + number));
    }

    public Optional<PassDefinition> find(int number) {
        if (number < 0 || number >= passes.size()) {
            return Optional.empty();
        }
        return Optional.of(passes.get(number));
    }

    public List<PassDefinition> byKind(PassKind kind) {
        return passes.stream().filter(p -> p.kind() == kind).toList();
    }

    public List<PassDefinition> narrativePasses() {
        return byKind(PassKind.NARRATIVE);
    }

    /** Minimum word count per narrative section key, in pass order. */
    public Map<String, Integer> minimumWordsBySection() {
        Map<String, Integer> minimums = new LinkedHashMap<>();
        narrativePasses().forEach(p -> minimums.put(p.sectionKey(), p.minWords()));
        return minimums;
    }

    /** Narrative pass that writes the given section. */
    public Optional<PassDefinition> passForSection(String sectionKey) {
        return narrativePasses().stream()
                .filter(p -> p.sectionKey().equals(sectionKey))
                .findFirst();
    }

    /**
     * Passes whose stored output is needed to rebuild a report without the generative service.
     * Research output is context only and not required.
     */
    public List<Integer> requiredForRegeneration() {
        return passes.stream()
                .filter(p -> p.kind() != PassKind.RESEARCH)
                .map(PassDefinition::number)
                .toList();
    }

    /**
     * Progress percentage reported while the given pass is running; 0 before the first pass and
     * 100 past the last.
     */
    public int progressFor(int passNumber) {
        if (passNumber < 0) {
            return 0;
        }
        if (passNumber >= passes.size()) {
            return 100;
        }
        return passes.get(passNumber).progress();
    }

    /**
     * Progress shown for a report: 0 while pending, the in-flight pass while processing (the last
     * completed pass when nothing is in flight), 100 when completed, and the last completed pass
     * for failed or cancelled reports.
     */
    public int progressFor(ReportStatus status, int currentPass, boolean jobInFlight) {
        return switch (status) {
            case PENDING -> 0;
            case COMPLETED -> 100;
            case PROCESSING -> jobInFlight
                    ? progressFor(currentPass + 1)
                    : progressFor(Math.min(currentPass, lastPassNumber()));
            default -> progressFor(currentPass);
        };
    }

    static void validate(List<PassDefinition> passes) {
        if (passes == null || passes.isEmpty()) {
            throw new IllegalArgumentException("Pass registry must not be empty");
        }
        int previousProgress = -1;
        for (int i = 0; i < passes.size(); i++) {
            PassDefinition pass = passes.get(i);
            if (pass.number() != i) {
                throw new IllegalArgumentException(
                        "Pass numbers must be contiguous from 0, found " + pass.number() + " at index " + i);
            }
            for (int dependency : pass.dependencies()) {
                if (dependency < 0 || dependency >= i) {
                    throw new IllegalArgumentException(
                            "Pass " + i + " depends on " + dependency + ", which is not an earlier pass");
                }
            }
            if (pass.progress() <= previousProgress || pass.progress() > 100) {
                throw new IllegalArgumentException("Progress must strictly increase, pass " + i);
            }
            previousProgress = pass.progress();
        }
    }

    static List<PassDefinition> standardPasses() {
        List<Integer> research = List.of(0);
        List<Integer> extraction = IntStream.rangeClosed(0, 5).boxed().toList();

        List<PassDefinition> passes = new ArrayList<>();
        passes.add(new PassDefinition(0, "research_company_background", PassKind.RESEARCH,
                "Researching company background...", 3, List.of(), RESEARCH_TOKENS, 0.3, null, 0));

        passes.add(extraction(1, "extract_core_company_data", "Extracting core company data...", 8, research));
        passes.add(extraction(2, "extract_income_statement_details", "Extracting income statement...", 13, research));
        passes.add(extraction(3, "extract_balance_sheet_details", "Extracting balance sheet...", 18, research));
        passes.add(extraction(4, "extract_special_items", "Extracting special items...", 23, research));
        passes.add(extraction(5, "extract_business_metrics", "Extracting business metrics...", 28, research));

        passes.add(narrative(6, "write_executive_summary", "Writing executive summary...", 34,
                extraction, "executive_summary", 400, 8_000));
        passes.add(narrative(7, "write_company_profile", "Writing company profile...", 40,
                extraction, "company_profile", 200, NARRATIVE_TOKENS));
        passes.add(narrative(8, "write_industry_analysis", "Writing industry analysis...", 46,
                extraction, "industry_analysis", 150, NARRATIVE_TOKENS));
        passes.add(narrative(9, "write_financial_analysis", "Writing financial analysis...", 52,
                extraction, "financial_analysis", 300, NARRATIVE_TOKENS));
        passes.add(narrative(10, "write_asset_approach_analysis", "Writing asset approach analysis...", 58,
                extraction, "asset_approach", 100, NARRATIVE_TOKENS));
        passes.add(narrative(11, "write_income_approach_analysis", "Writing income approach analysis...", 64,
                extraction, "income_approach", 150, NARRATIVE_TOKENS));
        passes.add(narrative(12, "write_market_approach_analysis", "Writing market approach analysis...", 70,
                extraction, "market_approach", 200, NARRATIVE_TOKENS));
        passes.add(narrative(13, "write_risk_assessment", "Writing risk assessment...", 76,
                extraction, "risk_assessment", 150, NARRATIVE_TOKENS));
        passes.add(narrative(14, "write_strategic_insights", "Writing strategic insights...", 82,
                extraction, "strategic_insights", 150, NARRATIVE_TOKENS));
        passes.add(narrative(15, "write_valuation_reconciliation", "Writing valuation reconciliation...", 88,
                extraction, "valuation_reconciliation", 50, NARRATIVE_TOKENS));
        passes.add(narrative(16, "write_discounts_and_premiums", "Writing discounts and premiums...", 94,
                extraction, "discounts_and_premiums", 100, NARRATIVE_TOKENS));
        passes.add(narrative(17, "write_assumptions_and_limiting_conditions", "Writing assumptions...", 98,
                extraction, "assumptions_and_limiting_conditions", 100, NARRATIVE_TOKENS));
        return passes;
    }

    private static PassDefinition extraction(
            int number, String key, String description, int progress, List<Integer> dependencies) {
        return new PassDefinition(number, key, PassKind.EXTRACTION, description, progress,
                dependencies, EXTRACTION_TOKENS, 0.1, null, 0);
    }

    private static PassDefinition narrative(
            int number, String key, String description, int progress, List<Integer> dependencies,
            String sectionKey, int minWords, int maxTokens) {
        return new PassDefinition(number, key, PassKind.NARRATIVE, description, progress,
                dependencies, maxTokens, 0.4, sectionKey, minWords);
    }
}
