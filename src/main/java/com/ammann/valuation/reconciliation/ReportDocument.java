/* (C)2026 */
package com.ammann.valuation.reconciliation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final merged report as persisted in {@code report_data}.
 *
 * @param valueSource {@code calculation_engine} when the engine ran, otherwise the fallback used
 * @param sections narrative sections after drift correction, in pass order
 * @param corrections narrative amounts replaced by authoritative figures
 * @param warnings engine warnings carried into the report
 */
public record ReportDocument(
        String companyName,
        String naicsCode,
        String industryName,
        String valueSource,
        ValuationFigures valuation,
        FinancialSummary financials,
        Map<String, String> sections,
        List<Correction> corrections,
        List<String> warnings) {

    public static final String SOURCE_ENGINE = "calculation_engine";
    public static final String SOURCE_FALLBACK = "narrative_and_extraction";

    public ReportDocument {
        sections = sections == null ? Map.of() : new LinkedHashMap<>(sections);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
