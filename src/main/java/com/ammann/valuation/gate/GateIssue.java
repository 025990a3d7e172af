/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.CalculationMath;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Blocking finding of a gate with enough detail to target a retry.
 *
 * @param code machine-readable kind of finding
 * @param field report field or section concerned, may be null
 * @param message human-readable description
 * @param expected authoritative value for numeric findings
 * @param actual observed value for numeric findings
 * @param snippet offending text for textual findings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateIssue(
        String code, String field, String message, Double expected, Double actual, String snippet) {

    public static final String NARRATIVE_VALUE_MISMATCH = "NARRATIVE_VALUE_MISMATCH";

    public static GateIssue of(String code, String message) {
        return new GateIssue(code, null, message, null, null, null);
    }

    public static GateIssue mismatch(String field, double expected, double actual) {
        String message = String.format(
                "%s mismatch: report shows %s, calculation engine computed %s (%.2f%% off)",
                field,
                CalculationMath.formatCurrency(actual),
                CalculationMath.formatCurrency(expected),
                CalculationMath.relativeDifference(actual, expected) * 100);
        return new GateIssue("VALUE_MISMATCH", field, message, expected, actual, null);
    }

    public static GateIssue narrativeMismatch(
            String section, String field, double expected, double actual, String statedText) {
        String message = String.format(
                "Section '%s' states %s as %s, calculation engine computed %s (%.2f%% off)",
                section,
                field,
                CalculationMath.formatCurrency(actual),
                CalculationMath.formatCurrency(expected),
                CalculationMath.relativeDifference(actual, expected) * 100);
        return new GateIssue(NARRATIVE_VALUE_MISMATCH, section, message, expected, actual, statedText);
    }

    public static GateIssue weightMismatch(String field, double expected, double actual) {
        String message = String.format(
                "%s mismatch: report shows %s, calculation engine used %s",
                field, CalculationMath.formatPercentage(actual), CalculationMath.formatPercentage(expected));
        return new GateIssue("WEIGHT_MISMATCH", field, message, expected, actual, null);
    }

    public static GateIssue industryViolation(IndustryViolation violation) {
        return new GateIssue(
                "WRONG_INDUSTRY_KEYWORD",
                violation.section(),
                "Section '" + violation.section() + "' mentions '" + violation.keyword()
                        + "', which does not belong to the classified industry",
                null,
                null,
                violation.snippet());
    }
}
