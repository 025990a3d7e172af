/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.enumeration.GateKind;
import java.util.List;
import java.util.Map;

/**
 * Verdict of one gate.
 *
 * @param passed false when finalization must be blocked
 * @param score 0 to 100
 * @param errors blocking findings
 * @param warnings findings that do not block
 * @param metrics gate-specific numbers such as category scores
 */
public record GateResult(
        GateKind gate,
        boolean passed,
        double score,
        List<GateIssue> errors,
        List<String> warnings,
        Map<String, Double> metrics) {

    public GateResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        score = Math.max(0, Math.min(100, score));
    }

    public boolean blocking() {
        return !passed;
    }
}
