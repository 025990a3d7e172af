/* (C)2026 */
package com.ammann.valuation.dto;

import com.ammann.valuation.gate.GateChainResult;
import com.ammann.valuation.gate.GateIssue;
import com.ammann.valuation.gate.GateResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Gate-by-gate diagnostics returned when a report is finalized, regenerated or blocked.
 */
@Schema(description = "Verdict of one validation gate")
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GateDiagnosticDTO(
        @Schema(description = "Gate kind", example = "consistency")
        String gate,

        @Schema(description = "False when the gate blocks finalization")
        boolean passed,

        @Schema(description = "Gate score from 0 to 100")
        double score,

        @Schema(description = "Blocking findings with field, expected/actual values or offending snippet")
        List<GateIssue> blockingErrors,

        @Schema(description = "Non-blocking findings")
        List<String> warnings,

        @Schema(description = "Gate-specific figures such as category scores")
        Map<String, Double> metrics
) {
    public static GateDiagnosticDTO from(GateResult result) {
        return new GateDiagnosticDTO(
                result.gate().wireName(),
                result.passed(),
                result.score(),
                result.errors(),
                result.warnings(),
                result.metrics());
    }

    public static List<GateDiagnosticDTO> fromChain(GateChainResult chain) {
        return chain.results().stream().map(GateDiagnosticDTO::from).toList();
    }
}
