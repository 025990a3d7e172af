/* (C)2026 */
package com.ammann.valuation.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Successful regeneration of a report from stored pass outputs")
public record RegenerationResponseDTO(
        boolean success,

        String message,

        ValuationSummaryDTO valuationSummary,

        @Schema(description = "Gate-by-gate diagnostics")
        List<GateDiagnosticDTO> gates,

        @Schema(description = "Narrative amounts replaced by calculated figures")
        int corrections
) {
    @Schema(description = "Headline figures of the regenerated report")
    public record ValuationSummaryDTO(
            double concludedValue, double low, double high, double qualityScore) {}
}
