/* (C)2026 */
package com.ammann.valuation.dto;

import com.ammann.valuation.pipeline.AdvanceResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Result of one pipeline advance")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdvanceResponseDTO(
        @Schema(description = "Lifecycle status after the call", example = "processing")
        String status,

        @Schema(description = "Last completed pass, -1 before the first")
        int pass,

        int totalPasses,

        int progress,

        String message,

        @Schema(description = "Present and true when finalization was blocked")
        Boolean blocked,

        @Schema(description = "Corrective action when blocked")
        String hint,

        @Schema(description = "Gate diagnostics when the call finalized the report")
        List<GateDiagnosticDTO> gates
) {
    public static AdvanceResponseDTO from(AdvanceResult result) {
        return new AdvanceResponseDTO(
                result.status().wireName(),
                result.pass(),
                result.totalPasses(),
                result.progress(),
                result.message(),
                result.blocked() ? Boolean.TRUE : null,
                result.hint(),
                result.gates() == null ? null : GateDiagnosticDTO.fromChain(result.gates()));
    }
}
