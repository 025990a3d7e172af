/* (C)2026 */
package com.ammann.valuation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Lightweight status for polling clients.
 */
@Schema(description = "Pipeline status of a report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportStatusDTO(
        @Schema(description = "Lifecycle status", example = "processing")
        String status,

        @Schema(description = "Last completed pass, -1 before the first")
        int pass,

        int totalPasses,

        @Schema(description = "Progress percentage from the static pass table")
        int progress,

        @Schema(description = "What the pipeline is doing", example = "Extracting balance sheet...")
        String message,

        Double concludedValue,

        String errorMessage,

        Boolean blocked,

        String hint
) {}
