/* (C)2026 */
package com.ammann.valuation.dto;

import com.ammann.valuation.model.ValuationReport;
import com.ammann.valuation.pass.PassRegistry;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.UUID;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary of a valuation report without the stored documents.
 */
@Schema(description = "Valuation report summary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportDTO(
        @Schema(description = "Report identifier")
        UUID id,

        @Schema(description = "Subject company name")
        String companyName,

        @Schema(description = "Lifecycle status", example = "processing")
        String status,

        @Schema(description = "Last completed pass, -1 before the first")
        int currentPass,

        @Schema(description = "Number of passes in the pipeline")
        int totalPasses,

        @Schema(description = "Progress percentage")
        int progress,

        @Schema(description = "Final concluded value once completed")
        Double concludedValue,

        @Schema(description = "Quality gate score once finalized")
        Double qualityScore,

        @Schema(description = "True when finalization was blocked by a validation gate")
        boolean blocked,

        @Schema(description = "Corrective action when blocked")
        String hint,

        @Schema(description = "Failure detail")
        String errorMessage,

        Instant createdAt,

        Instant completedAt
) {
    public static ReportDTO from(ValuationReport report, PassRegistry registry) {
        return new ReportDTO(
                report.id,
                report.companyName,
                report.status.wireName(),
                report.currentPass,
                registry.size(),
                registry.progressFor(report.status, report.currentPass, report.inFlight() != null),
                report.concludedValue,
                report.qualityScore,
                Boolean.TRUE.equals(report.blocked),
                report.blockHint,
                report.errorMessage,
                report.createdAt,
                report.completedAt);
    }
}
