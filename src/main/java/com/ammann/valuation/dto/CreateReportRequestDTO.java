/* (C)2026 */
package com.ammann.valuation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Request to create a valuation report")
public record CreateReportRequestDTO(
        @Schema(description = "Subject company name", example = "Acme Engineering LLC")
        @NotBlank
        @Size(max = 255)
        String companyName
) {}
