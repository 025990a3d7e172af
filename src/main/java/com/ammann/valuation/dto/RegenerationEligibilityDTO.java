/* (C)2026 */
package com.ammann.valuation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Whether a report can be rebuilt from its stored pass outputs")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegenerationEligibilityDTO(
        boolean canRegenerate,

        @Schema(description = "Passes with stored output")
        List<Integer> availablePasses,

        @Schema(description = "Required passes without stored output")
        List<Integer> missingPasses,

        @Schema(description = "Lowest missing pass")
        Integer nextRequiredPass,

        String hint
) {}
