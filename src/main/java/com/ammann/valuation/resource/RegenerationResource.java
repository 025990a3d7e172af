/* (C)2026 */
package com.ammann.valuation.resource;

import com.ammann.valuation.dto.RegenerationEligibilityDTO;
import com.ammann.valuation.dto.RegenerationResponseDTO;
import com.ammann.valuation.properties.ApiProperties;
import com.ammann.valuation.service.RegenerationService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Rebuilds a report from stored pass outputs without new generative calls.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Reports.BASE + ApiProperties.Reports.REGENERATE)
@Tag(name = "Regeneration API", description = "Report regeneration from stored pass outputs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RegenerationResource {

    @Inject RegenerationService regenerationService;

    @GET
    @Operation(
            summary = "Regeneration Eligibility",
            description = "Lists available and missing passes and the next pass to run")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Eligibility computed",
                content = @Content(schema = @Schema(implementation = RegenerationEligibilityDTO.class))),
        @APIResponse(responseCode = "404", description = "Report not found")
    })
    public Response eligibility(@PathParam("id") UUID id) {
        return Response.ok(regenerationService.eligibility(id)).build();
    }

    @POST
    @Operation(
            summary = "Regenerate Report",
            description = "Re-runs engine, reconciliation and validation gates over the stored pass outputs")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report regenerated",
                content = @Content(schema = @Schema(implementation = RegenerationResponseDTO.class))),
        @APIResponse(responseCode = "400", description = "Required passes are missing"),
        @APIResponse(responseCode = "404", description = "Report not found"),
        @APIResponse(responseCode = "409", description = "A pass is still running or the report was cancelled"),
        @APIResponse(responseCode = "422", description = "A validation gate blocked the regenerated report")
    })
    public Response regenerate(@PathParam("id") UUID id) {
        return Response.ok(regenerationService.regenerate(id)).build();
    }
}
