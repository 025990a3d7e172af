/* (C)2026 */
package com.ammann.valuation.resource;

import com.ammann.valuation.dto.AdvanceResponseDTO;
import com.ammann.valuation.dto.CreateReportRequestDTO;
import com.ammann.valuation.dto.ReportDTO;
import com.ammann.valuation.dto.ReportStatusDTO;
import com.ammann.valuation.exception.GlobalExceptionHandler;
import com.ammann.valuation.pipeline.AdvanceResult;
import com.ammann.valuation.pipeline.PipelineOrchestrator;
import com.ammann.valuation.properties.ApiProperties;
import com.ammann.valuation.service.ReportService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for valuation reports.
 *
 * <p>A client creates a report and then calls {@code advance} repeatedly, or lets the scheduler
 * do it; every call moves the pipeline by at most one step and returns the current progress.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Reports.BASE)
@Tag(name = "Reports API", description = "Valuation report lifecycle and pipeline progress")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ReportResource {

    private static final Logger LOG = Logger.getLogger(ReportResource.class);

    @Inject ReportService reportService;

    @Inject PipelineOrchestrator orchestrator;

    @POST
    @Operation(summary = "Create Report", description = "Creates a pending valuation report for a company")
    @APIResponses({
        @APIResponse(
                responseCode = "201",
                description = "Report created",
                content = @Content(schema = @Schema(implementation = ReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid company name")
    })
    public Response create(@Valid @NotNull CreateReportRequestDTO request) {
        ReportDTO report = reportService.create(request.companyName());
        return Response.created(URI.create(ApiProperties.BASE_URL_V1 + ApiProperties.Reports.BASE + "/" + report.id()))
                .entity(report)
                .build();
    }

    @GET
    @Operation(summary = "List Reports", description = "Returns the most recently created reports")
    @APIResponse(responseCode = "200", description = "Reports retrieved successfully")
    public Response list(@QueryParam("limit") @DefaultValue("20") @Min(1) @Max(200) int limit) {
        List<ReportDTO> reports = reportService.recent(limit);
        LOG.debugf("Listed %d reports (limit=%d)", reports.size(), limit);
        return Response.ok(reports).build();
    }

    @GET
    @Path(ApiProperties.Reports.BY_ID)
    @Operation(summary = "Get Report", description = "Returns a report with its pipeline state")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report found",
                content = @Content(schema = @Schema(implementation = ReportDTO.class))),
        @APIResponse(responseCode = "404", description = "Report not found")
    })
    public Response get(@PathParam("id") UUID id) {
        return Response.ok(reportService.get(id)).build();
    }

    @POST
    @Path(ApiProperties.Reports.ADVANCE)
    @Operation(
            summary = "Advance Pipeline",
            description = "Starts, polls or completes the next pass, or finalizes the report after the last pass")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Pipeline advanced",
                content = @Content(schema = @Schema(implementation = AdvanceResponseDTO.class))),
        @APIResponse(responseCode = "404", description = "Report not found"),
        @APIResponse(
                responseCode = "422",
                description = "Finalization blocked by a validation gate",
                content = @Content(schema = @Schema(implementation = AdvanceResponseDTO.class)))
    })
    public Response advance(@PathParam("id") UUID id) {
        AdvanceResult result = orchestrator.advance(id);
        AdvanceResponseDTO body = AdvanceResponseDTO.from(result);
        if (result.blocked()) {
            LOG.infof("Report %s blocked at finalization: %s", id, result.hint());
            return Response.status(GlobalExceptionHandler.UNPROCESSABLE_ENTITY).entity(body).build();
        }
        return Response.ok(body).build();
    }

    @GET
    @Path(ApiProperties.Reports.STATUS)
    @Operation(summary = "Report Status", description = "Returns status, current pass and progress percentage")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Status retrieved",
                content = @Content(schema = @Schema(implementation = ReportStatusDTO.class))),
        @APIResponse(responseCode = "404", description = "Report not found")
    })
    public Response status(@PathParam("id") UUID id) {
        return Response.ok(reportService.status(id)).build();
    }

    @POST
    @Path(ApiProperties.Reports.CANCEL)
    @Operation(summary = "Cancel Report", description = "Cancels a pending or processing report")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Report cancelled"),
        @APIResponse(responseCode = "404", description = "Report not found"),
        @APIResponse(responseCode = "409", description = "Report already finished")
    })
    public Response cancel(@PathParam("id") UUID id) {
        return Response.ok(reportService.cancel(id)).build();
    }
}
