/* (C)2026 */
package com.ammann.valuation.exception;

import com.ammann.valuation.dto.GateDiagnosticDTO;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsMissingPassesToBadRequestWithDetail()
    {
        Response response = handler.toResponse(new MissingPassesException(
                List.of(0, 1, 2, 3, 4, 5), List.of(6, 7), "Run pass 6 (write_executive_summary) first"));

        assertThat(response.getStatus()).isEqualTo(400);
        GlobalExceptionHandler.ErrorResponse body = body(response);
        assertThat(body.code).isEqualTo("MISSING_PASSES");
        assertThat(body.success).isFalse();
        assertThat(body.availablePasses).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(body.missingPasses).containsExactly(6, 7);
        assertThat(body.hint).isEqualTo("Run pass 6 (write_executive_summary) first");
        assertThat(body.message).contains("[6, 7]");
    }

    @Test
    void mapsGateBlockToUnprocessableEntity()
    {
        GateDiagnosticDTO industry = new GateDiagnosticDTO("industry", false, 75, List.of(), List.of(), Map.of());

        Response response = handler.toResponse(
                new GateBlockedException("Regeneration blocked by the industry gate", List.of(industry), "Re-run pass 8"));

        assertThat(response.getStatus()).isEqualTo(422);
        GlobalExceptionHandler.ErrorResponse body = body(response);
        assertThat(body.code).isEqualTo("GATE_BLOCKED");
        assertThat(body.gates).containsExactly(industry);
        assertThat(body.hint).isEqualTo("Re-run pass 8");
        assertThat(body.status).isEqualTo(422);
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(new ValidationException("weights must sum to 1"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        assertThat(body(response).code).isEqualTo("VALIDATION_ERROR");
        assertThat(body(response).path).isNull();
    }

    @Test
    void mapsUnknownReportAndUnknownRouteToNotFound()
    {
        Response report = handler.toResponse(new ReportNotFoundException(UUID.randomUUID()));
        Response route = handler.toResponse(new NotFoundException("missing"));

        assertThat(report.getStatus()).isEqualTo(404);
        assertThat(body(report).message).startsWith("Report not found: ");
        assertThat(route.getStatus()).isEqualTo(404);
        assertThat(body(route).code).isEqualTo("NOT_FOUND");
    }

    @Test
    void mapsInvalidStateToConflict()
    {
        Response response = handler.toResponse(new ReportStateException("Report is completed and cannot be cancelled"));

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(body(response).code).isEqualTo("INVALID_STATE");
    }

    @Test
    void mapsGenerativeServiceErrorToServiceUnavailable()
    {
        Response response = handler.toResponse(new GenerativeServiceException("upstream timeout"));

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(body(response).code).isEqualTo("GENERATIVE_SERVICE_ERROR");
        assertThat(body(response).message).contains("upstream timeout");
    }

    @Test
    void keepsStatusOfWebApplicationException()
    {
        Response response = handler.toResponse(new WebApplicationException("not acceptable", 406));

        assertThat(response.getStatus()).isEqualTo(406);
        assertThat(body(response).code).isEqualTo("HTTP_406");
    }

    @Test
    void mapsInternalErrorsTo500()
    {
        Response internal = handler.toResponse(
                new SomeThingWentWrongException("Could not serialize report", new IllegalStateException()));
        Response unhandled = handler.toResponse(new RuntimeException("boom"));

        assertThat(internal.getStatus()).isEqualTo(500);
        assertThat(body(internal).message).isEqualTo("Could not serialize report");
        assertThat(unhandled.getStatus()).isEqualTo(500);
        assertThat(body(unhandled).message).isEqualTo("An unexpected error occurred");
    }

    private static GlobalExceptionHandler.ErrorResponse body(Response response)
    {
        return (GlobalExceptionHandler.ErrorResponse) response.getEntity();
    }
}
