/* (C)2026 */
package com.ammann.valuation.exception;

import com.ammann.valuation.dto.GateDiagnosticDTO;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions into
 * structured JSON error responses.
 *
 * <p>Pipeline rejections (missing passes, blocked gates) carry their structured detail so a
 * client can retry only the implicated pass. Unhandled exceptions are logged at ERROR level and
 * returned as HTTP 500 without internals.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    public static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof MissingPassesException missing) {
            LOG.debugf("Regeneration rejected for path %s: %s", path, missing.getMessage());
            ErrorResponse body = new ErrorResponse(
                    "MISSING_PASSES", missing.getMessage(), path, Response.Status.BAD_REQUEST.getStatusCode());
            body.success = false;
            body.availablePasses = missing.getAvailablePasses();
            body.missingPasses = missing.getMissingPasses();
            body.hint = missing.getHint();
            return Response.status(Response.Status.BAD_REQUEST).entity(body).build();
        }

        if (exception instanceof GateBlockedException blocked) {
            LOG.infof("Finalization blocked for path %s: %s", path, blocked.getMessage());
            ErrorResponse body = new ErrorResponse(
                    "GATE_BLOCKED", blocked.getMessage(), path, UNPROCESSABLE_ENTITY);
            body.success = false;
            body.gates = blocked.getGates();
            body.hint = blocked.getHint();
            return Response.status(UNPROCESSABLE_ENTITY).entity(body).build();
        }

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof ReportNotFoundException || exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof ReportStateException) {
            return createResponse(
                    Response.Status.CONFLICT,
                    exception.getMessage(),
                    "INVALID_STATE",
                    path
            );
        }

        if (exception instanceof GenerativeServiceException) {
            LOG.warnf("Generative service error: %s", exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "GENERATIVE_SERVICE_ERROR",
                    path
            );
        }

        if (exception instanceof SomeThingWentWrongException) {
            LOG.error("Internal error on path " + path, exception);
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "INTERNAL_ERROR",
                    path
            );
        }

        if (exception instanceof WebApplicationException web) {
            int status = web.getResponse().getStatus();
            ErrorResponse body = new ErrorResponse("HTTP_" + status, exception.getMessage(), path, status);
            return Response.status(status).entity(body).build();
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error response body returned to API clients.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;
        public Boolean success;
        public List<Integer> availablePasses;
        public List<Integer> missingPasses;
        public String hint;
        public List<GateDiagnosticDTO> gates;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
