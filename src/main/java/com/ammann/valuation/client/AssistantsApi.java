/* (C)2026 */
package com.ammann.valuation.client;

import com.ammann.valuation.client.AssistantsPayloads.CreateThreadAndRunRequest;
import com.ammann.valuation.client.AssistantsPayloads.MessageList;
import com.ammann.valuation.client.AssistantsPayloads.RunResponse;
import com.ammann.valuation.client.AssistantsPayloads.SubmitToolOutputsRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Run endpoints of the generative text service. Base URL from
 * {@code quarkus.rest-client.generative-api.url}.
 */
@RegisterRestClient(configKey = "generative-api")
@ClientHeaderParam(name = "OpenAI-Beta", value = "assistants=v2")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface AssistantsApi {

    @POST
    @Path("/threads/runs")
    RunResponse createThreadAndRun(
            @HeaderParam("Authorization") String authorization, CreateThreadAndRunRequest request);

    @GET
    @Path("/threads/{threadId}/runs/{runId}")
    RunResponse getRun(
            @HeaderParam("Authorization") String authorization,
            @PathParam("threadId") String threadId,
            @PathParam("runId") String runId);

    @POST
    @Path("/threads/{threadId}/runs/{runId}/submit_tool_outputs")
    RunResponse submitToolOutputs(
            @HeaderParam("Authorization") String authorization,
            @PathParam("threadId") String threadId,
            @PathParam("runId") String runId,
            SubmitToolOutputsRequest request);

    @POST
    @Path("/threads/{threadId}/runs/{runId}/cancel")
    RunResponse cancelRun(
            @HeaderParam("Authorization") String authorization,
            @PathParam("threadId") String threadId,
            @PathParam("runId") String runId);

    @GET
    @Path("/threads/{threadId}/messages")
    MessageList listMessages(
            @HeaderParam("Authorization") String authorization,
            @PathParam("threadId") String threadId,
            @QueryParam("order") String order,
            @QueryParam("limit") int limit);
}
