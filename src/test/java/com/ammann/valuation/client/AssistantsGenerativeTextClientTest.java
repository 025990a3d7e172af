/* (C)2026 */
package com.ammann.valuation.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.valuation.client.AssistantsPayloads.CreateThreadAndRunRequest;
import com.ammann.valuation.client.AssistantsPayloads.FunctionCall;
import com.ammann.valuation.client.AssistantsPayloads.LastError;
import com.ammann.valuation.client.AssistantsPayloads.MessageContent;
import com.ammann.valuation.client.AssistantsPayloads.MessageList;
import com.ammann.valuation.client.AssistantsPayloads.MessageText;
import com.ammann.valuation.client.AssistantsPayloads.RequiredAction;
import com.ammann.valuation.client.AssistantsPayloads.RunResponse;
import com.ammann.valuation.client.AssistantsPayloads.SubmitToolOutputs;
import com.ammann.valuation.client.AssistantsPayloads.ThreadMessage;
import com.ammann.valuation.client.AssistantsPayloads.ToolCallPayload;
import com.ammann.valuation.enumeration.RunStatus;
import com.ammann.valuation.exception.GenerativeServiceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.ws.rs.ProcessingException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AssistantsGenerativeTextClientTest {

    private static final RunHandle HANDLE = new RunHandle("thread-1", "run-1");

    private AssistantsApi api;
    private AssistantsGenerativeTextClient client;

    @BeforeEach
    void setUp() {
        api = mock(AssistantsApi.class);
        client = configuredClient(Optional.of("secret"), Optional.of("asst_1"));
    }

    @Test
    void startRunForcesTheFunctionAndAddsResearchTool() {
        when(api.createThreadAndRun(anyString(), any()))
                .thenReturn(new RunResponse("run-1", "thread-1", "queued", null, null));

        RunHandle handle = client.startRun(new JobRequest(
                0, "research_company_background", "instructions", "context", true, 4000, 0.3));

        assertThat(handle).isEqualTo(HANDLE);
        ArgumentCaptor<CreateThreadAndRunRequest> body = ArgumentCaptor.forClass(CreateThreadAndRunRequest.class);
        verify(api).createThreadAndRun(eq("Bearer secret"), body.capture());
        assertThat(body.getValue().assistantId()).isEqualTo("asst_1");
        assertThat(body.getValue().tools()).extracting(AssistantsPayloads.Tool::type)
                .containsExactly("file_search", "function");
        assertThat(body.getValue().maxCompletionTokens()).isEqualTo(4000);
    }

    @Test
    void startRunWithoutIdentifiersFails() {
        when(api.createThreadAndRun(anyString(), any()))
                .thenReturn(new RunResponse(null, null, "queued", null, null));

        assertThatThrownBy(() -> client.startRun(new JobRequest(3, "extract_balance_sheet_details", "i", "c", false, 100, 0.1)))
                .isInstanceOf(GenerativeServiceException.class)
                .hasMessage("Run creation returned no identifiers for pass 3");
    }

    @Test
    void snapshotCarriesToolCallsAndLastError() {
        RequiredAction action = new RequiredAction("submit_tool_outputs", new SubmitToolOutputs(List.of(
                new ToolCallPayload("call-1", "function", new FunctionCall("extract_core_company_data", "{\"a\":1}")))));
        when(api.getRun("Bearer secret", "thread-1", "run-1"))
                .thenReturn(new RunResponse("run-1", "thread-1", "requires_action", action, new LastError("x", "none")));

        RunSnapshot snapshot = client.getRun(HANDLE);

        assertThat(snapshot.status()).isEqualTo(RunStatus.REQUIRES_ACTION);
        assertThat(snapshot.toolCalls())
                .containsExactly(new ToolCall("call-1", "extract_core_company_data", "{\"a\":1}"));
        assertThat(snapshot.lastError()).isEqualTo("none");
    }

    @Test
    void unknownRunStatusIsAServiceError() {
        when(api.getRun(anyString(), anyString(), anyString()))
                .thenReturn(new RunResponse("run-1", "thread-1", "paused", null, null));

        assertThatThrownBy(() -> client.getRun(HANDLE))
                .isInstanceOf(GenerativeServiceException.class)
                .hasMessage("Unknown run status 'paused'");
    }

    @Test
    void latestResponseTextJoinsAssistantTextParts() {
        ThreadMessage message = new ThreadMessage("msg-1", "assistant", List.of(
                new MessageContent("text", new MessageText("{\"content\":")),
                new MessageContent("image_file", null),
                new MessageContent("text", new MessageText("\"ok\"}"))));
        when(api.listMessages("Bearer secret", "thread-1", "desc", 1)).thenReturn(new MessageList(List.of(message)));

        assertThat(client.latestResponseText(HANDLE)).contains("{\"content\":\"ok\"}");
    }

    @Test
    void latestResponseTextIgnoresUserMessages() {
        ThreadMessage message = new ThreadMessage("msg-1", "user", List.of(
                new MessageContent("text", new MessageText("question"))));
        when(api.listMessages(anyString(), anyString(), anyString(), anyInt())).thenReturn(new MessageList(List.of(message)));

        assertThat(client.latestResponseText(HANDLE)).isEmpty();
    }

    @Test
    void transportErrorsOpenTheCircuitAfterFiveFailures() {
        when(api.getRun(anyString(), anyString(), anyString())).thenThrow(new ProcessingException("connection refused"));

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> client.getRun(HANDLE))
                    .isInstanceOf(GenerativeServiceException.class)
                    .hasMessage("Generative service get_run failed: connection refused");
        }

        assertThat(client.isAvailable()).isFalse();
        assertThatThrownBy(() -> client.getRun(HANDLE))
                .isInstanceOf(GenerativeServiceException.class)
                .hasMessage("Circuit breaker open, skipping get_run");
        verify(api, times(5)).getRun(anyString(), anyString(), anyString());
    }

    @Test
    void unconfiguredClientIsUnavailable() {
        AssistantsGenerativeTextClient unconfigured = configuredClient(Optional.of(" "), Optional.empty());

        assertThat(unconfigured.isAvailable()).isFalse();
        assertThatThrownBy(() -> unconfigured.startRun(new JobRequest(0, "f", "i", "c", false, 10, 0.1)))
                .isInstanceOf(GenerativeServiceException.class)
                .hasMessage("valuation.generative.assistant-id is not configured");
    }

    private AssistantsGenerativeTextClient configuredClient(Optional<String> apiKey, Optional<String> assistantId) {
        AssistantsGenerativeTextClient created = new AssistantsGenerativeTextClient(
                api, new SimpleMeterRegistry(), apiKey, assistantId, Optional.empty(), "file_search");
        created.initMetrics();
        return created;
    }
}
