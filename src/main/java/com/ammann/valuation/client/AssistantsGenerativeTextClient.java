/* (C)2026 */
package com.ammann.valuation.client;

import com.ammann.valuation.client.AssistantsPayloads.CreateThreadAndRunRequest;
import com.ammann.valuation.client.AssistantsPayloads.FunctionSpec;
import com.ammann.valuation.client.AssistantsPayloads.Message;
import com.ammann.valuation.client.AssistantsPayloads.MessageContent;
import com.ammann.valuation.client.AssistantsPayloads.MessageList;
import com.ammann.valuation.client.AssistantsPayloads.RunResponse;
import com.ammann.valuation.client.AssistantsPayloads.SubmitToolOutputsRequest;
import com.ammann.valuation.client.AssistantsPayloads.ThreadMessage;
import com.ammann.valuation.client.AssistantsPayloads.ThreadSpec;
import com.ammann.valuation.client.AssistantsPayloads.Tool;
import com.ammann.valuation.client.AssistantsPayloads.ToolCallPayload;
import com.ammann.valuation.client.AssistantsPayloads.ToolChoice;
import com.ammann.valuation.client.AssistantsPayloads.ToolOutputPayload;
import com.ammann.valuation.enumeration.RunStatus;
import com.ammann.valuation.exception.GenerativeServiceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link GenerativeTextClient} backed by an assistants-style run API.
 *
 * <p>Adds to the raw REST client:
 * - a circuit breaker that short-circuits calls after repeated failures
 * - metrics for call outcomes and latency
 * - translation of every transport or HTTP error into {@link GenerativeServiceException}
 */
@ApplicationScoped
public class AssistantsGenerativeTextClient implements GenerativeTextClient {

    private static final Logger LOG = Logger.getLogger(AssistantsGenerativeTextClient.class);
    private static final int CIRCUIT_BREAKER_THRESHOLD = 5;
    private static final Duration CIRCUIT_BREAKER_RESET = Duration.ofMinutes(1);

    private final AssistantsApi api;
    private final MeterRegistry meterRegistry;
    private final Optional<String> apiKey;
    private final Optional<String> assistantId;
    private final Optional<String> model;
    private final String researchTool;

    private Counter callSuccessCounter;
    private Counter callFailureCounter;
    private Timer callTimer;

    // Circuit breaker state
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile long circuitOpenedAt = 0;

    @Inject
    public AssistantsGenerativeTextClient(
            @RestClient AssistantsApi api,
            MeterRegistry meterRegistry,
            @ConfigProperty(name = "valuation.generative.api-key") Optional<String> apiKey,
            @ConfigProperty(name = "valuation.generative.assistant-id") Optional<String> assistantId,
            @ConfigProperty(name = "valuation.generative.model") Optional<String> model,
            @ConfigProperty(name = "valuation.generative.research-tool", defaultValue = "file_search")
                    String researchTool) {
        this.api = api;
        this.meterRegistry = meterRegistry;
        this.apiKey = apiKey.filter(k -> !k.isBlank());
        this.assistantId = assistantId.filter(a -> !a.isBlank());
        this.model = model.filter(m -> !m.isBlank());
        this.researchTool = researchTool;

        if (this.apiKey.isEmpty() || this.assistantId.isEmpty()) {
            LOG.warn("Generative service not configured - passes cannot be started");
        }
    }

    @PostConstruct
    void initMetrics() {
        callSuccessCounter = Counter.builder("valuation_generative_call_success_total")
                .description("Successful generative service calls")
                .register(meterRegistry);
        callFailureCounter = Counter.builder("valuation_generative_call_failure_total")
                .description("Failed generative service calls")
                .register(meterRegistry);
        callTimer = Timer.builder("valuation_generative_call_duration")
                .description("Generative service call duration")
                .register(meterRegistry);
    }

    @Override
    public RunHandle startRun(JobRequest request) {
        String assistant = assistantId.orElseThrow(
                () -> new GenerativeServiceException("valuation.generative.assistant-id is not configured"));

        List<Tool> tools = new ArrayList<>();
        if (request.allowResearch()) {
            tools.add(new Tool(researchTool, null));
        }
        tools.add(Tool.function(request.functionName()));

        CreateThreadAndRunRequest body = new CreateThreadAndRunRequest(
                assistant,
                model.orElse(null),
                request.instructions(),
                new ThreadSpec(List.of(new Message("user", request.context()))),
                tools,
                new ToolChoice("function", new FunctionSpec(request.functionName())),
                request.maxTokens(),
                request.temperature());

        RunResponse run = call("start_run", () -> api.createThreadAndRun(authorization(), body));
        if (run == null || run.id() == null || run.threadId() == null) {
            recordFailure();
            throw new GenerativeServiceException("Run creation returned no identifiers for pass " + request.passNumber());
        }
        LOG.debugf("Started run %s on thread %s for pass %d", run.id(), run.threadId(), request.passNumber());
        return new RunHandle(run.threadId(), run.id());
    }

    @Override
    public RunSnapshot getRun(RunHandle handle) {
        return toSnapshot(call("get_run", () -> api.getRun(authorization(), handle.threadId(), handle.runId())));
    }

    @Override
    public RunSnapshot submitToolOutputs(RunHandle handle, List<ToolOutput> outputs) {
        SubmitToolOutputsRequest body = new SubmitToolOutputsRequest(outputs.stream()
                .map(o -> new ToolOutputPayload(o.toolCallId(), o.output()))
                .toList());
        return toSnapshot(call("submit_tool_outputs",
                () -> api.submitToolOutputs(authorization(), handle.threadId(), handle.runId(), body)));
    }

    @Override
    public Optional<String> latestResponseText(RunHandle handle) {
        MessageList messages = call("list_messages",
                () -> api.listMessages(authorization(), handle.threadId(), "desc", 1));
        if (messages == null || messages.data() == null) {
            return Optional.empty();
        }
        for (ThreadMessage message : messages.data()) {
            if (!"assistant".equals(message.role()) || message.content() == null) {
                continue;
            }
            StringBuilder text = new StringBuilder();
            for (MessageContent content : message.content()) {
                if ("text".equals(content.type()) && content.text() != null && content.text().value() != null) {
                    text.append(content.text().value());
                }
            }
            if (text.length() > 0) {
                return Optional.of(text.toString());
            }
        }
        return Optional.empty();
    }

    @Override
    public void cancelRun(RunHandle handle) {
        call("cancel_run", () -> api.cancelRun(authorization(), handle.threadId(), handle.runId()));
    }

    @Override
    public boolean isAvailable() {
        return apiKey.isPresent() && assistantId.isPresent() && !isCircuitOpen();
    }

    private <T> T call(String operation, Supplier<T> invocation) {
        if (isCircuitOpen()) {
            throw new GenerativeServiceException("Circuit breaker open, skipping " + operation);
        }
        try {
            T result = callTimer.record(invocation);
            recordSuccess();
            return result;
        } catch (WebApplicationException e) {
            recordFailure();
            int status = e.getResponse() != null ? e.getResponse().getStatus() : -1;
            throw new GenerativeServiceException(
                    "Generative service " + operation + " failed with HTTP " + status, e);
        } catch (ProcessingException e) {
            recordFailure();
            throw new GenerativeServiceException(
                    "Generative service " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private String authorization() {
        return "Bearer " + apiKey.orElseThrow(
                () -> new GenerativeServiceException("valuation.generative.api-key is not configured"));
    }

    static RunSnapshot toSnapshot(RunResponse run) {
        if (run == null || run.status() == null) {
            throw new GenerativeServiceException("Run response carried no status");
        }
        RunStatus status;
        try {
            status = RunStatus.fromWire(run.status());
        } catch (IllegalArgumentException e) {
            throw new GenerativeServiceException("Unknown run status '" + run.status() + "'", e);
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        if (run.requiredAction() != null
                && run.requiredAction().submitToolOutputs() != null
                && run.requiredAction().submitToolOutputs().toolCalls() != null) {
            for (ToolCallPayload call : run.requiredAction().submitToolOutputs().toolCalls()) {
                if (call.function() != null) {
                    toolCalls.add(new ToolCall(call.id(), call.function().name(), call.function().arguments()));
                }
            }
        }
        String lastError = run.lastError() != null ? run.lastError().message() : null;
        return new RunSnapshot(status, toolCalls, lastError);
    }

    private boolean isCircuitOpen() {
        if (consecutiveFailures.get() >= CIRCUIT_BREAKER_THRESHOLD) {
            long now = System.currentTimeMillis();
            if (now - circuitOpenedAt < CIRCUIT_BREAKER_RESET.toMillis()) {
                return true;
            }
            // Reset circuit breaker after timeout
            consecutiveFailures.set(0);
            circuitOpenedAt = 0;
            LOG.info("Generative service circuit breaker reset");
        }
        return false;
    }

    private void recordSuccess() {
        consecutiveFailures.set(0);
        if (callSuccessCounter != null) {
            callSuccessCounter.increment();
        }
    }

    private void recordFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= CIRCUIT_BREAKER_THRESHOLD && circuitOpenedAt == 0) {
            circuitOpenedAt = System.currentTimeMillis();
            LOG.errorf("Generative service circuit breaker opened after %d consecutive failures", failures);
        }
        if (callFailureCounter != null) {
            callFailureCounter.increment();
        }
    }
}
