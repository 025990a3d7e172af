/* (C)2026 */
package com.ammann.valuation.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Wire shapes of the assistants-style run API.
 */
public final class AssistantsPayloads {

    private AssistantsPayloads() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CreateThreadAndRunRequest(
            String assistantId,
            String model,
            String instructions,
            ThreadSpec thread,
            List<Tool> tools,
            Object toolChoice,
            Integer maxCompletionTokens,
            Double temperature) {}

    public record ThreadSpec(List<Message> messages) {}

    public record Message(String role, String content) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Tool(String type, FunctionSpec function) {

        static Tool function(String name) {
            return new Tool("function", new FunctionSpec(name));
        }
    }

    public record FunctionSpec(String name) {}

    public record ToolChoice(String type, FunctionSpec function) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SubmitToolOutputsRequest(List<ToolOutputPayload> toolOutputs) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ToolOutputPayload(String toolCallId, String output) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RunResponse(
            String id, String threadId, String status, RequiredAction requiredAction, LastError lastError) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RequiredAction(String type, SubmitToolOutputs submitToolOutputs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SubmitToolOutputs(List<ToolCallPayload> toolCalls) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolCallPayload(String id, String type, FunctionCall function) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FunctionCall(String name, String arguments) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LastError(String code, String message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessageList(List<ThreadMessage> data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreadMessage(String id, String role, List<MessageContent> content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessageContent(String type, MessageText text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessageText(String value) {}
}
