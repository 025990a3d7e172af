/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.client.ToolCall;
import com.ammann.valuation.gate.GateChainResult;
import java.util.List;

/**
 * Side effects the orchestrator executes on behalf of the state machine. {@link Respond} ends
 * the advance call.
 */
public sealed interface PipelineAction {

    record StartPass(int passNumber) implements PipelineAction {}

    /**
     * @param afterSubmit whether tool outputs were just submitted in this advance call
     */
    record Poll(RunHandle handle, boolean afterSubmit) implements PipelineAction {

        public Poll(RunHandle handle) {
            this(handle, false);
        }
    }

    record SubmitToolOutputs(int passNumber, RunHandle handle, List<ToolCall> toolCalls)
            implements PipelineAction {

        public SubmitToolOutputs {
            toolCalls = List.copyOf(toolCalls);
        }
    }

    /**
     * @param outputStaged whether the output is already stored and only the pass counter moves
     */
    record CompletePass(int passNumber, RunHandle handle, boolean outputStaged) implements PipelineAction {}

    record Finalize() implements PipelineAction {}

    record MarkFailed(String reason) implements PipelineAction {}

    /**
     * @param gates gate diagnostics when finalization ran, otherwise null
     */
    record Respond(String message, GateChainResult gates) implements PipelineAction {

        public static Respond message(String message) {
            return new Respond(message, null);
        }
    }
}
