/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.client.RunSnapshot;
import com.ammann.valuation.gate.GateChainResult;

/**
 * Facts fed into the state machine: the start of an advance call and the outcome of each
 * executed action.
 */
public sealed interface PipelineEvent {

    /** An advance call loaded the report. */
    record Advance() implements PipelineEvent {}

    record JobStarted(RunHandle handle) implements PipelineEvent {}

    /** Another caller started the pass first; our duplicate job was discarded. */
    record JobStartLost() implements PipelineEvent {}

    record StartFailed(String reason) implements PipelineEvent {}

    /**
     * @param afterSubmit whether the poll followed a tool output submission in the same call
     */
    record Polled(RunSnapshot snapshot, boolean afterSubmit) implements PipelineEvent {

        public Polled(RunSnapshot snapshot) {
            this(snapshot, false);
        }
    }

    record PollFailed(String reason) implements PipelineEvent {}

    /**
     * @param staged whether the structured output carried by the tool calls was stored
     */
    record ToolOutputsSubmitted(RunSnapshot snapshot, boolean staged) implements PipelineEvent {}

    record ToolSubmitFailed(String reason) implements PipelineEvent {}

    record PassCompleted(int passNumber) implements PipelineEvent {}

    /** The pass was recorded by another caller. */
    record PassCompletionLost(int passNumber) implements PipelineEvent {}

    record Finalized(GateChainResult gates, double concludedValue) implements PipelineEvent {}

    record FinalizationBlocked(GateChainResult gates) implements PipelineEvent {}

    /** The report was marked failed in the datastore. */
    record Failed(String reason) implements PipelineEvent {}
}
