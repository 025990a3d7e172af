/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunSnapshot;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.enumeration.RunStatus;
import com.ammann.valuation.pipeline.PipelineAction.CompletePass;
import com.ammann.valuation.pipeline.PipelineAction.Finalize;
import com.ammann.valuation.pipeline.PipelineAction.MarkFailed;
import com.ammann.valuation.pipeline.PipelineAction.Poll;
import com.ammann.valuation.pipeline.PipelineAction.Respond;
import com.ammann.valuation.pipeline.PipelineAction.StartPass;
import com.ammann.valuation.pipeline.PipelineAction.SubmitToolOutputs;
import com.ammann.valuation.pipeline.PipelineEvent.Advance;
import com.ammann.valuation.pipeline.PipelineEvent.Failed;
import com.ammann.valuation.pipeline.PipelineEvent.Finalized;
import com.ammann.valuation.pipeline.PipelineEvent.FinalizationBlocked;
import com.ammann.valuation.pipeline.PipelineEvent.JobStartLost;
import com.ammann.valuation.pipeline.PipelineEvent.JobStarted;
import com.ammann.valuation.pipeline.PipelineEvent.PassCompleted;
import com.ammann.valuation.pipeline.PipelineEvent.PassCompletionLost;
import com.ammann.valuation.pipeline.PipelineEvent.PollFailed;
import com.ammann.valuation.pipeline.PipelineEvent.Polled;
import com.ammann.valuation.pipeline.PipelineEvent.StartFailed;
import com.ammann.valuation.pipeline.PipelineEvent.ToolOutputsSubmitted;
import com.ammann.valuation.pipeline.PipelineEvent.ToolSubmitFailed;

/**
 * Pure transition function of the pass pipeline. It never touches the datastore or the
 * generative service; the orchestrator executes the returned action and feeds the outcome back.
 *
 * <p>One advance call moves the report by at most one unit: start the next pass, observe the
 * running one, record its output, or finalize once every pass is stored.
 */
public class PipelineStateMachine {

    private final int totalPasses;
    private final int maxTransientFailures;

    public PipelineStateMachine(int totalPasses, int maxTransientFailures) {
        if (totalPasses <= 0) {
            throw new IllegalArgumentException("totalPasses must be positive: " + totalPasses);
        }
        if (maxTransientFailures < 1) {
            throw new IllegalArgumentException("maxTransientFailures must be at least 1: " + maxTransientFailures);
        }
        this.totalPasses = totalPasses;
        this.maxTransientFailures = maxTransientFailures;
    }

    public int totalPasses() {
        return totalPasses;
    }

    public Transition transition(PipelineState state, PipelineEvent event) {
        if (event instanceof Advance) {
            return onAdvance(state);
        }
        if (event instanceof JobStarted started) {
            return new Transition(state.withJob(started.handle()), new Poll(started.handle()));
        }
        if (event instanceof JobStartLost) {
            return respond(state, "Pass " + state.nextPass() + " was already started by another caller");
        }
        if (event instanceof StartFailed failed) {
            return onTransientFailure(state, "starting pass " + state.nextPass(), failed.reason());
        }
        if (event instanceof Polled polled) {
            return onSnapshot(state.withTransientFailures(0), polled.snapshot(), polled.afterSubmit());
        }
        if (event instanceof PollFailed failed) {
            return onTransientFailure(state, "polling pass " + state.nextPass(), failed.reason());
        }
        if (event instanceof ToolOutputsSubmitted submitted) {
            return onSubmitted(state.withTransientFailures(0).withOutputStaged(submitted.staged()),
                    submitted.snapshot());
        }
        if (event instanceof ToolSubmitFailed failed) {
            return onTransientFailure(state, "submitting tool outputs for pass " + state.nextPass(), failed.reason());
        }
        if (event instanceof PassCompleted completed) {
            PipelineState next = state.withPassCompleted(completed.passNumber());
            String message = completed.passNumber() == lastPass()
                    ? "All " + totalPasses + " passes complete, finalizing on the next advance"
                    : "Pass " + completed.passNumber() + " complete";
            return respond(next, message);
        }
        if (event instanceof PassCompletionLost lost) {
            return respond(state, "Pass " + lost.passNumber() + " was already recorded by another caller");
        }
        if (event instanceof Finalized finalized) {
            return new Transition(state.withStatus(ReportStatus.COMPLETED),
                    new Respond("Valuation report completed", finalized.gates()));
        }
        if (event instanceof FinalizationBlocked blocked) {
            return new Transition(state.withStatus(ReportStatus.FAILED),
                    new Respond("Finalization blocked by the " + blocked.gates().blockingGate().wireName()
                            + " gate", blocked.gates()));
        }
        if (event instanceof Failed failed) {
            return respond(state.withStatus(ReportStatus.FAILED), failed.reason());
        }
        throw new IllegalArgumentException("Unhandled pipeline event: " + event);
    }

    private Transition onAdvance(PipelineState state) {
        if (state.status().isTerminal()) {
            return respond(state, "Report is " + state.status().wireName() + ", nothing to do");
        }
        if (state.currentPass() > lastPass()) {
            return new Transition(state, new MarkFailed(
                    "Stored pass " + state.currentPass() + " is beyond the last pass " + lastPass()));
        }
        if (state.hasJobInFlight()) {
            return new Transition(state, new Poll(state.inFlight()));
        }
        if (state.nextPass() > lastPass()) {
            return new Transition(state, new Finalize());
        }
        return new Transition(state, new StartPass(state.nextPass()));
    }

    /**
     * The submit response usually still shows the run queued or in progress, so the run is
     * observed once more before the call responds.
     */
    private Transition onSubmitted(PipelineState state, RunSnapshot snapshot) {
        RunStatus status = snapshot.status();
        if (status == RunStatus.COMPLETED || status.isTerminalFailure()) {
            return onSnapshot(state, snapshot, true);
        }
        return new Transition(state, new Poll(state.inFlight(), true));
    }

    private Transition onSnapshot(PipelineState state, RunSnapshot snapshot, boolean afterSubmit) {
        RunStatus status = snapshot.status();
        int pass = state.nextPass();
        if (status == RunStatus.COMPLETED) {
            return new Transition(state, new CompletePass(pass, state.inFlight(), state.outputStaged()));
        }
        if (status.isTerminalFailure()) {
            String detail = snapshot.lastError() != null ? snapshot.lastError() : "no error detail";
            return new Transition(state, new MarkFailed(
                    "Pass " + pass + " " + status.name().toLowerCase() + ": " + detail));
        }
        if (status == RunStatus.REQUIRES_ACTION && !afterSubmit && !snapshot.toolCalls().isEmpty()) {
            return new Transition(state, new SubmitToolOutputs(pass, state.inFlight(), snapshot.toolCalls()));
        }
        return respond(state, "Pass " + pass + " is " + status.name().toLowerCase());
    }

    private Transition onTransientFailure(PipelineState state, String operation, String reason) {
        int failures = state.transientFailures() + 1;
        PipelineState next = state.withTransientFailures(failures);
        if (failures > maxTransientFailures) {
            return new Transition(next, new MarkFailed(
                    "Giving up after " + failures + " consecutive transient failures while " + operation + ": " + reason));
        }
        return respond(next, "Transient failure while " + operation + " (" + failures + "/" + maxTransientFailures
                + "), will retry: " + reason);
    }

    private int lastPass() {
        return totalPasses - 1;
    }

    private static Transition respond(PipelineState state, String message) {
        return new Transition(state, Respond.message(message));
    }
}
