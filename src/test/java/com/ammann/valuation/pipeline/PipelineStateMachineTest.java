/* (C)2026 */
package com.ammann.valuation.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.client.RunSnapshot;
import com.ammann.valuation.client.ToolCall;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.enumeration.RunStatus;
import com.ammann.valuation.gate.GateChainResult;
import com.ammann.valuation.pipeline.PipelineAction.CompletePass;
import com.ammann.valuation.pipeline.PipelineAction.Finalize;
import com.ammann.valuation.pipeline.PipelineAction.MarkFailed;
import com.ammann.valuation.pipeline.PipelineAction.Poll;
import com.ammann.valuation.pipeline.PipelineAction.Respond;
import com.ammann.valuation.pipeline.PipelineAction.StartPass;
import com.ammann.valuation.pipeline.PipelineAction.SubmitToolOutputs;
import com.ammann.valuation.pipeline.PipelineEvent.Advance;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PipelineStateMachineTest {

    private static final RunHandle HANDLE = new RunHandle("thread-1", "run-1");

    private final PipelineStateMachine machine = new PipelineStateMachine(18, 3);

    @Test
    void pendingReportStartsFirstPass() {
        Transition t = machine.transition(state(ReportStatus.PENDING, PipelineState.NOT_STARTED, null), new Advance());

        assertThat(t.action()).isEqualTo(new StartPass(0));
    }

    @Test
    void advanceWithJobInFlightOnlyPolls() {
        Transition t = machine.transition(state(ReportStatus.PROCESSING, 4, HANDLE), new Advance());

        assertThat(t.action()).isEqualTo(new Poll(HANDLE));
        assertThat(t.state().currentPass()).isEqualTo(4);
    }

    @Test
    void advanceAfterLastPassFinalizes() {
        Transition t = machine.transition(state(ReportStatus.PROCESSING, 17, null), new Advance());

        assertThat(t.action()).isInstanceOf(Finalize.class);
    }

    @Test
    void advanceBeyondRegistryFailsReport() {
        Transition t = machine.transition(state(ReportStatus.PROCESSING, 18, null), new Advance());

        assertThat(t.action()).isInstanceOf(MarkFailed.class);
        assertThat(((MarkFailed) t.action()).reason()).contains("beyond the last pass 17");
    }

    @ParameterizedTest
    @EnumSource(value = ReportStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void terminalReportsAreNoOps(ReportStatus status) {
        PipelineState terminal = state(status, 9, null);

        Transition t = machine.transition(terminal, new Advance());

        assertThat(t.state()).isEqualTo(terminal);
        assertThat(t.action()).isInstanceOf(Respond.class);
    }

    @Test
    void startedJobIsRecordedAndPolled() {
        Transition t = machine.transition(
                state(ReportStatus.PENDING, PipelineState.NOT_STARTED, null), new PipelineEvent.JobStarted(HANDLE));

        assertThat(t.state().status()).isEqualTo(ReportStatus.PROCESSING);
        assertThat(t.state().inFlight()).isEqualTo(HANDLE);
        assertThat(t.action()).isEqualTo(new Poll(HANDLE));
    }

    @Test
    void completedRunCompletesInFlightPass() {
        Transition t = machine.transition(
                state(ReportStatus.PROCESSING, 2, HANDLE), new PipelineEvent.Polled(RunSnapshot.of(RunStatus.COMPLETED)));

        assertThat(t.action()).isEqualTo(new CompletePass(3, HANDLE, false));
    }

    @Test
    void stillRunningJobResponds() {
        Transition t = machine.transition(
                state(ReportStatus.PROCESSING, 2, HANDLE), new PipelineEvent.Polled(RunSnapshot.of(RunStatus.IN_PROGRESS)));

        assertThat(t.action()).isInstanceOf(Respond.class);
        assertThat(((Respond) t.action()).message()).isEqualTo("Pass 3 is in_progress");
    }

    @Test
    void failedRunFailsReportWithUpstreamError() {
        RunSnapshot failed = new RunSnapshot(RunStatus.FAILED, List.of(), "rate_limit_exceeded");

        Transition t = machine.transition(state(ReportStatus.PROCESSING, 5, HANDLE), new PipelineEvent.Polled(failed));

        assertThat(t.action()).isEqualTo(new MarkFailed("Pass 6 failed: rate_limit_exceeded"));
    }

    @Test
    void requiredActionSubmitsToolOutputsOnce() {
        ToolCall call = new ToolCall("call-1", "extract_core_company_data", "{}");
        RunSnapshot snapshot = new RunSnapshot(RunStatus.REQUIRES_ACTION, List.of(call), null);

        Transition first = machine.transition(state(ReportStatus.PROCESSING, 0, HANDLE), new PipelineEvent.Polled(snapshot));
        Transition afterSubmit = machine.transition(
                state(ReportStatus.PROCESSING, 0, HANDLE), new PipelineEvent.ToolOutputsSubmitted(snapshot, true));
        Transition afterRepoll = machine.transition(
                afterSubmit.state(), new PipelineEvent.Polled(snapshot, true));

        assertThat(first.action()).isEqualTo(new SubmitToolOutputs(1, HANDLE, List.of(call)));
        assertThat(afterSubmit.action()).isEqualTo(new Poll(HANDLE, true));
        assertThat(afterSubmit.state().outputStaged()).isTrue();
        assertThat(afterRepoll.action()).isInstanceOf(Respond.class);
    }

    @Test
    void queuedRunIsPolledAgainAfterSubmit() {
        Transition afterSubmit = machine.transition(
                state(ReportStatus.PROCESSING, 0, HANDLE),
                new PipelineEvent.ToolOutputsSubmitted(RunSnapshot.of(RunStatus.QUEUED), true));
        Transition afterRepoll = machine.transition(
                afterSubmit.state(), new PipelineEvent.Polled(RunSnapshot.of(RunStatus.COMPLETED), true));

        assertThat(afterSubmit.action()).isEqualTo(new Poll(HANDLE, true));
        assertThat(afterRepoll.action()).isEqualTo(new CompletePass(1, HANDLE, true));
    }

    @Test
    void stagedOutputIsCarriedIntoCompletion() {
        Transition t = machine.transition(
                state(ReportStatus.PROCESSING, 0, HANDLE),
                new PipelineEvent.ToolOutputsSubmitted(RunSnapshot.of(RunStatus.COMPLETED), true));

        assertThat(t.action()).isEqualTo(new CompletePass(1, HANDLE, true));
    }

    @Test
    void transientFailuresAccumulateUntilLimit() {
        PipelineState current = state(ReportStatus.PROCESSING, 3, HANDLE);
        for (int i = 1; i <= 3; i++) {
            Transition t = machine.transition(current, new PipelineEvent.PollFailed("timeout"));
            assertThat(t.action()).isInstanceOf(Respond.class);
            assertThat(t.state().transientFailures()).isEqualTo(i);
            current = t.state();
        }

        Transition exhausted = machine.transition(current, new PipelineEvent.PollFailed("timeout"));

        assertThat(exhausted.action()).isInstanceOf(MarkFailed.class);
        assertThat(((MarkFailed) exhausted.action()).reason()).startsWith("Giving up after 4 consecutive");
    }

    @Test
    void successfulPollResetsTransientCounter() {
        PipelineState flaky = state(ReportStatus.PROCESSING, 3, HANDLE).withTransientFailures(2);

        Transition t = machine.transition(flaky, new PipelineEvent.Polled(RunSnapshot.of(RunStatus.QUEUED)));

        assertThat(t.state().transientFailures()).isZero();
    }

    @Test
    void passCompletionClearsJobAndMovesCounter() {
        Transition t = machine.transition(state(ReportStatus.PROCESSING, 3, HANDLE), new PipelineEvent.PassCompleted(4));

        assertThat(t.state().currentPass()).isEqualTo(4);
        assertThat(t.state().inFlight()).isNull();
        assertThat(((Respond) t.action()).message()).isEqualTo("Pass 4 complete");
    }

    @Test
    void lastPassCompletionAnnouncesFinalization() {
        Transition t = machine.transition(state(ReportStatus.PROCESSING, 16, HANDLE), new PipelineEvent.PassCompleted(17));

        assertThat(((Respond) t.action()).message()).contains("finalizing on the next advance");
    }

    @Test
    void blockedFinalizationFailsWithGates() {
        GateChainResult gates = new GateChainResult(List.of(), GateKind.INDUSTRY, "Re-run pass 8");

        Transition t = machine.transition(
                state(ReportStatus.PROCESSING, 17, null), new PipelineEvent.FinalizationBlocked(gates));

        assertThat(t.state().status()).isEqualTo(ReportStatus.FAILED);
        assertThat(((Respond) t.action()).gates()).isSameAs(gates);
        assertThat(((Respond) t.action()).message()).contains("industry");
    }

    @Test
    void finalizedReportCompletes() {
        GateChainResult gates = new GateChainResult(List.of(), null, null);

        Transition t = machine.transition(
                state(ReportStatus.PROCESSING, 17, null), new PipelineEvent.Finalized(gates, 680_000));

        assertThat(t.state().status()).isEqualTo(ReportStatus.COMPLETED);
    }

    @Test
    void rejectsNonPositivePassCount() {
        assertThatThrownBy(() -> new PipelineStateMachine(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineStateMachine(18, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static PipelineState state(ReportStatus status, int currentPass, RunHandle inFlight) {
        return new PipelineState(UUID.randomUUID(), "Acme Engineering", status, currentPass, inFlight, 0, false);
    }
}
