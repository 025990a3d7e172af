/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.pass.StoredPassOutput;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Datastore operations of the pipeline. Every mutation is atomic and keyed by report id; the
 * conditional ones return false when another caller got there first.
 */
public interface PipelineStore {

    Optional<PipelineState> load(UUID reportId);

    /**
     * Claims the start of the next pass where the report has neither a job nor a claim and its
     * current pass still equals {@code expectedCurrentPass}. Only the holder of the claim submits
     * a job to the generative service.
     */
    boolean tryClaimStart(UUID reportId, int expectedCurrentPass, String claimToken);

    /**
     * Replaces a still-held claim with the submitted job and moves the report to processing.
     */
    boolean recordStartedJob(UUID reportId, String claimToken, RunHandle handle);

    /** Drops a claim whose job could not be submitted. */
    void releaseClaim(UUID reportId, String claimToken);

    /**
     * Stores the structured output of a still-running job, replacing an earlier staged copy.
     */
    void stageOutput(UUID reportId, String runId, StoredPassOutput output);

    /**
     * Advances the current pass to {@code passNumber} and clears the job where the stored run id
     * still equals {@code runId}. The output must already be staged.
     */
    boolean tryCompletePass(UUID reportId, int passNumber, String runId);

    /**
     * Same as {@link #tryCompletePass} and writes the output in the same transaction.
     */
    boolean completePassWithOutput(UUID reportId, String runId, StoredPassOutput output);

    void updateTransientFailures(UUID reportId, int failures);

    void markFailed(UUID reportId, String message);

    /**
     * Cancels a pending or processing report.
     *
     * @return false when the report is already in a terminal status
     */
    boolean markCancelled(UUID reportId);

    void complete(UUID reportId, FinalizedReport report);

    /**
     * Marks the report failed with a blocked flag, the gate diagnostics and the corrective hint.
     */
    void block(UUID reportId, String gateResults, String hint, String calculationResults);

    List<StoredPassOutput> loadOutputs(UUID reportId);

    List<UUID> findProcessing(int limit);

    /**
     * Fails processing reports, and pending reports holding a start claim, without progress
     * since {@code threshold}.
     *
     * @return number of reports failed
     */
    int failStuck(Instant threshold, String message);

    /**
     * Fails reports whose current pass lies beyond {@code lastPass}.
     *
     * @return number of reports failed
     */
    int failBeyondPass(int lastPass, String message);
}
