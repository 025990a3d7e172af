/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.enumeration.ReportStatus;
import java.util.UUID;

/**
 * Pipeline view of a report as loaded from the datastore.
 *
 * @param currentPass last pass whose output is durably stored, -1 before the first pass
 * @param inFlight job of pass {@code currentPass + 1}, null when none is running
 * @param transientFailures consecutive transient errors since the last successful poll
 * @param outputStaged true when the in-flight job's structured output is already stored
 */
public record PipelineState(
        UUID reportId,
        String companyName,
        ReportStatus status,
        int currentPass,
        RunHandle inFlight,
        int transientFailures,
        boolean outputStaged) {

    public static final int NOT_STARTED = -1;

    public int nextPass() {
        return currentPass + 1;
    }

    public boolean hasJobInFlight() {
        return inFlight != null;
    }

    PipelineState withStatus(ReportStatus newStatus) {
        return new PipelineState(reportId, companyName, newStatus, currentPass, inFlight, transientFailures, outputStaged);
    }

    PipelineState withJob(RunHandle handle) {
        return new PipelineState(reportId, companyName, ReportStatus.PROCESSING, currentPass, handle, 0, false);
    }

    PipelineState withTransientFailures(int failures) {
        return new PipelineState(reportId, companyName, status, currentPass, inFlight, failures, outputStaged);
    }

    PipelineState withOutputStaged(boolean staged) {
        return new PipelineState(reportId, companyName, status, currentPass, inFlight, transientFailures, staged);
    }

    PipelineState withPassCompleted(int passNumber) {
        return new PipelineState(reportId, companyName, ReportStatus.PROCESSING, passNumber, null, 0, false);
    }
}
