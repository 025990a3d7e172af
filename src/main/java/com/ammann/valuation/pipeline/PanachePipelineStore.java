/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.model.PassOutputRecord;
import com.ammann.valuation.model.ValuationReport;
import com.ammann.valuation.pass.StoredPassOutput;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Pipeline store on the report tables.
 *
 * <p>Transaction design: every method runs in its own {@link QuarkusTransaction#requiringNew()}
 * so the orchestrator never holds a connection across a call to the generative service.
 * Conditional updates are single UPDATE statements whose WHERE clause carries the expected
 * state, which makes them compare-and-set operations.
 */
@ApplicationScoped
public class PanachePipelineStore implements PipelineStore {

    private static final Logger LOG = Logger.getLogger(PanachePipelineStore.class);

    @Override
    public Optional<PipelineState> load(UUID reportId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ValuationReport report = ValuationReport.findById(reportId);
            if (report == null) {
                return Optional.<PipelineState>empty();
            }
            RunHandle inFlight = report.inFlight();
            boolean staged = inFlight != null
                    && PassOutputRecord.findByReportAndPass(reportId, report.currentPass + 1)
                            .map(r -> inFlight.runId().equals(r.runId))
                            .orElse(false);
            return Optional.of(new PipelineState(
                    report.id,
                    report.companyName,
                    report.status,
                    report.currentPass,
                    inFlight,
                    report.transientFailures,
                    staged));
        });
    }

    @Override
    public boolean tryClaimStart(UUID reportId, int expectedCurrentPass, String claimToken) {
        int updated = QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "threadId = null, runId = ?1, lastProgressAt = ?2 "
                        + "WHERE id = ?3 AND runId IS NULL AND currentPass = ?4 AND (status = ?5 OR status = ?6)",
                claimToken,
                Instant.now(),
                reportId,
                expectedCurrentPass,
                ReportStatus.PENDING,
                ReportStatus.PROCESSING));
        return updated == 1;
    }

    @Override
    public boolean recordStartedJob(UUID reportId, String claimToken, RunHandle handle) {
        int updated = QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "status = ?1, threadId = ?2, runId = ?3, transientFailures = 0, lastProgressAt = ?4 "
                        + "WHERE id = ?5 AND threadId IS NULL AND runId = ?6 AND (status = ?7 OR status = ?8)",
                ReportStatus.PROCESSING,
                handle.threadId(),
                handle.runId(),
                Instant.now(),
                reportId,
                claimToken,
                ReportStatus.PENDING,
                ReportStatus.PROCESSING));
        return updated == 1;
    }

    @Override
    public void releaseClaim(UUID reportId, String claimToken) {
        QuarkusTransaction.requiringNew().run(() -> ValuationReport.update(
                "runId = null WHERE id = ?1 AND threadId IS NULL AND runId = ?2", reportId, claimToken));
    }

    @Override
    public void stageOutput(UUID reportId, String runId, StoredPassOutput output) {
        QuarkusTransaction.requiringNew().run(() -> upsertOutput(reportId, runId, output));
        LOG.debugf("Staged output of pass %d for report %s (run %s)", output.passNumber(), reportId, runId);
    }

    @Override
    public boolean tryCompletePass(UUID reportId, int passNumber, String runId) {
        return QuarkusTransaction.requiringNew().call(() -> advancePass(reportId, passNumber, runId));
    }

    @Override
    public boolean completePassWithOutput(UUID reportId, String runId, StoredPassOutput output) {
        return QuarkusTransaction.requiringNew().call(() -> {
            if (!advancePass(reportId, output.passNumber(), runId)) {
                return false;
            }
            upsertOutput(reportId, runId, output);
            return true;
        });
    }

    @Override
    public void updateTransientFailures(UUID reportId, int failures) {
        QuarkusTransaction.requiringNew().run(() ->
                ValuationReport.update("transientFailures = ?1 WHERE id = ?2", failures, reportId));
    }

    @Override
    public void markFailed(UUID reportId, String message) {
        int updated = QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "status = ?1, errorMessage = ?2, threadId = null, runId = null, completedAt = ?3 "
                        + "WHERE id = ?4 AND (status = ?5 OR status = ?6)",
                ReportStatus.FAILED,
                message,
                Instant.now(),
                reportId,
                ReportStatus.PENDING,
                ReportStatus.PROCESSING));
        if (updated == 0) {
            LOG.debugf("Report %s was no longer active when marking it failed", reportId);
        }
    }

    @Override
    public boolean markCancelled(UUID reportId) {
        int updated = QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "status = ?1, completedAt = ?2 WHERE id = ?3 AND (status = ?4 OR status = ?5)",
                ReportStatus.CANCELLED,
                Instant.now(),
                reportId,
                ReportStatus.PENDING,
                ReportStatus.PROCESSING));
        return updated == 1;
    }

    @Override
    public void complete(UUID reportId, FinalizedReport finalized) {
        QuarkusTransaction.requiringNew().run(() -> {
            ValuationReport report = ValuationReport.findById(reportId);
            if (report == null) {
                return;
            }
            Instant now = Instant.now();
            report.status = ReportStatus.COMPLETED;
            report.calculationResults = finalized.calculationResults();
            report.reportData = finalized.reportData();
            report.gateResults = finalized.gateResults();
            report.concludedValue = finalized.concludedValue();
            report.qualityScore = finalized.qualityScore();
            report.blocked = false;
            report.blockHint = null;
            report.errorMessage = null;
            report.threadId = null;
            report.runId = null;
            report.transientFailures = 0;
            report.lastProgressAt = now;
            report.completedAt = now;
        });
    }

    @Override
    public void block(UUID reportId, String gateResults, String hint, String calculationResults) {
        QuarkusTransaction.requiringNew().run(() -> {
            ValuationReport report = ValuationReport.findById(reportId);
            if (report == null) {
                return;
            }
            report.status = ReportStatus.FAILED;
            report.blocked = true;
            report.blockHint = hint;
            report.gateResults = gateResults;
            report.calculationResults = calculationResults;
            report.errorMessage = "Finalization blocked: " + hint;
            report.threadId = null;
            report.runId = null;
            report.completedAt = Instant.now();
        });
    }

    @Override
    public List<StoredPassOutput> loadOutputs(UUID reportId) {
        return QuarkusTransaction.requiringNew().call(() -> PassOutputRecord.findByReport(reportId).stream()
                .map(PassOutputRecord::toStored)
                .toList());
    }

    @Override
    public List<UUID> findProcessing(int limit) {
        return QuarkusTransaction.requiringNew().call(() -> ValuationReport.findProcessingIds(limit));
    }

    @Override
    public int failStuck(Instant threshold, String message) {
        return QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "status = ?1, errorMessage = ?2, threadId = null, runId = null, completedAt = ?3 "
                        + "WHERE (status = ?4 OR (status = ?5 AND runId IS NOT NULL)) AND lastProgressAt < ?6",
                ReportStatus.FAILED,
                message,
                Instant.now(),
                ReportStatus.PROCESSING,
                ReportStatus.PENDING,
                threshold));
    }

    @Override
    public int failBeyondPass(int lastPass, String message) {
        return QuarkusTransaction.requiringNew().call(() -> ValuationReport.update(
                "status = ?1, errorMessage = ?2, threadId = null, runId = null, completedAt = ?3 "
                        + "WHERE currentPass > ?4 AND (status = ?5 OR status = ?6)",
                ReportStatus.FAILED,
                message,
                Instant.now(),
                lastPass,
                ReportStatus.PENDING,
                ReportStatus.PROCESSING));
    }

    private static boolean advancePass(UUID reportId, int passNumber, String runId) {
        int updated = ValuationReport.update(
                "currentPass = ?1, threadId = null, runId = null, transientFailures = 0, lastProgressAt = ?2 "
                        + "WHERE id = ?3 AND runId = ?4 AND currentPass = ?5 AND status = ?6",
                passNumber,
                Instant.now(),
                reportId,
                runId,
                passNumber - 1,
                ReportStatus.PROCESSING);
        return updated == 1;
    }

    private static void upsertOutput(UUID reportId, String runId, StoredPassOutput output) {
        PassOutputRecord record = PassOutputRecord.findByReportAndPass(reportId, output.passNumber())
                .orElseGet(() -> {
                    PassOutputRecord created = new PassOutputRecord();
                    created.reportId = reportId;
                    created.passNumber = output.passNumber();
                    return created;
                });
        record.runId = runId;
        record.payload = output.payload();
        record.parseAttempt = output.parseAttempt();
        record.createdAt = Instant.now();
        record.persist();
    }
}
