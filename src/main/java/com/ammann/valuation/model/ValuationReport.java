/* (C)2026 */
package com.ammann.valuation.model;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.enumeration.ReportStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entity representing one valuation report and its pipeline position.
 * <p>
 * Report lifecycle: PENDING -> PROCESSING -> (COMPLETED | FAILED | CANCELLED). A report blocked
 * by the gate chain is FAILED with {@link #blocked} set until a regeneration completes it.
 * <p>
 * {@link #currentPass} is the last pass whose output is durably stored; the pass in flight is
 * {@code currentPass + 1} while {@link #runId} is set. A {@link #runId} without a
 * {@link #threadId} is a start claim taken before the job is submitted.
 */
@Entity
@Table(name = "valuation_reports")
public class ValuationReport extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "company_name", nullable = false)
    public String companyName;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    public ReportStatus status = ReportStatus.PENDING;

    @Column(name = "current_pass", nullable = false)
    public Integer currentPass = -1;

    @Column(name = "thread_id")
    public String threadId;

    @Column(name = "run_id")
    public String runId;

    @Column(name = "transient_failures", nullable = false)
    public Integer transientFailures = 0;

    @Column(name = "calculation_results", columnDefinition = "TEXT")
    public String calculationResults;

    @Column(name = "report_data", columnDefinition = "TEXT")
    public String reportData;

    @Column(name = "gate_results", columnDefinition = "TEXT")
    public String gateResults;

    @Column(name = "concluded_value")
    public Double concludedValue;

    @Column(name = "quality_score")
    public Double qualityScore;

    @Column(nullable = false)
    public Boolean blocked = false;

    @Column(name = "block_hint", columnDefinition = "TEXT")
    public String blockHint;

    @Column(name = "error_message", columnDefinition = "TEXT")
    public String errorMessage;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    @Column(name = "last_progress_at")
    public Instant lastProgressAt;

    @Column(name = "completed_at")
    public Instant completedAt;

    // Finder methods

    public static List<ValuationReport> findRecent(int limit) {
        return find("ORDER BY createdAt DESC").page(0, limit).list();
    }

    public static List<UUID> findProcessingIds(int limit) {
        return getEntityManager()
                .createQuery(
                        "SELECT r.id FROM ValuationReport r WHERE r.status = ?1 ORDER BY r.lastProgressAt",
                        UUID.class)
                .setParameter(1, ReportStatus.PROCESSING)
                .setMaxResults(limit)
                .getResultList();
    }

    public static long countByStatus(ReportStatus status) {
        return count("status", status);
    }

    /**
     * Job of the pass in flight, null when none is running.
     */
    public RunHandle inFlight() {
        if (threadId == null || runId == null) {
            return null;
        }
        return new RunHandle(threadId, runId);
    }
}
