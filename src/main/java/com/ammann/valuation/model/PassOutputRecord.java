/* (C)2026 */
package com.ammann.valuation.model;

import com.ammann.valuation.enumeration.ParseAttempt;
import com.ammann.valuation.pass.StoredPassOutput;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stored output of one pass. One row per report and pass; a rerun of the pass replaces it.
 */
@Entity
@Table(
        name = "pass_outputs",
        uniqueConstraints = @UniqueConstraint(columnNames = {"report_id", "pass_number"}))
public class PassOutputRecord extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(name = "report_id", nullable = false)
    public UUID reportId;

    @Column(name = "pass_number", nullable = false)
    public Integer passNumber;

    /** Job that produced the output; used to reject staged output of a superseded job. */
    @Column(name = "run_id")
    public String runId;

    @Column(columnDefinition = "TEXT")
    public String payload;

    @Column(name = "parse_attempt", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    public ParseAttempt parseAttempt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public static List<PassOutputRecord> findByReport(UUID reportId) {
        return list("reportId = ?1 ORDER BY passNumber", reportId);
    }

    public static Optional<PassOutputRecord> findByReportAndPass(UUID reportId, int passNumber) {
        return find("reportId = ?1 AND passNumber = ?2", reportId, passNumber).firstResultOptional();
    }

    public static long deleteByReport(UUID reportId) {
        return delete("reportId", reportId);
    }

    public StoredPassOutput toStored() {
        return new StoredPassOutput(passNumber, payload, parseAttempt);
    }
}
