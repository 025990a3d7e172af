/* (C)2026 */
package com.ammann.valuation.support;

import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.model.PassOutputRecord;
import com.ammann.valuation.model.ValuationReport;
import io.quarkus.narayana.jta.QuarkusTransaction;
import java.time.Instant;
import java.util.UUID;

/**
 * Commits report rows for {@code @QuarkusTest} classes whose code under test opens its own
 * transactions.
 */
public final class ReportRows {

    private ReportRows() {}

    public static void deleteAll() {
        QuarkusTransaction.requiringNew().run(() -> {
            PassOutputRecord.deleteAll();
            ValuationReport.deleteAll();
        });
    }

    public static UUID insert(String companyName, ReportStatus status, int currentPass, Instant lastProgressAt) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ValuationReport report = new ValuationReport();
            report.companyName = companyName;
            report.status = status;
            report.currentPass = currentPass;
            report.lastProgressAt = lastProgressAt;
            report.persist();
            return report.id;
        });
    }

    public static UUID insertPending(String companyName) {
        return insert(companyName, ReportStatus.PENDING, -1, null);
    }

    public static void setLastProgressAt(UUID id, Instant lastProgressAt) {
        QuarkusTransaction.requiringNew().run(() ->
                ValuationReport.update("lastProgressAt = ?1 WHERE id = ?2", lastProgressAt, id));
    }

    public static ValuationReport find(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> ValuationReport.<ValuationReport>findById(id));
    }

    public static long outputCount(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> PassOutputRecord.count("reportId", id));
    }
}
