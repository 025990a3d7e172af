/* (C)2026 */
package com.ammann.valuation.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.model.PassOutputRecord;
import com.ammann.valuation.model.ValuationReport;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

@QuarkusTest
class DatabaseHealthCheckIntegrationTest {

    @Test
    @TestTransaction
    void callReturnsUpWithReportCounts() {
        PassOutputRecord.deleteAll();
        ValuationReport.deleteAll();
        DatabaseHealthCheck check = new DatabaseHealthCheck();

        ValuationReport pending = new ValuationReport();
        pending.companyName = "Pending Co";
        ValuationReport running = new ValuationReport();
        running.companyName = "Running Co";
        running.status = ReportStatus.PROCESSING;
        ValuationReport.persist(pending, running);

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("total-reports")).isEqualTo(2L);
        assertThat(response.getData().get().get("processing-reports")).isEqualTo(1L);
    }
}
