/* (C)2026 */
package com.ammann.valuation.health;

import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.model.ValuationReport;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the report datastore.
 *
 * <p>Reports DOWN if the count queries fail or take longer than one second. Exposes the total
 * report count and the number of reports currently processing.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    private static final String NAME = "database-health";

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long totalReports = ValuationReport.count();
            long processing = ValuationReport.countByStatus(ReportStatus.PROCESSING);

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < 1000;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("total-reports", totalReports)
                    .withData("processing-reports", processing)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
