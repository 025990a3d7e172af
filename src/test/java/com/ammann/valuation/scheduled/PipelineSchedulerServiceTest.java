/* (C)2026 */
package com.ammann.valuation.scheduled;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.exception.GenerativeServiceException;
import com.ammann.valuation.pipeline.AdvanceResult;
import com.ammann.valuation.pipeline.PipelineOrchestrator;
import com.ammann.valuation.support.ReportRows;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PipelineSchedulerServiceTest {

    @Inject PipelineSchedulerService scheduler;

    @InjectMock PipelineOrchestrator orchestrator;

    @BeforeEach
    void cleanDatabase() {
        ReportRows.deleteAll();
    }

    @Test
    void advancesEveryProcessingReportAndCountsFailures() {
        UUID healthy = ReportRows.insert("Healthy", ReportStatus.PROCESSING, 2, Instant.now().minusSeconds(30));
        UUID broken = ReportRows.insert("Broken", ReportStatus.PROCESSING, 2, Instant.now().minusSeconds(60));
        ReportRows.insertPending("Waiting");

        when(orchestrator.advance(healthy))
                .thenReturn(new AdvanceResult(ReportStatus.PROCESSING, 3, 18, 25, "Pass 3 complete", null));
        when(orchestrator.advance(broken)).thenThrow(new GenerativeServiceException("boom"));

        assertThat(scheduler.advanceProcessingReports()).isEqualTo(1);
        verify(orchestrator).advance(healthy);
        verify(orchestrator).advance(broken);
    }

    @Test
    void noProcessingReportsMeansNoAdvance() {
        ReportRows.insertPending("Waiting");

        assertThat(scheduler.advanceProcessingReports()).isZero();
        verify(orchestrator, never()).advance(any());
    }

    @Test
    void watchdogFailsReportsWithoutRecentProgress() {
        UUID stuck = ReportRows.insert("Stuck", ReportStatus.PROCESSING, 6, Instant.now().minus(Duration.ofHours(3)));
        UUID active = ReportRows.insert("Active", ReportStatus.PROCESSING, 6, Instant.now());

        assertThat(scheduler.detectStuckReports()).isEqualTo(1);

        assertThat(ReportRows.find(stuck).status).isEqualTo(ReportStatus.FAILED);
        assertThat(ReportRows.find(stuck).errorMessage).isEqualTo("Report made no progress for 120 minutes");
        assertThat(ReportRows.find(active).status).isEqualTo(ReportStatus.PROCESSING);
    }
}
