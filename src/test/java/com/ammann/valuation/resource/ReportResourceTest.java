/* (C)2026 */
package com.ammann.valuation.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.dto.AdvanceResponseDTO;
import com.ammann.valuation.dto.CreateReportRequestDTO;
import com.ammann.valuation.dto.ReportDTO;
import com.ammann.valuation.dto.ReportStatusDTO;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.exception.ReportNotFoundException;
import com.ammann.valuation.exception.ReportStateException;
import com.ammann.valuation.gate.GateChainResult;
import com.ammann.valuation.gate.GateIssue;
import com.ammann.valuation.gate.GateResult;
import com.ammann.valuation.pipeline.AdvanceResult;
import com.ammann.valuation.pipeline.PanachePipelineStore;
import com.ammann.valuation.pipeline.PipelineOrchestrator;
import com.ammann.valuation.pipeline.PipelineState;
import com.ammann.valuation.service.ReportService;
import com.ammann.valuation.support.ReportRows;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ReportResourceTest {

    @Inject ReportService reportService;

    @Inject PanachePipelineStore store;

    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void cleanDatabase() {
        ReportRows.deleteAll();
        orchestrator = mock(PipelineOrchestrator.class);
    }

    @Test
    void createReturnsLocationOfPendingReport() {
        ReportResource resource = buildResource();

        Response response = resource.create(new CreateReportRequestDTO("  Acme Engineering LLC "));
        ReportDTO dto = (ReportDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(201);
        assertThat(response.getLocation().getPath()).endsWith("/reports/" + dto.id());
        assertThat(dto.companyName()).isEqualTo("Acme Engineering LLC");
        assertThat(dto.status()).isEqualTo("pending");
        assertThat(dto.currentPass()).isEqualTo(-1);
        assertThat(dto.totalPasses()).isEqualTo(18);
        assertThat(dto.progress()).isZero();
    }

    @Test
    void statusReportsInFlightPassProgress() {
        ReportResource resource = buildResource();
        UUID id = ReportRows.insertPending("Acme");
        store.tryClaimStart(id, PipelineState.NOT_STARTED, "claim-1");
        store.recordStartedJob(id, "claim-1", new RunHandle("thread-1", "run-1"));

        ReportStatusDTO dto = (ReportStatusDTO) resource.status(id).getEntity();

        assertThat(dto.status()).isEqualTo("processing");
        assertThat(dto.pass()).isEqualTo(-1);
        assertThat(dto.progress()).isPositive();
        assertThat(dto.blocked()).isNull();
    }

    @Test
    void listReturnsNewestFirst() {
        ReportResource resource = buildResource();
        resource.create(new CreateReportRequestDTO("First"));
        resource.create(new CreateReportRequestDTO("Second"));

        @SuppressWarnings("unchecked")
        List<ReportDTO> reports = (List<ReportDTO>) resource.list(1).getEntity();

        assertThat(reports).hasSize(1);
    }

    @Test
    void unknownReportIsNotFound() {
        ReportResource resource = buildResource();
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> resource.get(id))
                .isInstanceOf(ReportNotFoundException.class)
                .hasMessage("Report not found: " + id);
    }

    @Test
    void cancelTwiceIsAConflict() {
        ReportResource resource = buildResource();
        UUID id = ReportRows.insertPending("Acme");

        ReportDTO cancelled = (ReportDTO) resource.cancel(id).getEntity();
        assertThat(cancelled.status()).isEqualTo("cancelled");

        assertThatThrownBy(() -> resource.cancel(id)).isInstanceOf(ReportStateException.class);
    }

    @Test
    void advanceReturnsProgress() {
        ReportResource resource = buildResource();
        UUID id = UUID.randomUUID();
        when(orchestrator.advance(id))
                .thenReturn(new AdvanceResult(ReportStatus.PROCESSING, 2, 18, 20, "Pass 2 complete", null));

        Response response = resource.advance(id);
        AdvanceResponseDTO dto = (AdvanceResponseDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(dto.status()).isEqualTo("processing");
        assertThat(dto.pass()).isEqualTo(2);
        assertThat(dto.blocked()).isNull();
        assertThat(dto.gates()).isNull();
    }

    @Test
    void blockedAdvanceIsUnprocessable() {
        ReportResource resource = buildResource();
        UUID id = UUID.randomUUID();
        GateResult industry = new GateResult(
                GateKind.INDUSTRY, false, 75,
                List.of(GateIssue.of("INDUSTRY_CONTAMINATION", "car wash content")), List.of(), null);
        GateChainResult gates = new GateChainResult(List.of(industry), GateKind.INDUSTRY, "Re-run pass 8");
        when(orchestrator.advance(id))
                .thenReturn(new AdvanceResult(
                        ReportStatus.FAILED, 17, 18, 100, "Finalization blocked by the industry gate", gates));

        Response response = resource.advance(id);
        AdvanceResponseDTO dto = (AdvanceResponseDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(422);
        assertThat(dto.blocked()).isTrue();
        assertThat(dto.hint()).isEqualTo("Re-run pass 8");
        assertThat(dto.gates()).hasSize(1);
    }

    private ReportResource buildResource() {
        ReportResource resource = new ReportResource();
        resource.reportService = reportService;
        resource.orchestrator = orchestrator;
        return resource;
    }
}
