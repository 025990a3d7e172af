/* (C)2026 */
package com.ammann.valuation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.valuation.client.RunHandle;
import com.ammann.valuation.dto.GateDiagnosticDTO;
import com.ammann.valuation.dto.RegenerationEligibilityDTO;
import com.ammann.valuation.dto.RegenerationResponseDTO;
import com.ammann.valuation.enumeration.ParseAttempt;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.exception.GateBlockedException;
import com.ammann.valuation.exception.MissingPassesException;
import com.ammann.valuation.exception.ReportNotFoundException;
import com.ammann.valuation.exception.ReportStateException;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pass.StoredPassOutput;
import com.ammann.valuation.support.InMemoryPipelineStore;
import com.ammann.valuation.support.TestDataFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegenerationServiceTest {

    private InMemoryPipelineStore store;
    private RegenerationService service;
    private UUID reportId;

    @BeforeEach
    void setUp() {
        store = new InMemoryPipelineStore();
        service = new RegenerationService(new PassRegistry(), store, TestDataFactory.finalizationService(store));
        reportId = store.create(TestDataFactory.COMPANY);
    }

    @Test
    void missingNarrativePassesAreListedWithHint() {
        store.putOutputs(reportId, TestDataFactory.extractionOutputs());

        assertThatThrownBy(() -> service.regenerate(reportId))
                .isInstanceOfSatisfying(MissingPassesException.class, e -> {
                    assertThat(e.getAvailablePasses()).containsExactly(0, 1, 2, 3, 4, 5);
                    assertThat(e.getMissingPasses()).containsExactlyElementsOf(
                            IntStream.rangeClosed(6, 17).boxed().toList());
                    assertThat(e.getHint()).isEqualTo("Run pass 6 (write_executive_summary) and the 11 other"
                            + " missing pass(es) through the pipeline before regenerating");
                });
        assertThat(store.row(reportId).status).isEqualTo(ReportStatus.PENDING);
    }

    @Test
    void researchPassIsNotRequired() {
        List<StoredPassOutput> outputs = new ArrayList<>(TestDataFactory.storedOutputs());
        outputs.remove(0);
        store.putOutputs(reportId, outputs);

        RegenerationResponseDTO response = service.regenerate(reportId);

        assertThat(response.success()).isTrue();
    }

    @Test
    void failedParseCountsAsMissing() {
        List<StoredPassOutput> outputs = new ArrayList<>(TestDataFactory.storedOutputs());
        outputs.set(3, new StoredPassOutput(3, null, ParseAttempt.FAILED));
        store.putOutputs(reportId, outputs);

        RegenerationEligibilityDTO eligibility = service.eligibility(reportId);

        assertThat(eligibility.canRegenerate()).isFalse();
        assertThat(eligibility.missingPasses()).containsExactly(3);
        assertThat(eligibility.nextRequiredPass()).isEqualTo(3);
        assertThat(eligibility.hint())
                .isEqualTo("Run pass 3 (extract_balance_sheet_details) through the pipeline before regenerating");
    }

    @Test
    void completeOutputsAreEligible() {
        store.putOutputs(reportId, TestDataFactory.storedOutputs());

        RegenerationEligibilityDTO eligibility = service.eligibility(reportId);

        assertThat(eligibility.canRegenerate()).isTrue();
        assertThat(eligibility.missingPasses()).isEmpty();
        assertThat(eligibility.nextRequiredPass()).isNull();
        assertThat(eligibility.hint()).isNull();
    }

    @Test
    void regenerationCompletesBlockedReport() {
        store.putOutputs(reportId, TestDataFactory.storedOutputs());
        store.block(reportId, "[]", "Re-run pass 8", null);

        RegenerationResponseDTO response = service.regenerate(reportId);

        assertThat(response.valuationSummary().concludedValue()).isEqualTo(922_000);
        assertThat(response.valuationSummary().low()).isLessThan(922_000);
        assertThat(response.valuationSummary().high()).isGreaterThan(922_000);
        assertThat(response.gates()).extracting(GateDiagnosticDTO::gate)
                .containsExactly("consistency", "industry", "value", "quality");
        assertThat(response.corrections()).isZero();
        assertThat(store.row(reportId).status).isEqualTo(ReportStatus.COMPLETED);
        assertThat(store.row(reportId).blocked).isFalse();
    }

    @Test
    void blockedRegenerationKeepsStoredReport() {
        List<StoredPassOutput> outputs = new ArrayList<>(TestDataFactory.storedOutputs());
        outputs.set(7, TestDataFactory.narrativeOutput(7, "The owners also run a car wash next door."));
        store.putOutputs(reportId, outputs);

        assertThatThrownBy(() -> service.regenerate(reportId))
                .isInstanceOfSatisfying(GateBlockedException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Regeneration blocked by the industry gate");
                    assertThat(e.getHint()).contains("pass 7 (write_company_profile)");
                    assertThat(e.getGates()).hasSize(4);
                });
        assertThat(store.row(reportId).status).isEqualTo(ReportStatus.PENDING);
        assertThat(store.row(reportId).finalized).isNull();
    }

    @Test
    void refusesWhilePassIsRunning() {
        store.putOutputs(reportId, TestDataFactory.storedOutputs());
        store.startJob(reportId, new RunHandle("thread-1", "run-1"));

        assertThatThrownBy(() -> service.regenerate(reportId))
                .isInstanceOf(ReportStateException.class)
                .hasMessageContaining("is still running");
    }

    @Test
    void outputStagedForRunningPassIsNotAvailable() {
        store.putOutputs(reportId, TestDataFactory.storedOutputs());
        store.row(reportId).currentPass = 16;
        store.startJob(reportId, new RunHandle("thread-1", "run-1"));
        store.stageOutput(reportId, "run-1", TestDataFactory.narrativeOutput(17, "Staged while running."));

        RegenerationEligibilityDTO eligibility = service.eligibility(reportId);

        assertThat(eligibility.canRegenerate()).isFalse();
        assertThat(eligibility.availablePasses()).doesNotContain(17);
        assertThat(eligibility.missingPasses()).containsExactly(17);
        assertThat(eligibility.hint()).startsWith("Wait for pass 17 (");
        assertThatThrownBy(() -> service.regenerate(reportId)).isInstanceOf(ReportStateException.class);
    }

    @Test
    void runningOptionalPassStillBlocksEligibility() {
        store.putOutputs(reportId, TestDataFactory.storedOutputs());
        store.startJob(reportId, new RunHandle("thread-1", "run-1"));

        RegenerationEligibilityDTO eligibility = service.eligibility(reportId);

        assertThat(eligibility.canRegenerate()).isFalse();
        assertThat(eligibility.missingPasses()).isEmpty();
        assertThat(eligibility.availablePasses()).doesNotContain(0);
        assertThat(eligibility.hint())
                .isEqualTo("Wait for pass 0 (research_company_background) to finish before regenerating");
    }

    @Test
    void refusesCancelledReport() {
        store.markCancelled(reportId);

        assertThatThrownBy(() -> service.regenerate(reportId)).isInstanceOf(ReportStateException.class);
    }

    @Test
    void unknownReport() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> service.eligibility(unknown)).isInstanceOf(ReportNotFoundException.class);
    }
}
