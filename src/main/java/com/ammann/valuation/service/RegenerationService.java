/* (C)2026 */
package com.ammann.valuation.service;

import com.ammann.valuation.dto.GateDiagnosticDTO;
import com.ammann.valuation.dto.RegenerationEligibilityDTO;
import com.ammann.valuation.dto.RegenerationResponseDTO;
import com.ammann.valuation.dto.RegenerationResponseDTO.ValuationSummaryDTO;
import com.ammann.valuation.enumeration.ParseAttempt;
import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.exception.GateBlockedException;
import com.ammann.valuation.exception.MissingPassesException;
import com.ammann.valuation.exception.ReportNotFoundException;
import com.ammann.valuation.exception.ReportStateException;
import com.ammann.valuation.pass.PassDefinition;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pass.StoredPassOutput;
import com.ammann.valuation.pipeline.PipelineState;
import com.ammann.valuation.pipeline.PipelineStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Rebuilds a report from its stored pass outputs without calling the generative service:
 * engine, reconciliation and gate chain run again and the result replaces the stored report.
 */
@ApplicationScoped
public class RegenerationService {

    private static final Logger LOG = Logger.getLogger(RegenerationService.class);

    private final PassRegistry registry;
    private final PipelineStore store;
    private final ReportFinalizationService finalizer;

    @Inject
    public RegenerationService(PassRegistry registry, PipelineStore store, ReportFinalizationService finalizer) {
        this.registry = registry;
        this.store = store;
        this.finalizer = finalizer;
    }

    /**
     * Regeneration readiness as the POST endpoint would judge it. Output staged for a pass that
     * is still running does not count as available.
     */
    public RegenerationEligibilityDTO eligibility(UUID reportId) {
        PipelineState state = load(reportId);
        List<Integer> available = availablePasses(state, store.loadOutputs(reportId));
        List<Integer> missing = missingPasses(available);
        String refusal = refusal(state);
        String hint = refusal != null ? refusal : missing.isEmpty() ? null : hint(missing);
        return new RegenerationEligibilityDTO(
                missing.isEmpty() && refusal == null,
                available,
                missing,
                missing.isEmpty() ? null : missing.get(0),
                hint);
    }

    /**
     * @throws MissingPassesException if a required pass has no stored output
     * @throws GateBlockedException if a gate blocks the rebuilt report; the stored report is kept
     * @throws ReportStateException if a pass is still running or the report was cancelled
     */
    public RegenerationResponseDTO regenerate(UUID reportId) {
        PipelineState state = load(reportId);
        if (state.status() == ReportStatus.CANCELLED) {
            throw new ReportStateException("Report " + reportId + " was cancelled and cannot be regenerated");
        }
        if (state.hasJobInFlight()) {
            throw new ReportStateException(
                    "Pass " + state.nextPass() + " of report " + reportId + " is still running");
        }

        List<StoredPassOutput> outputs = store.loadOutputs(reportId);
        List<Integer> available = availablePasses(state, outputs);
        List<Integer> missing = missingPasses(available);
        if (!missing.isEmpty()) {
            LOG.infof("Regeneration of report %s refused, missing passes %s", reportId, missing);
            throw new MissingPassesException(available, missing, hint(missing));
        }

        FinalizationOutcome outcome = finalizer.evaluate(state.companyName(), outputs);
        List<GateDiagnosticDTO> gates = GateDiagnosticDTO.fromChain(outcome.gates());
        if (outcome.blocked()) {
            throw new GateBlockedException(
                    "Regeneration blocked by the " + outcome.gates().blockingGate().wireName() + " gate",
                    gates,
                    outcome.gates().hint());
        }

        store.complete(reportId, finalizer.toFinalized(outcome));
        LOG.infof("Regenerated report %s: concluded value %.0f", reportId, outcome.engine().finalConcludedValue());
        return new RegenerationResponseDTO(
                true,
                "Report regenerated from stored pass outputs",
                new ValuationSummaryDTO(
                        outcome.engine().finalConcludedValue(),
                        outcome.engine().valueRange().low(),
                        outcome.engine().valueRange().high(),
                        outcome.gates().qualityScore()),
                gates,
                outcome.document().corrections().size());
    }

    List<Integer> missingPasses(List<Integer> available) {
        Set<Integer> present = Set.copyOf(available);
        return registry.requiredForRegeneration().stream()
                .filter(p -> !present.contains(p))
                .toList();
    }

    String hint(List<Integer> missing) {
        PassDefinition next = registry.get(missing.get(0));
        return "Run pass " + next.number() + " (" + next.key() + ")"
                + (missing.size() > 1 ? " and the " + (missing.size() - 1) + " other missing pass(es)" : "")
                + " through the pipeline before regenerating";
    }

    private String refusal(PipelineState state) {
        if (state.status() == ReportStatus.CANCELLED) {
            return "The report was cancelled and cannot be regenerated";
        }
        if (state.hasJobInFlight()) {
            PassDefinition running = registry.get(state.nextPass());
            return "Wait for pass " + running.number() + " (" + running.key() + ") to finish before regenerating";
        }
        return null;
    }

    private static List<Integer> availablePasses(PipelineState state, List<StoredPassOutput> outputs) {
        Set<Integer> available = new TreeSet<>();
        for (StoredPassOutput output : outputs) {
            boolean running = state.hasJobInFlight() && output.passNumber() == state.nextPass();
            if (!running && output.payload() != null && output.parseAttempt() != ParseAttempt.FAILED) {
                available.add(output.passNumber());
            }
        }
        return List.copyOf(available);
    }

    private PipelineState load(UUID reportId) {
        return store.load(reportId).orElseThrow(() -> new ReportNotFoundException(reportId));
    }
}
