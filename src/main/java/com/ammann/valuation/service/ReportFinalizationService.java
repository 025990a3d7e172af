/* (C)2026 */
package com.ammann.valuation.service;

import com.ammann.valuation.calculation.CalculationEngine;
import com.ammann.valuation.calculation.EngineConfig;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.dto.GateDiagnosticDTO;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.exception.SomeThingWentWrongException;
import com.ammann.valuation.gate.GateChainResult;
import com.ammann.valuation.gate.GateContext;
import com.ammann.valuation.gate.ValidationGateChain;
import com.ammann.valuation.pass.FinancialInputsAssembler;
import com.ammann.valuation.pass.PassOutputMapper;
import com.ammann.valuation.pass.PassOutputs;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pass.StoredPassOutput;
import com.ammann.valuation.pipeline.FinalizedReport;
import com.ammann.valuation.pipeline.PipelineStore;
import com.ammann.valuation.reconciliation.ReconciliationService;
import com.ammann.valuation.reconciliation.ReportDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Turns stored pass outputs into a finished report.
 *
 * <p>Order: the engine computes the figures from the extraction passes, reconciliation merges
 * them with the narrative into the candidate document, and the gate chain inspects that
 * combined document. Only an unblocked document is written as the report.
 */
@ApplicationScoped
public class ReportFinalizationService {

    private static final Logger LOG = Logger.getLogger(ReportFinalizationService.class);

    private final PassRegistry registry;
    private final PassOutputMapper mapper;
    private final FinancialInputsAssembler assembler;
    private final CalculationEngine engine;
    private final EngineConfig engineConfig;
    private final ReconciliationService reconciliation;
    private final ValidationGateChain gateChain;
    private final PipelineStore store;
    private final ObjectMapper objectMapper;

    private final Map<GateKind, Counter> gateBlockCounters = new EnumMap<>(GateKind.class);

    @Inject
    public ReportFinalizationService(
            PassRegistry registry,
            PassOutputMapper mapper,
            FinancialInputsAssembler assembler,
            CalculationEngine engine,
            EngineConfig engineConfig,
            ReconciliationService reconciliation,
            ValidationGateChain gateChain,
            PipelineStore store,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.mapper = mapper;
        this.assembler = assembler;
        this.engine = engine;
        this.engineConfig = engineConfig;
        this.reconciliation = reconciliation;
        this.gateChain = gateChain;
        this.store = store;
        this.objectMapper = objectMapper;
        for (GateKind kind : GateKind.values()) {
            gateBlockCounters.put(kind, Counter.builder("valuation_gate_blocks_total")
                    .description("Finalizations blocked, by first blocking gate")
                    .tag("gate", kind.wireName())
                    .register(meterRegistry));
        }
    }

    /**
     * Runs engine, reconciliation and gates without writing anything.
     *
     * @throws com.ammann.valuation.exception.ValidationException if the engine rejects its inputs
     */
    public FinalizationOutcome evaluate(String companyName, List<StoredPassOutput> stored) {
        PassOutputs outputs = mapper.mapAll(stored);
        FinancialInputs inputs = assembler.assemble(outputs, companyName);
        CalculationEngineOutput result = engine.compute(inputs, engineConfig);

        ReportDocument document = reconciliation.reconcile(
                companyName, outputs, outputs.narrativeSections(), result);

        GateContext context = new GateContext(
                result, inputs, document, serializedData(document), registry.minimumWordsBySection());
        GateChainResult gates = gateChain.run(context);
        if (gates.blocked()) {
            gateBlockCounters.get(gates.blockingGate()).increment();
        }
        return new FinalizationOutcome(result, document, gates);
    }

    /**
     * Evaluates the report and writes it as completed, or as blocked when a gate blocks.
     */
    public FinalizationOutcome finalizeReport(UUID reportId, String companyName) {
        FinalizationOutcome outcome = evaluate(companyName, store.loadOutputs(reportId));
        if (outcome.blocked()) {
            store.block(reportId, toJson(GateDiagnosticDTO.fromChain(outcome.gates())),
                    outcome.gates().hint(), toJson(outcome.engine()));
            LOG.warnf("Report %s blocked by %s gate", reportId, outcome.gates().blockingGate().wireName());
        } else {
            store.complete(reportId, toFinalized(outcome));
            LOG.infof("Report %s completed: concluded value %.0f, quality score %.1f",
                    reportId, outcome.engine().finalConcludedValue(), outcome.gates().qualityScore());
        }
        return outcome;
    }

    public FinalizedReport toFinalized(FinalizationOutcome outcome) {
        return new FinalizedReport(
                toJson(outcome.engine()),
                toJson(outcome.document()),
                toJson(GateDiagnosticDTO.fromChain(outcome.gates())),
                outcome.engine().finalConcludedValue(),
                outcome.gates().qualityScore());
    }

    private String serializedData(ReportDocument document) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("company_name", document.companyName());
        data.put("naics_code", document.naicsCode());
        data.put("valuation", document.valuation());
        data.put("financials", document.financials());
        return toJson(data);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SomeThingWentWrongException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
