/* (C)2026 */
package com.ammann.valuation.service;

import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.gate.GateChainResult;
import com.ammann.valuation.reconciliation.ReportDocument;

/**
 * Engine output, merged document and gate verdicts of one finalization.
 */
public record FinalizationOutcome(
        CalculationEngineOutput engine, ReportDocument document, GateChainResult gates) {

    public boolean blocked() {
        return gates.blocked();
    }
}
