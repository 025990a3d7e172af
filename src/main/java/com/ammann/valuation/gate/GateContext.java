/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.reconciliation.ReportDocument;
import java.util.Map;

/**
 * Read-only view of a computed report handed to every gate.
 *
 * @param engine authoritative calculation output
 * @param inputs engine inputs assembled from the extraction passes
 * @param document merged report as it would be persisted
 * @param serializedData JSON of the document's figures, scanned for serialization defects
 * @param minimumWords minimum word count per narrative section key
 */
public record GateContext(
        CalculationEngineOutput engine,
        FinancialInputs inputs,
        ReportDocument document,
        String serializedData,
        Map<String, Integer> minimumWords) {

    public GateContext {
        if (engine == null || document == null) {
            throw new IllegalArgumentException("Gates need the engine output and the report document");
        }
        serializedData = serializedData == null ? "" : serializedData;
        minimumWords = minimumWords == null ? Map.of() : Map.copyOf(minimumWords);
    }

    public String naicsCode() {
        return document.naicsCode() != null ? document.naicsCode() : engine.naicsCode();
    }
}
