/* (C)2026 */
package com.ammann.valuation.exception;

import com.ammann.valuation.dto.GateDiagnosticDTO;
import java.util.List;

/**
 * Finalization was blocked by a validation gate. Not a fault of the caller's request, so it is
 * mapped to HTTP 422 with per-gate diagnostics and a hint naming the pass to re-run.
 */
public class GateBlockedException extends ApiException
{
    private final List<GateDiagnosticDTO> gates;
    private final String hint;

    public GateBlockedException(String message, List<GateDiagnosticDTO> gates, String hint)
    {
        super(message);
        this.gates = List.copyOf(gates);
        this.hint = hint;
    }

    public List<GateDiagnosticDTO> getGates() {
        return gates;
    }

    public String getHint() {
        return hint;
    }
}
