/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.enumeration.ReportStatus;
import com.ammann.valuation.gate.GateChainResult;

/**
 * Outcome of one advance call.
 *
 * @param pass last completed pass, -1 before the first
 * @param progress static progress percentage
 * @param gates gate diagnostics when the call finalized or was blocked
 */
public record AdvanceResult(
        ReportStatus status,
        int pass,
        int totalPasses,
        int progress,
        String message,
        GateChainResult gates) {

    public boolean blocked() {
        return gates != null && gates.blocked();
    }

    public String hint() {
        return gates == null ? null : gates.hint();
    }
}
