/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.enumeration.GateKind;
import java.util.List;
import java.util.Optional;

/**
 * Results of every gate in chain order.
 *
 * @param blockingGate first gate that blocked, null when finalization may proceed
 * @param hint minimal corrective action when blocked
 */
public record GateChainResult(List<GateResult> results, GateKind blockingGate, String hint) {

    public GateChainResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean blocked() {
        return blockingGate != null;
    }

    public Optional<GateResult> result(GateKind kind) {
        return results.stream().filter(r -> r.gate() == kind).findFirst();
    }

    /** Quality gate score, 0 when the quality gate did not run. */
    public double qualityScore() {
        return result(GateKind.QUALITY).map(GateResult::score).orElse(0.0);
    }
}
