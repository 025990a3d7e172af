/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.enumeration.GateKind;

/**
 * One validation stage. Gates only read the context and never change engine state.
 */
public interface ValidationGate {

    GateKind kind();

    GateResult evaluate(GateContext context);
}
