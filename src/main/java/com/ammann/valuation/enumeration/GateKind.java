/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Validation gates in the fixed order the chain runs them.
 */
public enum GateKind {
    /** Displayed figures against the calculation engine output */
    CONSISTENCY,
    /** Wrong-industry keywords in narrative text */
    INDUSTRY,
    /** Derived market multiple against the industry ceiling */
    VALUE,
    /** Weighted composite score over integrity, rules, completeness and formatting */
    QUALITY;

    public String wireName() {
        return name().toLowerCase();
    }
}
