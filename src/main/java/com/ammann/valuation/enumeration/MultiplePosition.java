/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Point of an industry multiple range used as the market approach starting multiple.
 */
public enum MultiplePosition {
    LOW,
    MEDIAN,
    HIGH
}
