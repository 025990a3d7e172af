/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * The three valuation approaches combined by the synthesis step.
 */
public enum ApproachType {
    ASSET,
    INCOME,
    MARKET
}
