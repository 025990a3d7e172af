/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.EarningsMetric;

/**
 * Guideline multiple result.
 *
 * @param multipleType earnings base the multiple applies to
 * @param baseMultiple multiple at the configured range position
 * @param adjustedMultiple multiple after risk adjustments, clamping and ceiling
 * @param earningsBase benefit stream the multiple is applied to
 * @param multipleCeiling hard ceiling for the multiple type
 * @param ceilingApplied true when the adjusted multiple was capped at the ceiling
 * @param value indicated value rounded to the thousand
 */
public record MarketApproachResult(
        EarningsMetric multipleType,
        double baseMultiple,
        double adjustedMultiple,
        double earningsBase,
        double multipleCeiling,
        boolean ceilingApplied,
        double value) {}
