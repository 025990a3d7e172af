/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.ApproachType;

/**
 * One row of the weighting table that every downstream consumer reads instead of
 * re-deriving weights.
 */
public record ApproachSummary(ApproachType approach, double value, double weight, double weightedValue) {}
