/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Weighted conclusion of value with the discounts applied in order.
 */
public record Synthesis(
        double preliminaryValue,
        double dlomRate,
        double dlomAmount,
        double dlocRate,
        double dlocAmount,
        double controlPremiumRate,
        double controlPremiumAmount,
        boolean floorApplied,
        double floorValue,
        double finalConcludedValue,
        ValueRange valueRange) {}
