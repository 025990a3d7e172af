/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.MultiplePosition;

/**
 * Industry range for one kind of multiple with a hard ceiling above the typical high.
 */
public record MultipleRange(double low, double median, double high, double ceiling, String source) {

    public double at(MultiplePosition position) {
        return switch (position) {
            case LOW -> low;
            case HIGH -> high;
            default -> median;
        };
    }
}
