/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Range around the concluded value.
 *
 * @param low lower bound rounded down to the thousand
 * @param mid concluded value
 * @param high upper bound rounded up to the thousand
 * @param rangePercentage half-width as a fraction of the concluded value
 * @param derivedFromDispersion true when the percentage came from approach dispersion
 */
public record ValueRange(double low, double mid, double high, double rangePercentage, boolean derivedFromDispersion) {

    public boolean contains(double value) {
        return value >= low && value <= high;
    }
}
