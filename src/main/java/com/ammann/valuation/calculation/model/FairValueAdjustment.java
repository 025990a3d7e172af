/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Itemized restatement of a balance sheet line from book value to fair market value.
 *
 * @param item line item name
 * @param liability true when the line is a liability
 * @param bookValue value carried on the balance sheet
 * @param fairValue appraised fair market value
 */
public record FairValueAdjustment(String item, boolean liability, double bookValue, double fairValue) {

    /** Fair value minus book value. */
    public double delta() {
        return fairValue - bookValue;
    }
}
