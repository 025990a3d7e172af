/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Earnings base used as a benefit stream or as the denominator of a market multiple.
 */
public enum EarningsMetric {
    /** Seller's discretionary earnings */
    SDE,
    /** Earnings before interest, taxes, depreciation and amortization */
    EBITDA,
    /** Gross receipts; only used by the market approach when earnings are not positive */
    REVENUE
}
