/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Income statement facts for one fiscal year, including the owner-related and
 * non-recurring items that are added back when normalizing earnings.
 *
 * @param fiscalYear four-digit fiscal year, used to order periods most recent first
 * @param grossReceipts total revenue
 * @param costOfGoodsSold cost of goods sold
 * @param netIncome reported net income
 * @param officerCompensation compensation paid to owners/officers
 * @param interest interest expense
 * @param depreciation depreciation expense
 * @param amortization amortization expense
 * @param taxes income taxes
 * @param nonRecurring one-time expenses
 * @param personal personal expenses run through the business
 * @param charitable charitable contributions
 * @param meals meals expense (50% is added back)
 * @param auto auto expense (50% is added back)
 * @param discretionaryAddbacks other discretionary add-backs
 */
public record FiscalYearFinancials(
        int fiscalYear,
        double grossReceipts,
        double costOfGoodsSold,
        double netIncome,
        double officerCompensation,
        double interest,
        double depreciation,
        double amortization,
        double taxes,
        double nonRecurring,
        double personal,
        double charitable,
        double meals,
        double auto,
        double discretionaryAddbacks) {

    /**
     * Creates a period with only the income statement lines and no add-back items.
     */
    public static FiscalYearFinancials of(
            int fiscalYear,
            double grossReceipts,
            double netIncome,
            double officerCompensation,
            double interest,
            double depreciation,
            double amortization,
            double taxes) {
        return new FiscalYearFinancials(
                fiscalYear, grossReceipts, 0, netIncome, officerCompensation, interest,
                depreciation, amortization, taxes, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Returns a copy with the special items of the same fiscal year added on top of the
     * values already present.
     */
    public FiscalYearFinancials withAddBacks(
            double nonRecurring,
            double personal,
            double charitable,
            double meals,
            double auto,
            double discretionary) {
        return new FiscalYearFinancials(
                fiscalYear,
                grossReceipts,
                costOfGoodsSold,
                netIncome,
                officerCompensation,
                interest,
                depreciation,
                amortization,
                taxes,
                this.nonRecurring + nonRecurring,
                this.personal + personal,
                this.charitable + charitable,
                this.meals + meals,
                this.auto + auto,
                this.discretionaryAddbacks + discretionary);
    }
}
