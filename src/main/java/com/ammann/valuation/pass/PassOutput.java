/* (C)2026 */
package com.ammann.valuation.pass;

/**
 * Typed view of one stored pass output. Each known pass maps to one variant; payloads that do
 * not fit their variant, or whose parse failed, stay available as {@link RawPassOutput}.
 */
public sealed interface PassOutput
        permits CompanyBackground,
                CoreCompanyData,
                IncomeStatementDetails,
                BalanceSheetDetails,
                SpecialItems,
                BusinessMetrics,
                NarrativeSection,
                RawPassOutput {}
