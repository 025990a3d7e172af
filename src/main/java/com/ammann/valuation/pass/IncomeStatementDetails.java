/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Income statements per fiscal year. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncomeStatementDetails(List<Period> periods) implements PassOutput {

    public IncomeStatementDetails {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Period(
            Integer fiscalYear,
            Double grossReceipts,
            Double costOfGoodsSold,
            Double netIncome,
            Double officerCompensation,
            Double interestExpense,
            Double depreciation,
            Double amortization,
            Double incomeTax) {}
}
