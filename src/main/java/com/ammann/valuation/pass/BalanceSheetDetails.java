/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Most recent balance sheet with optional fair-value adjustments. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BalanceSheetDetails(
        Double cash,
        Double accountsReceivable,
        Double allowanceForDoubtfulAccounts,
        Double inventory,
        Double totalCurrentAssets,
        Double totalAssets,
        Double totalCurrentLiabilities,
        Double totalLiabilities,
        Double totalEquity,
        List<Adjustment> fairValueAdjustments) implements PassOutput {

    public BalanceSheetDetails {
        fairValueAdjustments = fairValueAdjustments == null ? List.of() : List.copyOf(fairValueAdjustments);
    }

    /**
     * @param type "asset" or "liability"
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Adjustment(String item, String type, Double bookValue, Double fairValue) {

        public boolean isLiability() {
            return "liability".equalsIgnoreCase(type);
        }
    }
}
