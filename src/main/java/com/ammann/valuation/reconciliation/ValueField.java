/* (C)2026 */
package com.ammann.valuation.reconciliation;

import java.util.List;

/**
 * Authoritative figures that narrative text commonly restates, with the phrases that identify
 * them in prose.
 */
public enum ValueField {
    CONCLUDED_VALUE("concluded_value", List.of(
            "fair market value", "concluded value", "valuation of", "valued at", "worth",
            "business value", "opinion of value")),
    ASSET_APPROACH("asset_approach_value", List.of(
            "asset approach", "asset-based", "adjusted net asset", "asset method", "net asset value")),
    INCOME_APPROACH("income_approach_value", List.of(
            "income approach", "capitalization of earnings", "capitalized earnings", "income method",
            "earnings-based")),
    MARKET_APPROACH("market_approach_value", List.of(
            "market approach", "guideline", "comparable", "market method", "market-based")),
    SDE("weighted_sde", List.of("seller's discretionary earnings", "discretionary earnings", "sde"));

    private final String fieldName;
    private final List<String> keywords;

    ValueField(String fieldName, List<String> keywords) {
        this.fieldName = fieldName;
        this.keywords = keywords;
    }

    public String fieldName() {
        return fieldName;
    }

    public List<String> keywords() {
        return keywords;
    }
}
