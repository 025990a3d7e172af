/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Owner-related and non-recurring items to add back, per fiscal year. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpecialItems(List<AddBack> addBacks) implements PassOutput {

    public SpecialItems {
        addBacks = addBacks == null ? List.of() : List.copyOf(addBacks);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AddBack(
            Integer fiscalYear,
            Double nonRecurring,
            Double personal,
            Double charitable,
            Double meals,
            Double auto,
            Double discretionary) {}
}
