/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Identity and classification of the subject company.
 *
 * @param totalAssets total assets reported outside a balance sheet, used when no balance sheet
 *     could be extracted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CoreCompanyData(
        String companyName,
        String naicsCode,
        String industryName,
        String entityType,
        String fiscalYearEnd,
        Double annualRevenue,
        Double totalAssets) implements PassOutput {}
