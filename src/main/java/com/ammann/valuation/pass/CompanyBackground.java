/* (C)2026 */
package com.ammann.valuation.pass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Output of the research pass. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompanyBackground(
        String companyName,
        String legalName,
        String naicsCode,
        String industryDescription,
        Integer yearsInBusiness,
        Integer employeeCount,
        String location,
        String summary) implements PassOutput {}
