/* (C)2026 */
package com.ammann.valuation.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.valuation.calculation.CalculationEngine;
import com.ammann.valuation.calculation.EngineConfig;
import com.ammann.valuation.pass.FinancialInputsAssembler;
import com.ammann.valuation.pass.PassOutputMapper;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.support.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PassContextBuilderTest {

    private final PassRegistry registry = new PassRegistry();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PassContextBuilder builder = new PassContextBuilder(
            registry,
            new PassOutputMapper(objectMapper, registry),
            new FinancialInputsAssembler(),
            new CalculationEngine(),
            EngineConfig.defaults(),
            objectMapper);

    @Test
    void researchInstructionNamesTheCompanyAndTool() {
        String instructions = builder.instructions(registry.get(0), TestDataFactory.COMPANY);

        assertThat(instructions)
                .startsWith("Research the business 'Acme Engineering LLC': legal name, NAICS code, industry,"
                        + " years in business")
                .contains("Call research_company_background with the fields company_name");
    }

    @Test
    void extractionInstructionListsThePassFields() {
        String instructions = builder.instructions(registry.get(3), TestDataFactory.COMPANY);

        assertThat(instructions)
                .contains("only values that appear in them; use null for anything not present")
                .contains("Call extract_balance_sheet_details with the fields cash, accounts_receivable");
    }

    @Test
    void narrativeInstructionStatesMinimumLengthAndAuthoritativeFigures() {
        String instructions = builder.instructions(registry.get(6), TestDataFactory.COMPANY);

        assertThat(instructions)
                .startsWith("Write the executive summary section of the business valuation report for"
                        + " 'Acme Engineering LLC' in at least 400 words.")
                .contains("exactly as given under 'Authoritative valuation figures'")
                .endsWith("Call write_executive_summary with {\"content\": \"...\"}.");
    }
}
