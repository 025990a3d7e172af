/* (C)2026 */
package com.ammann.valuation.pass;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.calculation.model.FiscalYearFinancials;
import com.ammann.valuation.calculation.model.RiskProfile;
import com.ammann.valuation.industry.IndustryMultiplesTable;
import com.ammann.valuation.support.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FinancialInputsAssemblerTest {

    private final PassOutputMapper mapper = new PassOutputMapper(new ObjectMapper(), new PassRegistry());
    private final FinancialInputsAssembler assembler = new FinancialInputsAssembler();

    @Test
    void assemblesEngineInputsFromExtractionPasses() {
        FinancialInputs inputs = assembler.assemble(mapper.mapAll(TestDataFactory.extractionOutputs()), "Fallback");

        assertThat(inputs).isEqualTo(TestDataFactory.engineeringFirmInputs());
    }

    @Test
    void mergesAddBacksIntoMatchingFiscalYear() {
        List<StoredPassOutput> stored = new ArrayList<>(TestDataFactory.extractionOutputs());
        stored.set(4, TestDataFactory.stored(4, "{\"add_backs\":["
                + "{\"fiscal_year\":2023,\"non_recurring\":10000,\"meals\":4000},"
                + "{\"fiscal_year\":2023,\"personal\":6000},"
                + "{\"fiscal_year\":2019,\"personal\":99999}]}"));

        List<FiscalYearFinancials> periods = assembler.periods(mapper.mapAll(stored));

        assertThat(periods).hasSize(2);
        assertThat(periods.get(0).nonRecurring()).isEqualTo(10_000);
        assertThat(periods.get(0).meals()).isEqualTo(4_000);
        assertThat(periods.get(0).personal()).isEqualTo(6_000);
        assertThat(periods.get(1).personal()).isZero();
    }

    @Test
    void fallsBackToResearchThenGivenNameAndGeneralIndustry() {
        FinancialInputs inputs = assembler.assemble(PassOutputs.empty(), "Given Name Inc");

        assertThat(inputs.companyName()).isEqualTo("Given Name Inc");
        assertThat(inputs.naicsCode()).isEqualTo(IndustryMultiplesTable.GENERAL_NAICS);
        assertThat(inputs.periods()).isEmpty();
        assertThat(inputs.balanceSheet()).isNull();
        assertThat(inputs.risk()).isEqualTo(RiskProfile.empty());
    }

    @Test
    void derivesCompanyPremiumFromOverallRiskScore() {
        PassOutputs outputs = mapper.mapAll(List.of(
                TestDataFactory.stored(5, "{\"overall_risk_score\":6,\"risk_factors\":[{\"category\":\"Customers\"}]}")));

        RiskProfile risk = assembler.assemble(outputs, "Acme").risk();

        // (6 - 3) * 1.5%
        assertThat(risk.companySpecificRiskPremium()).isCloseTo(0.045, within(1e-9));
        assertThat(risk.factors()).singleElement().satisfies(f -> {
            assertThat(f.category()).isEqualTo("Customers");
            assertThat(f.score()).isEqualTo(5);
            assertThat(f.rating()).isEqualTo("Moderate");
        });
    }

    @Test
    void riskPremiumIsCapped() {
        PassOutputs outputs = mapper.mapAll(List.of(TestDataFactory.stored(5, "{\"overall_risk_score\":10}")));

        assertThat(assembler.assemble(outputs, "Acme").risk().companySpecificRiskPremium())
                .isEqualTo(FinancialInputsAssembler.MAX_COMPANY_RISK_PREMIUM);
    }
}
