/* (C)2026 */
package com.ammann.valuation.pipeline;

import com.ammann.valuation.calculation.CalculationEngine;
import com.ammann.valuation.calculation.EngineConfig;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.client.JobRequest;
import com.ammann.valuation.enumeration.PassKind;
import com.ammann.valuation.exception.ValidationException;
import com.ammann.valuation.pass.FinancialInputsAssembler;
import com.ammann.valuation.pass.PassDefinition;
import com.ammann.valuation.pass.PassOutputMapper;
import com.ammann.valuation.pass.PassOutputs;
import com.ammann.valuation.pass.PassRegistry;
import com.ammann.valuation.pass.StoredPassOutput;
import com.ammann.valuation.reconciliation.ValuationFigures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Builds the request for one pass: the pass instruction plus a context made of the company
 * name, the stored outputs of its dependencies and, for narrative passes, the calculation
 * engine's figures as the only values the text may state.
 */
@ApplicationScoped
public class PassContextBuilder {

    private static final Logger LOG = Logger.getLogger(PassContextBuilder.class);

    private static final Map<Integer, String> EXTRACTION_FIELDS = Map.of(
            1, "company_name, naics_code, industry_name, entity_type, fiscal_year_end, annual_revenue, total_assets",
            2, "periods: [{fiscal_year, gross_receipts, cost_of_goods_sold, net_income, officer_compensation,"
                    + " interest_expense, depreciation, amortization, income_tax}]",
            3, "cash, accounts_receivable, allowance_for_doubtful_accounts, inventory, total_current_assets,"
                    + " total_assets, total_current_liabilities, total_liabilities, total_equity,"
                    + " fair_value_adjustments: [{item, type (asset|liability), book_value, fair_value}]",
            4, "add_backs: [{fiscal_year, non_recurring, personal, charitable, meals, auto, discretionary}]",
            5, "overall_risk_score, company_specific_risk_premium, industry_risk_premium, customer_concentration,"
                    + " risk_factors: [{category, score (1-10), rating, impact_on_multiple, description}]");

    private final PassRegistry registry;
    private final PassOutputMapper mapper;
    private final FinancialInputsAssembler assembler;
    private final CalculationEngine engine;
    private final EngineConfig engineConfig;
    private final ObjectMapper objectMapper;

    @Inject
    public PassContextBuilder(
            PassRegistry registry,
            PassOutputMapper mapper,
            FinancialInputsAssembler assembler,
            CalculationEngine engine,
            EngineConfig engineConfig,
            ObjectMapper objectMapper) {
        this.registry = registry;
        this.mapper = mapper;
        this.assembler = assembler;
        this.engine = engine;
        this.engineConfig = engineConfig;
        this.objectMapper = objectMapper;
    }

    public JobRequest build(int passNumber, String companyName, List<StoredPassOutput> stored) {
        PassDefinition pass = registry.get(passNumber);
        return new JobRequest(
                pass.number(),
                pass.key(),
                instructions(pass, companyName),
                context(pass, companyName, stored),
                pass.allowsResearch(),
                pass.maxTokens(),
                pass.temperature());
    }

    String instructions(PassDefinition pass, String companyName) {
        return switch (pass.kind()) {
            case RESEARCH -> "Research the business '" + companyName + "': legal name, NAICS code, industry,"
                    + " years in business, employee count, location and a short summary. Call " + pass.key()
                    + " with the fields company_name, legal_name, naics_code, industry_description,"
                    + " years_in_business, employee_count, location, summary.";
            case EXTRACTION -> "Extract from the uploaded financial documents of '" + companyName + "' only"
                    + " values that appear in them; use null for anything not present. Call " + pass.key()
                    + " with the fields " + EXTRACTION_FIELDS.get(pass.number()) + ".";
            case NARRATIVE -> "Write the " + pass.sectionKey().replace('_', ' ') + " section of the business"
                    + " valuation report for '" + companyName + "' in at least " + pass.minWords() + " words."
                    + " State dollar figures exactly as given under 'Authoritative valuation figures' and do not"
                    + " compute different ones. Call " + pass.key() + " with {\"content\": \"...\"}.";
        };
    }

    String context(PassDefinition pass, String companyName, List<StoredPassOutput> stored) {
        StringBuilder sb = new StringBuilder("Company: ").append(companyName).append('\n');
        Map<Integer, StoredPassOutput> byPass = new LinkedHashMap<>();
        stored.forEach(s -> byPass.put(s.passNumber(), s));

        for (int dependency : pass.dependencies()) {
            StoredPassOutput output = byPass.get(dependency);
            if (output == null || output.payload() == null) {
                continue;
            }
            PassDefinition source = registry.get(dependency);
            sb.append("\n## ").append(source.key()).append('\n').append(pretty(output.payload())).append('\n');
        }

        if (pass.needsEngineOutput()) {
            sb.append("\n## Authoritative valuation figures\n");
            sb.append(engineFigures(companyName, stored).orElse("Calculation results are not available."));
            sb.append('\n');
        }
        return sb.toString();
    }

    private Optional<String> engineFigures(String companyName, List<StoredPassOutput> stored) {
        List<StoredPassOutput> extraction = stored.stream()
                .filter(s -> registry.find(s.passNumber()).map(p -> p.kind() != PassKind.NARRATIVE).orElse(false))
                .toList();
        try {
            PassOutputs outputs = mapper.mapAll(extraction);
            CalculationEngineOutput result = engine.compute(assembler.assemble(outputs, companyName), engineConfig);
            Map<String, Object> figures = new LinkedHashMap<>();
            figures.put("valuation", ValuationFigures.fromEngine(result));
            figures.put("approaches", result.approachSummary());
            figures.put("synthesis", result.synthesis());
            figures.put("warnings", result.warnings());
            return Optional.of(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(figures));
        } catch (ValidationException e) {
            LOG.warnf("Calculation for the context of '%s' failed: %s", companyName, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Could not serialize calculation figures for '%s'", companyName);
            return Optional.empty();
        }
    }

    private String pretty(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            LOG.debugf("Stored output is not JSON, passing it through: %s", e.getOriginalMessage());
            return payload;
        }
    }
}
