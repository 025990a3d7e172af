/* (C)2026 */
package com.ammann.valuation.reconciliation;

import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.IndustryMultiples;
import com.ammann.valuation.industry.IndustryMultiplesTable;
import com.ammann.valuation.pass.BalanceSheetDetails;
import com.ammann.valuation.pass.CoreCompanyData;
import com.ammann.valuation.pass.NarrativeSection;
import com.ammann.valuation.pass.PassOutputs;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds the final report document from narrative sections and the calculation engine output.
 *
 * <p>Data flows one way, from the engine into the narrative. Every figure is merged field by
 * field with the engine value first; narrative-stated or extracted values are used only for
 * fields the engine did not produce. Narrative amounts that drifted from the engine are
 * rewritten and recorded as corrections.
 */
@ApplicationScoped
public class ReconciliationService {

    private static final Logger LOG = Logger.getLogger(ReconciliationService.class);

    private final NarrativeValueCorrector corrector;

    public ReconciliationService() {
        this(NarrativeValueCorrector.DEFAULT_DRIFT_TOLERANCE);
    }

    @Inject
    public ReconciliationService(
            @ConfigProperty(name = "valuation.gate.consistency.tolerance", defaultValue = "0.01")
                    double driftTolerance) {
        this.corrector = new NarrativeValueCorrector(driftTolerance);
    }

    /**
     * @param engine engine output, null when no calculation result exists
     */
    public ReportDocument reconcile(
            String companyName,
            PassOutputs outputs,
            Map<String, NarrativeSection> sections,
            CalculationEngineOutput engine) {
        boolean hasCalculationEngine = engine != null;

        ValuationFigures fromEngine = hasCalculationEngine ? ValuationFigures.fromEngine(engine) : ValuationFigures.empty();
        ValuationFigures fromNarrative = statedInNarrative(sections);
        ValuationFigures figures = merge(fromEngine, fromNarrative);

        Map<String, String> texts = new LinkedHashMap<>();
        List<Correction> corrections = new ArrayList<>();
        Map<ValueField, Double> authoritative = hasCalculationEngine ? authoritative(fromEngine) : Map.of();
        for (NarrativeSection section : sections.values()) {
            if (authoritative.isEmpty()) {
                texts.put(section.sectionKey(), section.content());
                continue;
            }
            NarrativeValueCorrector.Result result =
                    corrector.correct(section.sectionKey(), section.content(), authoritative);
            texts.put(section.sectionKey(), result.text());
            corrections.addAll(result.corrections());
        }
        if (!corrections.isEmpty()) {
            LOG.infof("Corrected %d narrative amount(s) for '%s'", corrections.size(), companyName);
        }

        String naicsCode = hasCalculationEngine
                ? engine.naicsCode()
                : outputs.coreCompanyData().map(CoreCompanyData::naicsCode).orElse(IndustryMultiplesTable.GENERAL_NAICS);
        IndustryMultiples industry = IndustryMultiplesTable.lookup(naicsCode);

        return new ReportDocument(
                companyName,
                naicsCode,
                industry.industryName(),
                hasCalculationEngine ? ReportDocument.SOURCE_ENGINE : ReportDocument.SOURCE_FALLBACK,
                figures,
                financials(outputs, engine),
                texts,
                corrections,
                hasCalculationEngine ? engine.warnings() : List.of());
    }

    /**
     * Field-by-field merge: the primary value wins whenever it exists.
     */
    static ValuationFigures merge(ValuationFigures primary, ValuationFigures fallback) {
        return new ValuationFigures(
                prefer(primary.assetValue(), fallback.assetValue()),
                prefer(primary.incomeValue(), fallback.incomeValue()),
                prefer(primary.marketValue(), fallback.marketValue()),
                prefer(primary.assetWeight(), fallback.assetWeight()),
                prefer(primary.incomeWeight(), fallback.incomeWeight()),
                prefer(primary.marketWeight(), fallback.marketWeight()),
                prefer(primary.preliminaryValue(), fallback.preliminaryValue()),
                prefer(primary.concludedValue(), fallback.concludedValue()),
                prefer(primary.rangeLow(), fallback.rangeLow()),
                prefer(primary.rangeHigh(), fallback.rangeHigh()),
                prefer(primary.capitalizationRate(), fallback.capitalizationRate()),
                prefer(primary.marketMultiple(), fallback.marketMultiple()),
                prefer(primary.weightedSde(), fallback.weightedSde()));
    }

    private static Double prefer(Double primary, Double fallback) {
        return primary != null ? primary : fallback;
    }

    private ValuationFigures statedInNarrative(Map<String, NarrativeSection> sections) {
        Map<ValueField, Double> stated = new EnumMap<>(ValueField.class);
        for (NarrativeSection section : sections.values()) {
            for (ValueField field : ValueField.values()) {
                if (!stated.containsKey(field)) {
                    Double value = corrector.statedValue(section.content(), field);
                    if (value != null) {
                        stated.put(field, value);
                    }
                }
            }
        }
        return new ValuationFigures(
                stated.get(ValueField.ASSET_APPROACH),
                stated.get(ValueField.INCOME_APPROACH),
                stated.get(ValueField.MARKET_APPROACH),
                null, null, null, null,
                stated.get(ValueField.CONCLUDED_VALUE),
                null, null, null, null,
                stated.get(ValueField.SDE));
    }

    private static Map<ValueField, Double> authoritative(ValuationFigures figures) {
        Map<ValueField, Double> values = new EnumMap<>(ValueField.class);
        for (ValueField field : ValueField.values()) {
            Double value = figures.get(field);
            if (value != null) {
                values.put(field, value);
            }
        }
        return values;
    }

    private static FinancialSummary financials(PassOutputs outputs, CalculationEngineOutput engine) {
        Double extractedRevenue = outputs.coreCompanyData().map(CoreCompanyData::annualRevenue).orElse(null);
        Double totalAssets = outputs.balanceSheet().map(BalanceSheetDetails::totalAssets)
                .orElse(outputs.coreCompanyData().map(CoreCompanyData::totalAssets).orElse(null));
        Double totalLiabilities = outputs.balanceSheet().map(BalanceSheetDetails::totalLiabilities).orElse(null);

        if (engine == null) {
            return new FinancialSummary(extractedRevenue, null, null, totalAssets, totalLiabilities);
        }
        Double engineRevenue = engine.earnings().periods().isEmpty() ? null : engine.earnings().latestRevenue();
        return new FinancialSummary(
                prefer(engineRevenue, extractedRevenue),
                engine.earnings().weightedSde(),
                engine.earnings().weightedEbitda(),
                totalAssets,
                totalLiabilities);
    }
}
