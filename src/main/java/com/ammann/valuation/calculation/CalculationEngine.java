/* (C)2026 */
package com.ammann.valuation.calculation;

import com.ammann.valuation.calculation.model.AssetApproachResult;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.EarningsSummary;
import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.calculation.model.IncomeApproachResult;
import com.ammann.valuation.calculation.model.IndustryMultiples;
import com.ammann.valuation.calculation.model.MarketApproachResult;
import com.ammann.valuation.exception.ValidationException;
import com.ammann.valuation.industry.IndustryMultiplesTable;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Deterministic valuation: normalized earnings, the three approaches, weighting, discounts
 * and the final value range. Same inputs and configuration always produce the same output.
 */
@ApplicationScoped
public class CalculationEngine {

    private static final Logger LOG = Logger.getLogger(CalculationEngine.class);

    public static final String ENGINE_VERSION = "1.0.0";

    private final EarningsCalculator earningsCalculator = new EarningsCalculator();
    private final AssetApproachCalculator assetCalculator = new AssetApproachCalculator();
    private final IncomeApproachCalculator incomeCalculator = new IncomeApproachCalculator();
    private final MarketApproachCalculator marketCalculator = new MarketApproachCalculator();
    private final SynthesisCalculator synthesisCalculator = new SynthesisCalculator();

    /**
     * Runs the full calculation.
     *
     * @throws ValidationException if the configuration is invalid or inputs are missing
     */
    public CalculationEngineOutput compute(FinancialInputs inputs, EngineConfig config) {
        if (inputs == null) {
            throw ValidationException.insufficientData("financial inputs");
        }
        config.validate();

        CalculationTrail trail = new CalculationTrail();
        IndustryMultiples industry = inputs.industry() != null
                ? inputs.industry()
                : IndustryMultiplesTable.lookup(inputs.naicsCode());

        EarningsSummary earnings = earningsCalculator.calculate(inputs.periods(), config, trail);
        AssetApproachResult asset =
                assetCalculator.calculate(inputs.balanceSheet(), inputs.reportedTotalAssets(), trail);
        IncomeApproachResult income = incomeCalculator.calculate(earnings, inputs.risk(), config, trail);
        MarketApproachResult market =
                marketCalculator.calculate(earnings, industry, inputs.risk(), config, trail);

        SynthesisCalculator.Outcome outcome =
                synthesisCalculator.synthesize(asset.value(), income.value(), market.value(), config, trail);

        CalculationEngineOutput output = new CalculationEngineOutput(
                ENGINE_VERSION,
                industry.naicsCode(),
                earnings,
                asset,
                income,
                market,
                outcome.approachSummary(),
                outcome.synthesis(),
                trail.steps(),
                trail.warnings());

        LOG.debugf(
                "Engine run for '%s': asset=%.0f income=%.0f market=%.0f final=%.0f (%d warnings)",
                inputs.companyName(),
                asset.value(),
                income.value(),
                market.value(),
                output.finalConcludedValue(),
                trail.warnings().size());
        return output;
    }
}
