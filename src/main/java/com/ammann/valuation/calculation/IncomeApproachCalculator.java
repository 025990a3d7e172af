/* (C)2026 */
package com.ammann.valuation.calculation;

import static com.ammann.valuation.calculation.CalculationMath.roundToThousand;

import com.ammann.valuation.calculation.model.CapRateComponents;
import com.ammann.valuation.calculation.model.EarningsSummary;
import com.ammann.valuation.calculation.model.IncomeApproachResult;
import com.ammann.valuation.calculation.model.RiskProfile;
import com.ammann.valuation.enumeration.EarningsMetric;

/**
 * Single-period capitalization of earnings with a build-up discount rate.
 */
public class IncomeApproachCalculator {

    /** Weighted SDE at or above this level switches the benefit stream to EBITDA. */
    static final double EBITDA_STREAM_THRESHOLD = 1_000_000;

    public CapRateComponents capRate(EngineConfig config, RiskProfile risk) {
        double industryPremium = risk.industryRiskPremium() != null
                ? risk.industryRiskPremium()
                : config.industryPremium();
        double companyPremium = risk.companySpecificRiskPremium() != null
                ? risk.companySpecificRiskPremium()
                : config.companySpecificPremium();
        double discountRate = config.riskFreeRate()
                + config.equityRiskPremium()
                + config.sizePremium()
                + industryPremium
                + companyPremium;
        double capRate = Math.max(config.minCapRate(), discountRate - config.longTermGrowth());
        return new CapRateComponents(
                config.riskFreeRate(),
                config.equityRiskPremium(),
                config.sizePremium(),
                industryPremium,
                companyPremium,
                discountRate,
                config.longTermGrowth(),
                capRate);
    }

    public IncomeApproachResult calculate(
            EarningsSummary earnings, RiskProfile risk, EngineConfig config, CalculationTrail trail) {
        CapRateComponents components = capRate(config, risk);
        trail.step(
                "income.cap_rate",
                "Capitalization rate",
                "rf + ERP + size + industry + company-specific - growth, floored at "
                        + CalculationMath.formatPercentage(config.minCapRate()),
                components.capitalizationRate(),
                "discountRate", components.discountRate(),
                "longTermGrowth", components.longTermGrowthRate());

        EarningsMetric streamType = earnings.weightedSde() >= EBITDA_STREAM_THRESHOLD
                ? EarningsMetric.EBITDA
                : EarningsMetric.SDE;
        double stream = streamType == EarningsMetric.EBITDA ? earnings.weightedEbitda() : earnings.weightedSde();

        if (stream <= 0) {
            trail.warn("Benefit stream is not positive; income approach value is zero");
            return new IncomeApproachResult(streamType, stream, components, 0);
        }

        double value = roundToThousand(stream / components.capitalizationRate());
        trail.step(
                "income.value",
                "Income approach value",
                "benefit stream / capitalization rate",
                value,
                "benefitStream", stream,
                "capitalizationRate", components.capitalizationRate());
        return new IncomeApproachResult(streamType, stream, components, value);
    }
}
