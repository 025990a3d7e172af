/* (C)2026 */
package com.ammann.valuation.calculation;

import static com.ammann.valuation.calculation.CalculationMath.roundToThousand;

import com.ammann.valuation.calculation.model.EarningsSummary;
import com.ammann.valuation.calculation.model.IndustryMultiples;
import com.ammann.valuation.calculation.model.MarketApproachResult;
import com.ammann.valuation.calculation.model.MultipleRange;
import com.ammann.valuation.calculation.model.RiskFactor;
import com.ammann.valuation.calculation.model.RiskProfile;
import com.ammann.valuation.enumeration.EarningsMetric;

/**
 * Guideline transaction method: industry multiple adjusted for company risk, applied to the
 * benefit stream.
 */
public class MarketApproachCalculator {

    static final double EBITDA_MULTIPLE_THRESHOLD = 1_000_000;
    static final double MIN_EARNINGS_MULTIPLE = 0.5;
    static final double MIN_REVENUE_MULTIPLE = 0.05;

    public MarketApproachResult calculate(
            EarningsSummary earnings,
            IndustryMultiples industry,
            RiskProfile risk,
            EngineConfig config,
            CalculationTrail trail) {

        EarningsMetric type = selectMultipleType(earnings);
        double stream = switch (type) {
            case EBITDA -> earnings.weightedEbitda();
            case REVENUE -> earnings.latestRevenue();
            default -> earnings.weightedSde();
        };

        MultipleRange range = industry.rangeFor(type);
        double base = range.at(config.multiplePosition());
        double adjusted = base;
        for (RiskFactor factor : risk.factors()) {
            adjusted *= 1 + factor.impactOnMultiple();
        }

        double ceiling = range.ceiling() > 0 ? range.ceiling() : base * 2;
        double floor = type == EarningsMetric.REVENUE ? MIN_REVENUE_MULTIPLE : MIN_EARNINGS_MULTIPLE;
        boolean ceilingApplied = false;
        if (adjusted > ceiling) {
            ceilingApplied = true;
            if (type == EarningsMetric.SDE) {
                trail.warn("CRITICAL: SDE multiple " + CalculationMath.formatMultiple(adjusted)
                        + " exceeds the " + industry.industryName() + " ceiling of "
                        + CalculationMath.formatMultiple(ceiling) + "; capped at the ceiling");
            } else {
                trail.warn(type + " multiple " + CalculationMath.formatMultiple(adjusted)
                        + " capped at ceiling " + CalculationMath.formatMultiple(ceiling));
            }
        }
        adjusted = CalculationMath.clamp(adjusted, floor, ceiling);
        adjusted = Math.round(adjusted * 100) / 100.0;

        trail.step(
                "market.multiple",
                "Risk-adjusted " + type + " multiple",
                "base multiple x product(1 + risk impact), clamped to [" + floor + ", ceiling]",
                adjusted,
                "baseMultiple", base,
                "ceiling", ceiling,
                "riskFactors", risk.factors().size());

        if (stream <= 0) {
            trail.warn("No positive earnings or revenue base; market approach value is zero");
            return new MarketApproachResult(type, base, adjusted, stream, ceiling, ceilingApplied, 0);
        }

        double value = roundToThousand(stream * adjusted);
        trail.step(
                "market.value",
                "Market approach value",
                type + " x multiple",
                value,
                "earningsBase", stream,
                "multiple", adjusted);
        return new MarketApproachResult(type, base, adjusted, stream, ceiling, ceilingApplied, value);
    }

    EarningsMetric selectMultipleType(EarningsSummary earnings) {
        if (earnings.weightedSde() <= 0 && earnings.weightedEbitda() <= 0) {
            return EarningsMetric.REVENUE;
        }
        if (earnings.weightedSde() >= EBITDA_MULTIPLE_THRESHOLD && earnings.weightedEbitda() > 0) {
            return EarningsMetric.EBITDA;
        }
        return EarningsMetric.SDE;
    }
}
