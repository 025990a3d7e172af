/* (C)2026 */
package com.ammann.valuation.calculation;

import static com.ammann.valuation.calculation.CalculationMath.roundToDollar;

import com.ammann.valuation.calculation.model.EarningsSummary;
import com.ammann.valuation.calculation.model.FiscalYearFinancials;
import com.ammann.valuation.calculation.model.PeriodEarnings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Normalizes each fiscal year to SDE and EBITDA and produces the recency-weighted averages.
 */
public class EarningsCalculator {

    static final double LOW_SDE_THRESHOLD = 50_000;

    /**
     * Recency weights, most recent period first: 1 → [1], 2 → [2,1], 3 → [3,2,1],
     * 4 or more → [4,3,2,1] applied to the four most recent periods.
     */
    static List<Integer> recencyWeights(int periodCount) {
        return switch (periodCount) {
            case 0 -> List.of();
            case 1 -> List.of(1);
            case 2 -> List.of(2, 1);
            case 3 -> List.of(3, 2, 1);
            default -> List.of(4, 3, 2, 1);
        };
    }

    public double sde(FiscalYearFinancials p) {
        return p.netIncome()
                + p.officerCompensation()
                + p.interest()
                + p.depreciation()
                + p.amortization()
                + p.nonRecurring()
                + p.personal()
                + p.charitable()
                + p.meals() * 0.5
                + p.auto() * 0.5
                + p.discretionaryAddbacks();
    }

    public double ebitda(FiscalYearFinancials p, double fairMarketSalary) {
        double excessOwnerCompensation = Math.max(0, p.officerCompensation() - fairMarketSalary);
        return p.netIncome()
                + p.interest()
                + p.taxes()
                + p.depreciation()
                + p.amortization()
                + excessOwnerCompensation
                + p.nonRecurring();
    }

    public EarningsSummary calculate(
            List<FiscalYearFinancials> periods, EngineConfig config, CalculationTrail trail) {
        if (periods.isEmpty()) {
            trail.warn("No fiscal periods extracted; earnings default to zero");
            return new EarningsSummary(List.of(), List.of(), 0, 0, 0);
        }

        List<FiscalYearFinancials> ordered = new ArrayList<>(periods);
        ordered.sort(Comparator.comparingInt(FiscalYearFinancials::fiscalYear).reversed());
        List<Integer> weights = recencyWeights(ordered.size());
        List<FiscalYearFinancials> weighted = ordered.subList(0, weights.size());

        List<PeriodEarnings> normalized = new ArrayList<>();
        List<Double> sdeValues = new ArrayList<>();
        List<Double> ebitdaValues = new ArrayList<>();
        for (FiscalYearFinancials p : weighted) {
            double sde = roundToDollar(sde(p));
            double ebitda = roundToDollar(ebitda(p, config.fairMarketSalary()));
            normalized.add(new PeriodEarnings(p.fiscalYear(), p.grossReceipts(), sde, ebitda));
            sdeValues.add(sde);
            ebitdaValues.add(ebitda);
            trail.step(
                    "earnings.sde." + p.fiscalYear(),
                    "Seller's discretionary earnings for " + p.fiscalYear(),
                    "net income + officer comp + interest + D&A + add-backs + 50% meals/auto",
                    sde,
                    "netIncome", p.netIncome(),
                    "officerCompensation", p.officerCompensation(),
                    "interest", p.interest(),
                    "depreciation", p.depreciation(),
                    "amortization", p.amortization());
            if (sde < 0) {
                trail.warn("Negative SDE of " + CalculationMath.formatCurrency(sde) + " in " + p.fiscalYear());
            }
        }

        double weightedSde = roundToDollar(CalculationMath.weightedAverage(sdeValues, weights));
        double weightedEbitda = roundToDollar(CalculationMath.weightedAverage(ebitdaValues, weights));
        trail.step(
                "earnings.weighted_sde",
                "Recency-weighted SDE",
                "sum(SDE x weight) / sum(weight), weights " + weights,
                weightedSde);
        trail.step(
                "earnings.weighted_ebitda",
                "Recency-weighted EBITDA",
                "sum(EBITDA x weight) / sum(weight), weights " + weights,
                weightedEbitda);

        if (weightedSde >= 0 && weightedSde < LOW_SDE_THRESHOLD) {
            trail.warn("Weighted SDE below " + CalculationMath.formatCurrency(LOW_SDE_THRESHOLD)
                    + "; market multiples may not be meaningful");
        }

        return new EarningsSummary(
                normalized, weights, weightedSde, weightedEbitda, weighted.get(0).grossReceipts());
    }
}
