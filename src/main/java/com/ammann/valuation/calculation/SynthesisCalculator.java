/* (C)2026 */
package com.ammann.valuation.calculation;

import static com.ammann.valuation.calculation.CalculationMath.ceilToThousand;
import static com.ammann.valuation.calculation.CalculationMath.floorToThousand;
import static com.ammann.valuation.calculation.CalculationMath.roundToThousand;

import com.ammann.valuation.calculation.model.ApproachSummary;
import com.ammann.valuation.calculation.model.Synthesis;
import com.ammann.valuation.calculation.model.ValueRange;
import com.ammann.valuation.enumeration.ApproachType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weights the approach values, applies discounts and premiums in order, floors the result
 * at the asset value and derives the value range.
 */
public class SynthesisCalculator {

    /** Weighting table plus conclusion. */
    public record Outcome(List<ApproachSummary> approachSummary, Synthesis synthesis) {}

    public Outcome synthesize(
            double assetValue,
            double incomeValue,
            double marketValue,
            EngineConfig config,
            CalculationTrail trail) {

        Map<ApproachType, Double> values = new EnumMap<>(ApproachType.class);
        values.put(ApproachType.ASSET, assetValue);
        values.put(ApproachType.INCOME, incomeValue);
        values.put(ApproachType.MARKET, marketValue);
        Map<ApproachType, Double> weights = effectiveWeights(values, config, trail);

        List<ApproachSummary> summary = new ArrayList<>();
        double preliminary = 0;
        for (ApproachType type : ApproachType.values()) {
            double value = values.get(type);
            double weight = weights.get(type);
            double weighted = Math.round(value * weight);
            preliminary += weighted;
            summary.add(new ApproachSummary(type, value, weight, weighted));
        }
        trail.step(
                "synthesis.preliminary",
                "Preliminary value",
                "sum(approach value x weight)",
                preliminary,
                "asset", assetValue,
                "income", incomeValue,
                "market", marketValue);

        double running = preliminary;
        double dlomRate = config.dlomEnabled() ? config.dlomRate() : 0;
        double dlomAmount = running * dlomRate;
        running -= dlomAmount;

        double dlocRate = config.dlocEnabled() ? config.dlocRate() : 0;
        double dlocAmount = running * dlocRate;
        running -= dlocAmount;

        double premiumRate = config.controlPremium();
        double premiumAmount = running * premiumRate;
        running += premiumAmount;

        trail.step(
                "synthesis.discounts",
                "Value after discounts and premiums",
                "preliminary x (1 - DLOM) x (1 - DLOC) x (1 + control premium)",
                running,
                "dlomRate", dlomRate,
                "dlocRate", dlocRate,
                "controlPremium", premiumRate);

        boolean floorApplied = false;
        if (assetValue > 0 && running < assetValue) {
            trail.warn("Concluded value below adjusted net asset value; floored at "
                    + CalculationMath.formatCurrency(assetValue));
            running = assetValue;
            floorApplied = true;
        }

        double finalValue = roundToThousand(running);
        ValueRange range = valueRange(finalValue, preliminary, summary, config);
        trail.step(
                "synthesis.final",
                "Final concluded value",
                "round to nearest thousand",
                finalValue,
                "rangeLow", range.low(),
                "rangeHigh", range.high());

        Synthesis synthesis = new Synthesis(
                preliminary,
                dlomRate,
                dlomAmount,
                dlocRate,
                dlocAmount,
                premiumRate,
                premiumAmount,
                floorApplied,
                assetValue,
                finalValue,
                range);
        return new Outcome(summary, synthesis);
    }

    /**
     * Configured weights, with the weight of any zero-valued approach moved proportionally to
     * the approaches that produced a value. The result always sums to one.
     */
    Map<ApproachType, Double> effectiveWeights(
            Map<ApproachType, Double> values, EngineConfig config, CalculationTrail trail) {
        Map<ApproachType, Double> configured = new EnumMap<>(ApproachType.class);
        configured.put(ApproachType.ASSET, config.assetWeight());
        configured.put(ApproachType.INCOME, config.incomeWeight());
        configured.put(ApproachType.MARKET, config.marketWeight());

        double retained = 0;
        for (ApproachType type : ApproachType.values()) {
            if (values.get(type) > 0) {
                retained += configured.get(type);
            }
        }
        if (retained <= 0 || Math.abs(retained - 1.0) <= CalculationMath.WEIGHT_EPSILON) {
            return configured;
        }

        Map<ApproachType, Double> redistributed = new EnumMap<>(ApproachType.class);
        for (ApproachType type : ApproachType.values()) {
            if (values.get(type) > 0) {
                redistributed.put(type, configured.get(type) / retained);
            } else {
                redistributed.put(type, 0.0);
                if (configured.get(type) > 0) {
                    trail.warn(type + " approach produced no value; its weight was redistributed");
                }
            }
        }
        return redistributed;
    }

    /**
     * Range half-width from the weighted coefficient of variation of the approach values when
     * at least two approaches carry weight and value; otherwise the configured fallback.
     */
    ValueRange valueRange(
            double finalValue, double preliminary, List<ApproachSummary> summary, EngineConfig config) {
        int contributing = 0;
        double weightTotal = 0;
        double variance = 0;
        for (ApproachSummary row : summary) {
            if (row.value() > 0 && row.weight() > 0) {
                contributing++;
                weightTotal += row.weight();
                variance += row.weight() * Math.pow(row.value() - preliminary, 2);
            }
        }

        double percentage;
        boolean fromDispersion;
        if (contributing >= 2 && preliminary > 0 && weightTotal > 0) {
            double coefficient = Math.sqrt(variance / weightTotal) / preliminary;
            percentage = CalculationMath.clamp(coefficient, config.rangeMinPercent(), config.rangeMaxPercent());
            fromDispersion = true;
        } else {
            percentage = config.rangeFallbackPercent();
            fromDispersion = false;
        }

        double low = floorToThousand(finalValue * (1 - percentage));
        double high = ceilToThousand(finalValue * (1 + percentage));
        return new ValueRange(Math.min(low, finalValue), finalValue, Math.max(high, finalValue), percentage, fromDispersion);
    }
}
