/* (C)2026 */
package com.ammann.valuation.calculation;

import com.ammann.valuation.enumeration.MultiplePosition;
import com.ammann.valuation.exception.ValidationException;

/**
 * Parameters of one engine run. Production values come from {@code valuation.engine.*};
 * {@link #defaults()} mirrors the shipped configuration for tests and standalone use.
 */
public record EngineConfig(
        double assetWeight,
        double incomeWeight,
        double marketWeight,
        double riskFreeRate,
        double equityRiskPremium,
        double sizePremium,
        double industryPremium,
        double companySpecificPremium,
        double longTermGrowth,
        double minCapRate,
        boolean dlomEnabled,
        double dlomRate,
        boolean dlocEnabled,
        double dlocRate,
        double controlPremium,
        MultiplePosition multiplePosition,
        double fairMarketSalary,
        double rangeFallbackPercent,
        double rangeMinPercent,
        double rangeMaxPercent) {

    public static EngineConfig defaults() {
        return new EngineConfig(
                0.20, 0.40, 0.40,
                0.045, 0.055, 0.04, 0.02, 0.03, 0.025, 0.10,
                true, 0.15,
                false, 0.0,
                0.0,
                MultiplePosition.MEDIAN,
                75_000,
                0.15, 0.05, 0.35);
    }

    public EngineConfig withWeights(double asset, double income, double market) {
        return new EngineConfig(
                asset, income, market,
                riskFreeRate, equityRiskPremium, sizePremium, industryPremium,
                companySpecificPremium, longTermGrowth, minCapRate,
                dlomEnabled, dlomRate, dlocEnabled, dlocRate, controlPremium,
                multiplePosition, fairMarketSalary,
                rangeFallbackPercent, rangeMinPercent, rangeMaxPercent);
    }

    public EngineConfig withDlom(boolean enabled, double rate) {
        return new EngineConfig(
                assetWeight, incomeWeight, marketWeight,
                riskFreeRate, equityRiskPremium, sizePremium, industryPremium,
                companySpecificPremium, longTermGrowth, minCapRate,
                enabled, rate, dlocEnabled, dlocRate, controlPremium,
                multiplePosition, fairMarketSalary,
                rangeFallbackPercent, rangeMinPercent, rangeMaxPercent);
    }

    public EngineConfig withRangeFallback(double fallbackPercent) {
        return new EngineConfig(
                assetWeight, incomeWeight, marketWeight,
                riskFreeRate, equityRiskPremium, sizePremium, industryPremium,
                companySpecificPremium, longTermGrowth, minCapRate,
                dlomEnabled, dlomRate, dlocEnabled, dlocRate, controlPremium,
                multiplePosition, fairMarketSalary,
                fallbackPercent, rangeMinPercent, rangeMaxPercent);
    }

    /**
     * Rejects configurations the engine cannot honor.
     *
     * @throws ValidationException on weights not summing to one, negative weights or rates
     *     outside [0, 1)
     */
    public void validate() {
        if (assetWeight < 0 || incomeWeight < 0 || marketWeight < 0) {
            throw ValidationException.invalidParameter(
                    "weights", assetWeight + "/" + incomeWeight + "/" + marketWeight, "non-negative weights");
        }
        if (!CalculationMath.weightsSumToOne(assetWeight, incomeWeight, marketWeight)) {
            throw ValidationException.invalidParameter(
                    "weights",
                    assetWeight + incomeWeight + marketWeight,
                    "approach weights summing to 1.0");
        }
        requireFraction("dlomRate", dlomRate);
        requireFraction("dlocRate", dlocRate);
        requireFraction("rangeFallbackPercent", rangeFallbackPercent);
        if (rangeMinPercent > rangeMaxPercent) {
            throw ValidationException.invalidParameter(
                    "rangeMinPercent", rangeMinPercent, "a value not above rangeMaxPercent " + rangeMaxPercent);
        }
        if (minCapRate <= 0) {
            throw ValidationException.invalidParameter("minCapRate", minCapRate, "a positive rate");
        }
    }

    private static void requireFraction(String name, double value) {
        if (value < 0 || value >= 1) {
            throw ValidationException.invalidParameter(name, value, "a fraction in [0, 1)");
        }
    }
}
