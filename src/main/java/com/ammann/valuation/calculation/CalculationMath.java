/* (C)2026 */
package com.ammann.valuation.calculation;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rounding, formatting and parsing helpers shared by the calculators, the gates and the
 * reconciliation layer.
 */
public final class CalculationMath {

    /** Tolerance used when checking that approach weights sum to one. */
    public static final double WEIGHT_EPSILON = 1e-6;

    private static final Pattern CURRENCY =
            Pattern.compile(
                    "^\\$?\\s*([\\d,]+(?:\\.\\d+)?)\\s*(million|billion|thousand|[mMbBkK])?(?:\\s+dollars)?$",
                    Pattern.CASE_INSENSITIVE);

    private CalculationMath() {}

    public static double roundToDollar(double value) {
        return Math.round(value);
    }

    public static double roundToThousand(double value) {
        return Math.round(value / 1000.0) * 1000.0;
    }

    public static double floorToThousand(double value) {
        return Math.floor(value / 1000.0) * 1000.0;
    }

    public static double ceilToThousand(double value) {
        return Math.ceil(value / 1000.0) * 1000.0;
    }

    /**
     * Division that returns {@code fallback} instead of infinity or NaN.
     */
    public static double safeDivide(double numerator, double denominator, double fallback) {
        if (denominator == 0 || Double.isNaN(denominator)) {
            return fallback;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : fallback;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Weighted average {@code sum(v*w) / sum(w)}; values and weights are paired by index.
     *
     * @return 0 when the weights sum to zero
     */
    public static double weightedAverage(List<Double> values, List<Integer> weights) {
        if (values.size() != weights.size()) {
            throw new IllegalArgumentException(
                    "values and weights differ in size: " + values.size() + " vs " + weights.size());
        }
        double weighted = 0;
        double total = 0;
        for (int i = 0; i < values.size(); i++) {
            weighted += values.get(i) * weights.get(i);
            total += weights.get(i);
        }
        return safeDivide(weighted, total, 0);
    }

    public static boolean weightsSumToOne(double... weights) {
        double sum = 0;
        for (double w : weights) {
            sum += w;
        }
        return Math.abs(sum - 1.0) <= WEIGHT_EPSILON;
    }

    /**
     * Relative difference {@code |actual - expected| / |expected|}; when expected is zero the
     * absolute difference is returned.
     */
    public static double relativeDifference(double actual, double expected) {
        if (expected == 0) {
            return Math.abs(actual);
        }
        return Math.abs(actual - expected) / Math.abs(expected);
    }

    /** Formats as whole US dollars, e.g. {@code $1,234,000}. */
    public static String formatCurrency(double value) {
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
        format.setMaximumFractionDigits(0);
        format.setMinimumFractionDigits(0);
        return format.format(value);
    }

    /** Formats a fraction as a percentage with one decimal, e.g. {@code 15.0%}. */
    public static String formatPercentage(double fraction) {
        return String.format(Locale.US, "%.1f%%", fraction * 100);
    }

    /** Formats a multiple with two decimals, e.g. {@code 2.65x}. */
    public static String formatMultiple(double multiple) {
        return String.format(Locale.US, "%.2fx", multiple);
    }

    /**
     * Parses currency text such as {@code $1,234,567}, {@code $1.2M}, {@code 1.5 million}.
     *
     * @return parsed amount or null when the text is not a currency amount
     */
    public static Double parseCurrency(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = CURRENCY.matcher(text.trim());
        if (!m.matches()) {
            return null;
        }
        BigDecimal amount = new BigDecimal(m.group(1).replace(",", ""));
        String unit = m.group(2);
        if (unit != null) {
            long multiplier = switch (unit.toLowerCase(Locale.ROOT)) {
                case "m", "million" -> 1_000_000L;
                case "b", "billion" -> 1_000_000_000L;
                case "k", "thousand" -> 1_000L;
                default -> 1L;
            };
            amount = amount.multiply(BigDecimal.valueOf(multiplier));
        }
        return amount.doubleValue();
    }
}
