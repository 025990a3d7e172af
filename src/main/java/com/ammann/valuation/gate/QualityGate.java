/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.CalculationMath;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.FinancialInputs;
import com.ammann.valuation.enumeration.ApproachType;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.reconciliation.ValuationFigures;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Composite quality score over four weighted categories.
 *
 * <ul>
 *   <li>data integrity (35%): serialization artifacts in the figures or the narrative
 *   <li>business rules (25%): weights, concluded value, capitalization rate, asset value, range
 *   <li>completeness (25%): every narrative section present with its minimum word count
 *   <li>formatting (15%): {@code N/A} next to critical figures
 * </ul>
 *
 * <p>The gate blocks when a category records a blocking error or the weighted score falls below
 * the threshold.
 */
public class QualityGate implements ValidationGate {

    private static final Logger LOG = Logger.getLogger(QualityGate.class);

    static final double DEFAULT_THRESHOLD = 70;

    static final double DATA_INTEGRITY_WEIGHT = 0.35;
    static final double BUSINESS_RULES_WEIGHT = 0.25;
    static final double COMPLETENESS_WEIGHT = 0.25;
    static final double FORMATTING_WEIGHT = 0.15;

    static final double MIN_CAP_RATE = 0.05;
    static final double MAX_CAP_RATE = 0.60;
    static final double MIN_RANGE_SPREAD = 0.10;
    static final double MAX_RANGE_SPREAD = 0.50;
    static final double WEIGHT_SUM_TOLERANCE = 0.001;

    static final int NEAR_FIELD_CHARS = 100;

    private static final Map<String, Pattern> FORBIDDEN_TOKENS = new LinkedHashMap<>();

    static {
        FORBIDDEN_TOKENS.put("[object Object]", Pattern.compile(Pattern.quote("[object Object]")));
        FORBIDDEN_TOKENS.put("undefined", Pattern.compile("\\bundefined\\b"));
        FORBIDDEN_TOKENS.put("NaN", Pattern.compile("\\bNaN\\b"));
    }

    private static final Pattern NOT_AVAILABLE = Pattern.compile("\\bN/A\\b");
    private static final Pattern CRITICAL_FIELD = Pattern.compile(
            "concluded value|fair market value|asset approach|income approach|market approach"
                    + "|\\bSDE\\b|capitalization rate|valuation range",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_NOT_AVAILABLE = Pattern.compile("\"N/A\"");

    private final double threshold;

    public QualityGate() {
        this(DEFAULT_THRESHOLD);
    }

    public QualityGate(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public GateKind kind() {
        return GateKind.QUALITY;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        List<GateIssue> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        double integrity = dataIntegrity(context, errors, warnings);
        double rules = businessRules(context, errors, warnings);
        double completeness = completeness(context, warnings);
        double formatting = formatting(context, warnings);

        double score = DATA_INTEGRITY_WEIGHT * integrity
                + BUSINESS_RULES_WEIGHT * rules
                + COMPLETENESS_WEIGHT * completeness
                + FORMATTING_WEIGHT * formatting;
        score = Math.round(score * 10) / 10.0;

        if (errors.isEmpty() && score < threshold) {
            errors.add(new GateIssue("QUALITY_BELOW_THRESHOLD", null,
                    String.format("Quality score %.1f is below the pass threshold of %.1f", score, threshold),
                    threshold, score, null));
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("dataIntegrity", integrity);
        metrics.put("businessRules", rules);
        metrics.put("completeness", completeness);
        metrics.put("formatting", formatting);

        LOG.infof("Quality score %.1f (integrity %.0f, rules %.0f, completeness %.0f, formatting %.0f)",
                score, integrity, rules, completeness, formatting);
        return new GateResult(kind(), errors.isEmpty(), score, errors, warnings, metrics);
    }

    double dataIntegrity(GateContext context, List<GateIssue> errors, List<String> warnings) {
        double score = 100;
        for (Map.Entry<String, Pattern> token : FORBIDDEN_TOKENS.entrySet()) {
            Matcher m = token.getValue().matcher(context.serializedData());
            if (m.find()) {
                errors.add(new GateIssue("FORBIDDEN_TOKEN", null,
                        "Report data contains '" + token.getKey() + "'", null, null,
                        IndustryGate.snippet(context.serializedData(), m.start(), m.end())));
                score -= 25;
            }
        }
        for (Map.Entry<String, String> section : context.document().sections().entrySet()) {
            String text = section.getValue() == null ? "" : section.getValue();
            for (Map.Entry<String, Pattern> token : FORBIDDEN_TOKENS.entrySet()) {
                int hits = count(token.getValue(), text);
                if (hits > 0) {
                    warnings.add("Section '" + section.getKey() + "' contains '" + token.getKey() + "' "
                            + hits + " time(s)");
                    score -= 15 * hits;
                }
            }
        }
        score -= 2 * context.engine().warnings().size();
        return clamp(score);
    }

    double businessRules(GateContext context, List<GateIssue> errors, List<String> warnings) {
        CalculationEngineOutput engine = context.engine();
        ValuationFigures shown = context.document().valuation();
        double score = 100;

        double assetWeight = pick(shown == null ? null : shown.assetWeight(), engine.approach(ApproachType.ASSET).weight());
        double incomeWeight = pick(shown == null ? null : shown.incomeWeight(), engine.approach(ApproachType.INCOME).weight());
        double marketWeight = pick(shown == null ? null : shown.marketWeight(), engine.approach(ApproachType.MARKET).weight());
        double weightSum = assetWeight + incomeWeight + marketWeight;
        if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            errors.add(new GateIssue("WEIGHTS_DO_NOT_SUM", "approach_weights",
                    "Approach weights sum to " + CalculationMath.formatPercentage(weightSum), 1.0, weightSum, null));
            score -= 20;
        }

        double concluded = pick(shown == null ? null : shown.concludedValue(), engine.finalConcludedValue());
        if (concluded <= 0) {
            errors.add(new GateIssue("NON_POSITIVE_VALUE", "concluded_value",
                    "Concluded value " + CalculationMath.formatCurrency(concluded) + " is not positive",
                    null, concluded, null));
            score -= 20;
        }

        double capRate = pick(shown == null ? null : shown.capitalizationRate(),
                engine.incomeApproach().capRate().capitalizationRate());
        if (capRate < MIN_CAP_RATE || capRate > MAX_CAP_RATE) {
            errors.add(new GateIssue("CAP_RATE_OUT_OF_RANGE", "capitalization_rate",
                    "Capitalization rate " + CalculationMath.formatPercentage(capRate) + " is outside "
                            + CalculationMath.formatPercentage(MIN_CAP_RATE) + " to "
                            + CalculationMath.formatPercentage(MAX_CAP_RATE),
                    null, capRate, null));
            score -= 20;
        }

        double assetValue = pick(shown == null ? null : shown.assetValue(), engine.approach(ApproachType.ASSET).value());
        if (hasAssets(context.inputs()) && assetValue <= 0) {
            warnings.add("Asset approach value is zero although the company reports assets");
            score -= 5;
        }

        if (concluded > 0) {
            double low = pick(shown == null ? null : shown.rangeLow(), engine.valueRange().low());
            double high = pick(shown == null ? null : shown.rangeHigh(), engine.valueRange().high());
            double spread = (high - low) / concluded;
            if (spread < MIN_RANGE_SPREAD || spread > MAX_RANGE_SPREAD) {
                warnings.add("Valuation range spans " + CalculationMath.formatPercentage(spread)
                        + " of the concluded value");
                score -= 5;
            }
        }
        return clamp(score);
    }

    double completeness(GateContext context, List<String> warnings) {
        double score = 100;
        Map<String, String> sections = context.document().sections();
        for (Map.Entry<String, Integer> required : context.minimumWords().entrySet()) {
            String text = sections.get(required.getKey());
            if (text == null || text.isBlank()) {
                warnings.add("Section '" + required.getKey() + "' is missing");
                score -= 15;
                continue;
            }
            int words = wordCount(text);
            if (words < required.getValue()) {
                warnings.add("Section '" + required.getKey() + "' has " + words + " words, minimum is "
                        + required.getValue());
                score -= 3;
            }
        }
        return clamp(score);
    }

    double formatting(GateContext context, List<String> warnings) {
        double score = 100;
        for (Map.Entry<String, String> section : context.document().sections().entrySet()) {
            String text = section.getValue() == null ? "" : section.getValue();
            Matcher m = NOT_AVAILABLE.matcher(text);
            while (m.find()) {
                int from = Math.max(0, m.start() - NEAR_FIELD_CHARS);
                int to = Math.min(text.length(), m.end() + NEAR_FIELD_CHARS);
                if (CRITICAL_FIELD.matcher(text.substring(from, to)).find()) {
                    warnings.add("Section '" + section.getKey() + "' shows N/A next to a critical figure");
                    score -= 20;
                }
            }
        }
        int rawHits = count(QUOTED_NOT_AVAILABLE, context.serializedData());
        if (rawHits > 0) {
            warnings.add("Report data contains " + rawHits + " N/A value(s)");
            score -= 5 * rawHits;
        }
        return clamp(score);
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static boolean hasAssets(FinancialInputs inputs) {
        if (inputs == null) {
            return false;
        }
        if (inputs.balanceSheet() != null && inputs.balanceSheet().totalAssets() > 0) {
            return true;
        }
        return inputs.reportedTotalAssets() != null && inputs.reportedTotalAssets() > 0;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int hits = 0;
        while (m.find()) {
            hits++;
        }
        return hits;
    }

    private static double pick(Double shown, double engine) {
        return shown != null ? shown : engine;
    }

    private static double clamp(double score) {
        return CalculationMath.clamp(score, 0, 100);
    }
}
