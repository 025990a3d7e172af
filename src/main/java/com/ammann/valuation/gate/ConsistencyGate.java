/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.CalculationMath;
import com.ammann.valuation.calculation.model.ApproachSummary;
import com.ammann.valuation.calculation.model.BalanceSheet;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.enumeration.ApproachType;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.reconciliation.NarrativeValueCorrector;
import com.ammann.valuation.reconciliation.NarrativeValueCorrector.StatedAmount;
import com.ammann.valuation.reconciliation.ValuationFigures;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Cross-checks every figure displayed in the report against the calculation engine.
 *
 * <p>Values are compared with a relative tolerance, weights with an absolute one. A figure the
 * report does not display is not checked. Amounts stated in the narrative sections are attributed
 * to a figure the same way reconciliation does and compared with the same relative tolerance; each
 * drifting amount is reported against its section.
 */
public class ConsistencyGate implements ValidationGate {

    private static final Logger LOG = Logger.getLogger(ConsistencyGate.class);

    static final double DEFAULT_TOLERANCE = 0.01;
    static final double WEIGHT_TOLERANCE = 0.001;
    static final double PENALTY_PER_ERROR = 25;
    static final double BALANCE_TOLERANCE = 0.01;
    static final double MAX_APPROACH_SPREAD = 1.0;

    private final double tolerance;
    private final NarrativeValueCorrector narrativeScanner;

    public ConsistencyGate() {
        this(DEFAULT_TOLERANCE);
    }

    public ConsistencyGate(double tolerance) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
        this.tolerance = tolerance;
        this.narrativeScanner = new NarrativeValueCorrector(tolerance);
    }

    @Override
    public GateKind kind() {
        return GateKind.CONSISTENCY;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        CalculationEngineOutput engine = context.engine();
        ValuationFigures shown = context.document().valuation();
        List<GateIssue> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (shown == null) {
            errors.add(GateIssue.of("MISSING_VALUATION", "Report carries no valuation figures"));
        } else {
            checkValue(errors, "asset_approach_value", engine.approach(ApproachType.ASSET).value(), shown.assetValue());
            checkValue(errors, "income_approach_value", engine.approach(ApproachType.INCOME).value(), shown.incomeValue());
            checkValue(errors, "market_approach_value", engine.approach(ApproachType.MARKET).value(), shown.marketValue());
            checkWeight(errors, "asset_weight", engine.approach(ApproachType.ASSET).weight(), shown.assetWeight());
            checkWeight(errors, "income_weight", engine.approach(ApproachType.INCOME).weight(), shown.incomeWeight());
            checkWeight(errors, "market_weight", engine.approach(ApproachType.MARKET).weight(), shown.marketWeight());
            checkValue(errors, "preliminary_value", engine.synthesis().preliminaryValue(), shown.preliminaryValue());
            checkValue(errors, "concluded_value", engine.finalConcludedValue(), shown.concludedValue());
            checkValue(errors, "value_range_low", engine.valueRange().low(), shown.rangeLow());
            checkValue(errors, "value_range_high", engine.valueRange().high(), shown.rangeHigh());
        }
        checkNarrative(errors, context.document().sections(), ValuationFigures.fromEngine(engine));

        if (context.inputs() != null) {
            balanceWarning(context.inputs().balanceSheet()).ifPresent(warnings::add);
        }
        spreadWarning(engine).ifPresent(warnings::add);

        double score = Math.max(0, 100 - PENALTY_PER_ERROR * errors.size());
        if (!errors.isEmpty()) {
            LOG.warnf("Consistency gate found %d mismatched figure(s): %s",
                    errors.size(), errors.stream().map(GateIssue::field).toList());
        }
        return new GateResult(kind(), errors.isEmpty(), score, errors, warnings,
                Map.of("mismatches", (double) errors.size()));
    }

    private void checkValue(List<GateIssue> errors, String field, double expected, Double actual) {
        if (actual == null) {
            return;
        }
        if (CalculationMath.relativeDifference(actual, expected) > tolerance) {
            errors.add(GateIssue.mismatch(field, expected, actual));
        }
    }

    private void checkNarrative(List<GateIssue> errors, Map<String, String> sections, ValuationFigures truth) {
        sections.forEach((section, text) -> {
            for (StatedAmount stated : narrativeScanner.findStatedAmounts(text)) {
                Double expected = truth.get(stated.field());
                if (expected == null || expected <= 0) {
                    continue;
                }
                if (CalculationMath.relativeDifference(stated.amount(), expected) > tolerance) {
                    errors.add(GateIssue.narrativeMismatch(
                            section, stated.field().fieldName(), expected, stated.amount(), stated.original()));
                }
            }
        });
    }

    private static void checkWeight(List<GateIssue> errors, String field, double expected, Double actual) {
        if (actual == null) {
            return;
        }
        if (Math.abs(actual - expected) > WEIGHT_TOLERANCE) {
            errors.add(GateIssue.weightMismatch(field, expected, actual));
        }
    }

    static Optional<String> balanceWarning(BalanceSheet sheet) {
        if (sheet == null || sheet.totalAssets() <= 0 || sheet.totalEquity() == 0) {
            return Optional.empty();
        }
        double liabilitiesAndEquity = sheet.totalLiabilities() + sheet.totalEquity();
        double gap = Math.abs(sheet.totalAssets() - liabilitiesAndEquity);
        if (gap / sheet.totalAssets() > BALANCE_TOLERANCE) {
            return Optional.of(String.format(
                    "Balance sheet does not balance: assets %s vs liabilities plus equity %s",
                    CalculationMath.formatCurrency(sheet.totalAssets()),
                    CalculationMath.formatCurrency(liabilitiesAndEquity)));
        }
        return Optional.empty();
    }

    static Optional<String> spreadWarning(CalculationEngineOutput engine) {
        double[] positive = engine.approachSummary().stream()
                .mapToDouble(ApproachSummary::value)
                .filter(v -> v > 0)
                .toArray();
        if (positive.length < 2) {
            return Optional.empty();
        }
        double min = Arrays.stream(positive).min().orElse(0);
        double max = Arrays.stream(positive).max().orElse(0);
        double spread = (max - min) / min;
        if (spread > MAX_APPROACH_SPREAD) {
            return Optional.of(String.format(
                    "Approach values diverge by %s (lowest %s, highest %s)",
                    CalculationMath.formatPercentage(spread),
                    CalculationMath.formatCurrency(min),
                    CalculationMath.formatCurrency(max)));
        }
        return Optional.empty();
    }
}
