/* (C)2026 */
package com.ammann.valuation.reconciliation;

import com.ammann.valuation.calculation.CalculationMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds currency amounts that narrative text attributes to an authoritative figure and replaces
 * those that drifted from it.
 *
 * <p>An amount is attributed to the field whose keyword occurs closest to it within
 * {@value #CONTEXT_CHARS} characters. Only amounts of at least {@value #MIN_AMOUNT} are
 * considered, and only relative differences above the drift tolerance are corrected. The
 * consistency gate flags drift above the same tolerance, so reconciliation runs with the gate's
 * value.
 */
public class NarrativeValueCorrector {

    static final int CONTEXT_CHARS = 100;
    static final double MIN_AMOUNT = 100_000;
    public static final double DEFAULT_DRIFT_TOLERANCE = 0.01;

    private static final Pattern AMOUNT = Pattern.compile(
            "\\$\\s?\\d+(?:,\\d{3})*(?:\\.\\d+)?(?:\\s?(?:million|billion|thousand|[MBK])\\b)?",
            Pattern.CASE_INSENSITIVE);

    /** Corrected text plus the corrections applied. */
    public record Result(String text, List<Correction> corrections) {}

    /** A currency amount found in text and the field it is attributed to. */
    public record StatedAmount(int start, int end, String original, double amount, ValueField field) {}

    private final double driftTolerance;

    public NarrativeValueCorrector() {
        this(DEFAULT_DRIFT_TOLERANCE);
    }

    public NarrativeValueCorrector(double driftTolerance) {
        if (driftTolerance <= 0) {
            throw new IllegalArgumentException("drift tolerance must be positive: " + driftTolerance);
        }
        this.driftTolerance = driftTolerance;
    }

    public Result correct(String section, String text, Map<ValueField, Double> authoritative) {
        if (text == null || text.isEmpty()) {
            return new Result(text == null ? "" : text, List.of());
        }

        List<StatedAmount> stated = findStatedAmounts(text);
        StringBuilder corrected = new StringBuilder(text);
        List<Correction> corrections = new ArrayList<>();

        // Replace from the end so earlier offsets stay valid
        for (int i = stated.size() - 1; i >= 0; i--) {
            StatedAmount amount = stated.get(i);
            Double truth = authoritative.get(amount.field());
            if (truth == null || truth <= 0) {
                continue;
            }
            if (CalculationMath.relativeDifference(amount.amount(), truth) <= driftTolerance) {
                continue;
            }
            String replacement = CalculationMath.formatCurrency(truth);
            corrected.replace(amount.start(), amount.end(), replacement);
            corrections.add(0, new Correction(section, amount.field().fieldName(), amount.original(), replacement));
        }
        return new Result(corrected.toString(), corrections);
    }

    /**
     * First amount the text attributes to the field, or null.
     */
    public Double statedValue(String text, ValueField field) {
        if (text == null) {
            return null;
        }
        return findStatedAmounts(text).stream()
                .filter(a -> a.field() == field)
                .map(StatedAmount::amount)
                .findFirst()
                .orElse(null);
    }

    /**
     * Currency amounts in the text that can be attributed to a figure, in order of appearance.
     */
    public List<StatedAmount> findStatedAmounts(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<StatedAmount> result = new ArrayList<>();
        Matcher matcher = AMOUNT.matcher(text);
        while (matcher.find()) {
            String original = matcher.group();
            Double amount = CalculationMath.parseCurrency(original);
            if (amount == null || amount < MIN_AMOUNT) {
                continue;
            }
            ValueField field = nearestField(lower, matcher.start(), matcher.end());
            if (field != null) {
                result.add(new StatedAmount(matcher.start(), matcher.end(), original, amount, field));
            }
        }
        return result;
    }

    private static ValueField nearestField(String lower, int start, int end) {
        int from = Math.max(0, start - CONTEXT_CHARS);
        int to = Math.min(lower.length(), end + CONTEXT_CHARS);

        ValueField best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (ValueField field : ValueField.values()) {
            for (String keyword : field.keywords()) {
                int index = lower.indexOf(keyword, from);
                while (index >= 0 && index + keyword.length() <= to) {
                    if (isWordAt(lower, index, keyword.length())) {
                        int distance = index < start ? start - (index + keyword.length()) : index - end;
                        if (distance < bestDistance) {
                            bestDistance = distance;
                            best = field;
                        }
                    }
                    index = lower.indexOf(keyword, index + 1);
                }
            }
        }
        return best;
    }

    private static boolean isWordAt(String text, int index, int length) {
        boolean startOk = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
        int after = index + length;
        boolean endOk = after >= text.length() || !Character.isLetterOrDigit(text.charAt(after));
        return startOk && endOk;
    }
}
