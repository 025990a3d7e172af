/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.calculation.CalculationMath;
import com.ammann.valuation.calculation.model.CalculationEngineOutput;
import com.ammann.valuation.calculation.model.MultipleRange;
import com.ammann.valuation.enumeration.EarningsMetric;
import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.industry.IndustryMultiplesTable;
import com.ammann.valuation.reconciliation.ValuationFigures;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Checks the SDE multiple implied by the report against the industry ceiling.
 *
 * <p>The multiple is derived as market value divided by weighted SDE. When SDE is not positive
 * the engine's own SDE multiple is used; for other multiple types no SDE multiple exists and the
 * gate only warns.
 */
public class ValueGate implements ValidationGate {

    private static final Logger LOG = Logger.getLogger(ValueGate.class);

    static final double PENALTY_PER_WARNING = 10;
    /** Slack for the thousand-rounding of the market value. */
    static final double CEILING_TOLERANCE = 0.01;

    @Override
    public GateKind kind() {
        return GateKind.VALUE;
    }

    @Override
    public GateResult evaluate(GateContext context) {
        String naics = context.naicsCode();
        MultipleRange range = IndustryMultiplesTable.lookup(naics).sde();
        List<GateIssue> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("ceiling", range.ceiling());

        if (!IndustryMultiplesTable.isKnown(naics)) {
            warnings.add("NAICS " + naics + " has no multiples table entry, general ceiling of "
                    + CalculationMath.formatMultiple(range.ceiling()) + " applied");
        }

        Double multiple = derivedSdeMultiple(context.engine(), context.document().valuation());
        if (multiple == null) {
            warnings.add("No SDE multiple could be derived, ceiling check skipped");
        } else if (multiple <= 0) {
            metrics.put("sdeMultiple", multiple);
            warnings.add("Derived SDE multiple " + CalculationMath.formatMultiple(multiple) + " is not positive");
        } else {
            metrics.put("sdeMultiple", multiple);
            if (multiple > range.ceiling() * (1 + CEILING_TOLERANCE)) {
                String message = String.format(
                        "SDE multiple %s exceeds the industry ceiling of %s for NAICS %s",
                        CalculationMath.formatMultiple(multiple),
                        CalculationMath.formatMultiple(range.ceiling()),
                        naics);
                errors.add(new GateIssue("MULTIPLE_ABOVE_CEILING", "sde_multiple", message,
                        range.ceiling(), multiple, null));
                LOG.warnf("Value gate blocked: %s", message);
            } else if (multiple > range.high() * (1 + CEILING_TOLERANCE)) {
                warnings.add(String.format("SDE multiple %s is above the typical industry high of %s",
                        CalculationMath.formatMultiple(multiple), CalculationMath.formatMultiple(range.high())));
            } else if (multiple < range.low()) {
                warnings.add(String.format("SDE multiple %s is below the typical industry low of %s",
                        CalculationMath.formatMultiple(multiple), CalculationMath.formatMultiple(range.low())));
            }
        }

        double score = errors.isEmpty() ? 100 - PENALTY_PER_WARNING * warnings.size() : 0;
        return new GateResult(kind(), errors.isEmpty(), score, errors, warnings, metrics);
    }

    /**
     * Market value over weighted SDE, preferring the figures the report displays.
     *
     * @return null when neither figure nor engine multiple yields an SDE multiple
     */
    static Double derivedSdeMultiple(CalculationEngineOutput engine, ValuationFigures shown) {
        double marketValue = shown != null && shown.marketValue() != null
                ? shown.marketValue()
                : engine.marketApproach().value();
        double sde = shown != null && shown.weightedSde() != null
                ? shown.weightedSde()
                : engine.earnings().weightedSde();
        if (sde > 0) {
            return marketValue / sde;
        }
        if (engine.marketApproach().multipleType() == EarningsMetric.SDE) {
            return engine.marketApproach().adjustedMultiple();
        }
        return null;
    }
}
