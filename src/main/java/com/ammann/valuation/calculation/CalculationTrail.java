/* (C)2026 */
package com.ammann.valuation.calculation;

import com.ammann.valuation.calculation.model.CalculationStep;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects audit steps and warnings while one engine run is in progress. Not thread-safe;
 * a trail belongs to a single {@link CalculationEngine#compute} call.
 */
public final class CalculationTrail {

    private final List<CalculationStep> steps = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void step(String stepId, String description, String formula, double result, Object... inputs) {
        Map<String, Double> named = new LinkedHashMap<>();
        for (int i = 0; i + 1 < inputs.length; i += 2) {
            named.put(String.valueOf(inputs[i]), ((Number) inputs[i + 1]).doubleValue());
        }
        steps.add(new CalculationStep(stepId, description, formula, named, result));
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public List<CalculationStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
