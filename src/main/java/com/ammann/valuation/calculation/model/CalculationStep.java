/* (C)2026 */
package com.ammann.valuation.calculation.model;

import java.util.Map;

/**
 * Audit trail entry for one calculation step.
 *
 * @param stepId stable identifier such as {@code income.cap_rate}
 * @param description human-readable description
 * @param formula formula in words
 * @param inputs named numeric inputs
 * @param result numeric result of the step
 */
public record CalculationStep(
        String stepId, String description, String formula, Map<String, Double> inputs, double result) {

    public CalculationStep {
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }
}
