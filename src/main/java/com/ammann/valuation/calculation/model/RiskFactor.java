/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Company-specific risk factor scored during extraction.
 *
 * @param category risk category (e.g. customer concentration)
 * @param score 1 (low risk) to 10 (high risk)
 * @param rating textual rating
 * @param impactOnMultiple relative multiple adjustment, e.g. -0.05 for a 5% haircut
 * @param description free-text justification
 */
public record RiskFactor(String category, int score, String rating, double impactOnMultiple, String description) {}
