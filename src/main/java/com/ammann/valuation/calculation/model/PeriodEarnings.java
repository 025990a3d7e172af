/* (C)2026 */
package com.ammann.valuation.calculation.model;

/**
 * Normalized earnings of one fiscal year.
 */
public record PeriodEarnings(int fiscalYear, double revenue, double sde, double ebitda) {}
