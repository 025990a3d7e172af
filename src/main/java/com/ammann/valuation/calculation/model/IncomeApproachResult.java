/* (C)2026 */
package com.ammann.valuation.calculation.model;

import com.ammann.valuation.enumeration.EarningsMetric;

/**
 * Capitalization of earnings result.
 */
public record IncomeApproachResult(
        EarningsMetric benefitStreamType, double benefitStream, CapRateComponents capRate, double value) {}
