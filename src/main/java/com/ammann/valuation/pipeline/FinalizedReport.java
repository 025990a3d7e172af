/* (C)2026 */
package com.ammann.valuation.pipeline;

/**
 * Serialized results written when a report completes.
 */
public record FinalizedReport(
        String calculationResults,
        String reportData,
        String gateResults,
        double concludedValue,
        double qualityScore) {}
