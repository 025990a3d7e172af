/* (C)2026 */
package com.ammann.valuation.reconciliation;

/**
 * One narrative amount replaced by the authoritative figure.
 */
public record Correction(String section, String field, String original, String replacement) {}
