/* (C)2026 */
package com.ammann.valuation.gate;

/**
 * Wrong-industry keyword found in a narrative section.
 *
 * @param snippet text around the first match, with {@code ...} where it was cut
 */
public record IndustryViolation(String section, String keyword, String snippet) {}
