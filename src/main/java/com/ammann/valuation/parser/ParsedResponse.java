/* (C)2026 */
package com.ammann.valuation.parser;

import com.ammann.valuation.enumeration.ParseAttempt;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of parsing one generative response.
 *
 * @param attempt recovery step that produced {@code data}, FAILED when nothing was recovered
 * @param data recovered JSON object, null when the parse failed
 * @param rawText original response text
 */
public record ParsedResponse(ParseAttempt attempt, JsonNode data, String rawText) {

    public boolean succeeded() {
        return attempt != ParseAttempt.FAILED && data != null;
    }

    static ParsedResponse failed(String rawText) {
        return new ParsedResponse(ParseAttempt.FAILED, null, rawText);
    }
}
