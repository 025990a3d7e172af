/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.enumeration.ParseAttempt;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Output that could not be mapped to its pass's variant. {@code payload} is null when the parse
 * failed entirely.
 */
public record RawPassOutput(JsonNode payload, ParseAttempt parseAttempt) implements PassOutput {}
