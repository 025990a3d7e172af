/* (C)2026 */
package com.ammann.valuation.pass;

import com.ammann.valuation.enumeration.ParseAttempt;

/**
 * Persisted pass output as read back from the datastore.
 *
 * @param payload JSON text, null when the parse failed
 */
public record StoredPassOutput(int passNumber, String payload, ParseAttempt parseAttempt) {}
