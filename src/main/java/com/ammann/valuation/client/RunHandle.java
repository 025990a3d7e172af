/* (C)2026 */
package com.ammann.valuation.client;

/**
 * Identifies one asynchronous job on the generative text service.
 */
public record RunHandle(String threadId, String runId) {

    public RunHandle {
        if (threadId == null || threadId.isBlank() || runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("threadId and runId are required");
        }
    }
}
