/* (C)2026 */
package com.ammann.valuation.client;

/**
 * Everything needed to start one pass on the generative service.
 *
 * @param functionName structured-output function the service must call
 * @param instructions pass-specific system instruction
 * @param context user context assembled from prior pass outputs
 * @param allowResearch whether real-time research may be requested
 */
public record JobRequest(
        int passNumber,
        String functionName,
        String instructions,
        String context,
        boolean allowResearch,
        int maxTokens,
        double temperature) {}
