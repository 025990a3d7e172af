/* (C)2026 */
package com.ammann.valuation.client;

/**
 * Structured output the service asks the caller to acknowledge.
 *
 * @param arguments JSON arguments generated for the function, i.e. the pass output
 */
public record ToolCall(String id, String functionName, String arguments) {}
