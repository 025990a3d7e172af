/* (C)2026 */
package com.ammann.valuation.client;

public record ToolOutput(String toolCallId, String output) {}
