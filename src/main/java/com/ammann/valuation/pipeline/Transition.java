/* (C)2026 */
package com.ammann.valuation.pipeline;

/**
 * Next state and the action that leads there.
 */
public record Transition(PipelineState state, PipelineAction action) {}
