/* (C)2026 */
package com.ammann.valuation.client;

import com.ammann.valuation.enumeration.RunStatus;
import java.util.List;

/**
 * Observed state of a job.
 *
 * @param toolCalls pending tool calls, only for {@link RunStatus#REQUIRES_ACTION}
 * @param lastError upstream error message for failed runs, may be null
 */
public record RunSnapshot(RunStatus status, List<ToolCall> toolCalls, String lastError) {

    public RunSnapshot {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static RunSnapshot of(RunStatus status) {
        return new RunSnapshot(status, List.of(), null);
    }
}
