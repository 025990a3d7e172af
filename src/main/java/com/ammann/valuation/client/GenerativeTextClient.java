/* (C)2026 */
package com.ammann.valuation.client;

import com.ammann.valuation.exception.GenerativeServiceException;
import java.util.List;
import java.util.Optional;

/**
 * Opaque asynchronous text generation: submit, poll, optionally acknowledge tool calls, poll
 * again until a terminal state. Every method throws {@link GenerativeServiceException} on
 * transport or service errors.
 */
public interface GenerativeTextClient {

    RunHandle startRun(JobRequest request);

    RunSnapshot getRun(RunHandle handle);

    RunSnapshot submitToolOutputs(RunHandle handle, List<ToolOutput> outputs);

    /**
     * Text of the latest assistant message of a completed run, empty when there is none.
     */
    Optional<String> latestResponseText(RunHandle handle);

    /** Best-effort cancellation of a job nobody will consume. */
    void cancelRun(RunHandle handle);

    /**
     * Whether the client is configured and not currently short-circuiting calls.
     */
    boolean isAvailable();
}
