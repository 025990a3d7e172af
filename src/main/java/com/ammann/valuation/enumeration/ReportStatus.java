/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Lifecycle status of a valuation report.
 * <p>
 * Expected transition sequence is PENDING to PROCESSING and then to COMPLETED, FAILED or
 * CANCELLED. A report blocked by the gate chain is FAILED until a regeneration completes it.
 */
public enum ReportStatus {
    /** Report created at upload time, no pass started yet */
    PENDING,
    /** Passes are being driven by the orchestrator */
    PROCESSING,
    /** Engine, gates and reconciliation finished and the record was written */
    COMPLETED,
    /** Unrecoverable error or blocking gate verdict */
    FAILED,
    /** Cancelled by the user; further advance calls are no-ops */
    CANCELLED;

    /**
     * Whether no further pipeline work happens for a report in this status.
     *
     * @return true for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Lower-case wire name used in API payloads.
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
