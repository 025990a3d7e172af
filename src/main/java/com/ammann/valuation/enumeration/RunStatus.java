/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * State of an asynchronous run on the generative text service.
 */
public enum RunStatus {
    QUEUED,
    IN_PROGRESS,
    /** The service asks for structured tool outputs before it can continue */
    REQUIRES_ACTION,
    COMPLETED,
    FAILED,
    CANCELLED,
    EXPIRED;

    /**
     * Terminal states other than COMPLETED.
     */
    public boolean isTerminalFailure() {
        return this == FAILED || this == CANCELLED || this == EXPIRED;
    }

    /**
     * Case-insensitive conversion from the service's wire value ("in_progress", "requires_action").
     * Statuses the service may add later ("cancelling", "incomplete") map to the closest state.
     *
     * @param value wire value
     * @return run status
     * @throws IllegalArgumentException if value is null or unknown
     */
    public static RunStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("RunStatus value cannot be null");
        }
        String normalized = value.trim().toUpperCase();
        if ("CANCELLING".equals(normalized)) {
            return IN_PROGRESS;
        }
        if ("INCOMPLETE".equals(normalized)) {
            return FAILED;
        }
        for (RunStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid run status: " + value);
    }
}
