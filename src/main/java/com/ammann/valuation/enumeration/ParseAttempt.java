/* (C)2026 */
package com.ammann.valuation.enumeration;

/**
 * Records which recovery step of the response parser produced a pass output.
 */
public enum ParseAttempt {
    /** Direct parse after removing code fences */
    ATTEMPT_1(1),
    /** Parse after stripping control characters and repairing escapes */
    ATTEMPT_2(2),
    /** Parse of the regex-extracted outermost JSON object */
    ATTEMPT_3(3),
    /** Salvage of known fields or raw narrative text */
    ATTEMPT_4(4),
    /** Nothing could be recovered */
    FAILED(0);

    private final int number;

    ParseAttempt(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * Whether the payload came from a real JSON parse rather than salvage.
     */
    public boolean isStructured() {
        return this == ATTEMPT_1 || this == ATTEMPT_2 || this == ATTEMPT_3;
    }
}
