/* (C)2026 */
package com.ammann.valuation.exception;

import java.util.List;

/**
 * Regeneration was requested but some required pass outputs are not stored yet.
 *
 * <p>Mapped to HTTP 400 with the available and missing pass numbers and a corrective hint.
 */
public class MissingPassesException extends ApiException
{
    private final List<Integer> availablePasses;
    private final List<Integer> missingPasses;
    private final String hint;

    public MissingPassesException(List<Integer> availablePasses, List<Integer> missingPasses, String hint)
    {
        super("Cannot regenerate: missing pass outputs " + missingPasses);
        this.availablePasses = List.copyOf(availablePasses);
        this.missingPasses = List.copyOf(missingPasses);
        this.hint = hint;
    }

    public List<Integer> getAvailablePasses() {
        return availablePasses;
    }

    public List<Integer> getMissingPasses() {
        return missingPasses;
    }

    public String getHint() {
        return hint;
    }
}
