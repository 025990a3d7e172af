/* (C)2026 */
package com.ammann.valuation.exception;

import java.util.UUID;

/**
 * No report exists for the requested id. Mapped to HTTP 404.
 */
public class ReportNotFoundException extends ApiException
{
    public ReportNotFoundException(UUID reportId)
    {
        super("Report not found: " + reportId);
    }
}
