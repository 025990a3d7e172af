/* (C)2026 */
package com.ammann.valuation.exception;

/**
 * The operation is not allowed while the report is in its current status. Mapped to HTTP 409.
 */
public class ReportStateException extends ApiException
{
    public ReportStateException(String message)
    {
        super(message);
    }
}
