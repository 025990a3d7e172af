/* (C)2026 */
package com.ammann.valuation.exception;

/**
 * Base unchecked exception for all application-level errors of the valuation pipeline API.
 *
 * <p>Subclasses represent specific error categories and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
