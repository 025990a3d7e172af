/* (C)2026 */
package com.ammann.valuation.exception;

/**
 * Generic internal error for unexpected failures that do not fit a more specific category.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class SomeThingWentWrongException extends ApiException
{
    public SomeThingWentWrongException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public SomeThingWentWrongException(Throwable cause)
    {
        super("Some thing went wrong", cause);
    }
}
