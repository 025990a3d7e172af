/* (C)2026 */
package com.ammann.valuation.exception;

/**
 * Failure talking to the generative text service: transport errors, non-2xx answers, an open
 * circuit breaker or an unreadable response.
 *
 * <p>Inside the pipeline this is a transient condition retried on the next advance. When it
 * escapes to a resource it is mapped to HTTP 503.
 */
public class GenerativeServiceException extends ApiException
{
    public GenerativeServiceException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public GenerativeServiceException(String message)
    {
        super(message);
    }
}
