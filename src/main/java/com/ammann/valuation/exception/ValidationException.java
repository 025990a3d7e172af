/* (C)2026 */
package com.ammann.valuation.exception;

/**
 * A client-supplied parameter, engine configuration or dataset does not meet the constraints of
 * the requested operation.
 *
 * <p>Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for missing input data.
     */
    public static ValidationException insufficientData(String resourceType) {
        return new ValidationException(String.format("Insufficient data: %s is required", resourceType));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
