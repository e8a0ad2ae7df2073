/* (C)2026 */
package com.ammann.logquery.exception;

/**
 * Exception indicating that a client-supplied query request does not meet the
 * constraints required to compile it.
 *
 * <p>Mapped to HTTP 400 (Bad Request). Raised before any SQL is compiled or executed.
 * Provides factory methods for the common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public static final String MALFORMED_BODY = "malformed request body";
    public static final String MISSING_TIME_WINDOW = "missing time window";

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a body that is not a JSON object.
     */
    public static ValidationException malformedBody() {
        return new ValidationException(MALFORMED_BODY);
    }

    /**
     * Creates validation exception for an endpoint that requires a time window.
     */
    public static ValidationException missingTimeWindow() {
        return new ValidationException(MISSING_TIME_WINDOW);
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
