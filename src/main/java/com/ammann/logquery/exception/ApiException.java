/* (C)2026 */
package com.ammann.logquery.exception;

/**
 * Base unchecked exception for all application-level errors in the log query API.
 *
 * <p>Subclasses represent specific error categories (validation, query execution,
 * response encoding) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler} and by the query resource itself.
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
