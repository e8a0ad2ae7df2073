/* (C)2026 */
package com.ammann.logquery.exception;

/**
 * Failure while serializing or compressing a response body.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class ResponseEncodingException extends ApiException
{
    public ResponseEncodingException(Throwable cause)
    {
        super("Response encoding failed", cause);
    }
}
