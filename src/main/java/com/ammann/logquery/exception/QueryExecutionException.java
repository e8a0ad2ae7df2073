/* (C)2026 */
package com.ammann.logquery.exception;

import com.ammann.logquery.query.SqlStatement;

/**
 * Failure while executing one of the compiled statements against the log store
 * (connectivity loss, SQL error, type-cast error, timeout).
 *
 * <p>Mapped to HTTP 500. Carries the failing statement so the caller can log its SQL
 * and bound parameters; the statement is never returned to the client.
 */
public class QueryExecutionException extends ApiException
{
    private final transient SqlStatement statement;

    public QueryExecutionException(String message, SqlStatement statement, Throwable cause)
    {
        super(message, cause);
        this.statement = statement;
    }

    public QueryExecutionException(String message, Throwable cause)
    {
        this(message, null, cause);
    }

    public QueryExecutionException(String message)
    {
        this(message, null, null);
    }

    /**
     * @return the statement that failed, or {@code null} when the failure is not tied to one
     */
    public SqlStatement getStatement()
    {
        return statement;
    }
}
