/* (C)2026 */
package com.ammann.logquery.store;

import java.sql.SQLException;
import java.sql.Statement;
import org.jboss.logging.Logger;

/**
 * Cancellation handle of one in-flight store call.
 *
 * <p>The store registers the statement it is about to execute; {@link #cancel()} asks the
 * database to abort it. Interrupting the worker thread alone does not stop a statement that is
 * blocked reading from the server. A handle cancelled before registration rejects the
 * statement, so a late-starting call never reaches the database.
 */
public class QueryCancellation
{
    private static final Logger LOG = Logger.getLogger(QueryCancellation.class);

    private Statement running;
    private boolean cancelled;

    /**
     * @param statement statement about to execute
     * @throws SQLException if this handle was already cancelled
     */
    public synchronized void register(Statement statement) throws SQLException
    {
        if (cancelled) {
            throw new SQLException("Statement cancelled before execution");
        }
        running = statement;
    }

    public synchronized void clear()
    {
        running = null;
    }

    /**
     * Cancel the registered statement, if any, and reject later registrations.
     */
    public synchronized void cancel()
    {
        cancelled = true;
        if (running == null) {
            return;
        }
        try {
            running.cancel();
        } catch (SQLException e) {
            LOG.warnf(e, "Could not cancel running statement");
        }
    }

    public synchronized boolean isCancelled()
    {
        return cancelled;
    }
}
