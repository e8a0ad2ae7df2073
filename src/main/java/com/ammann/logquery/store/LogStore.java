/* (C)2026 */
package com.ammann.logquery.store;

import com.ammann.logquery.query.SqlStatement;
import java.sql.SQLException;

/**
 * Database-execution capability used by the query orchestrator.
 *
 * <p>Implementations must be safe for concurrent use; every call is expected to run on its own
 * connection. Test doubles record the submitted statements.
 */
public interface LogStore {

    /**
     * Execute one parameterized statement.
     *
     * @param statement SQL text with its positional parameters
     * @param cancellation handle through which the caller may abort the running statement
     * @return the returned rows and their count
     * @throws SQLException on connectivity, syntax or type-cast failures, or cancellation
     */
    StoreResult execute(SqlStatement statement, QueryCancellation cancellation) throws SQLException;

    /**
     * Execute one parameterized statement that nobody will cancel.
     */
    default StoreResult execute(SqlStatement statement) throws SQLException {
        return execute(statement, new QueryCancellation());
    }
}
