/* (C)2026 */
package com.ammann.logquery.query;

import com.ammann.logquery.enumeration.StatementKind;
import java.util.List;

/**
 * Parameterized SQL text with its positional parameter vector.
 *
 * @param kind which query variant this is
 * @param sql SQL text using {@code ?} placeholders
 * @param parameters values bound to the placeholders, in order
 */
public record SqlStatement(StatementKind kind, String sql, List<Object> parameters) {

    public SqlStatement {
        parameters = List.copyOf(parameters);
    }
}
