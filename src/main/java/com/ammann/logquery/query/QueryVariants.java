/* (C)2026 */
package com.ammann.logquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The statements compiled for one faceted request.
 *
 * @param predicate predicate shared by all variants
 * @param rows row listing
 * @param count total count
 * @param group group aggregate, or {@code null} when not requested
 * @param breakdown hourly breakdown, or {@code null} when not requested
 */
public record QueryVariants(
        CompiledPredicate predicate,
        SqlStatement rows,
        SqlStatement count,
        SqlStatement group,
        SqlStatement breakdown) {

    public Optional<SqlStatement> groupStatement() {
        return Optional.ofNullable(group);
    }

    public Optional<SqlStatement> breakdownStatement() {
        return Optional.ofNullable(breakdown);
    }

    /**
     * @return every statement to execute, rows first
     */
    public List<SqlStatement> statements() {
        List<SqlStatement> statements = new ArrayList<>(4);
        statements.add(rows);
        statements.add(count);
        if (group != null) {
            statements.add(group);
        }
        if (breakdown != null) {
            statements.add(breakdown);
        }
        return List.copyOf(statements);
    }
}
