/* (C)2026 */
package com.ammann.logquery.dto;

import com.ammann.logquery.enumeration.SortDirection;
import com.ammann.logquery.registry.ColumnRegistry;
import com.ammann.logquery.registry.LogColumn;

/**
 * Validated single-column sort of the row query.
 *
 * <p>The column is always a registered, sortable {@link LogColumn}; unknown columns never
 * reach this type, they fall back to {@link #defaultOrder()} during validation.
 *
 * @param column sort column
 * @param direction sort direction
 */
public record SortRequestDTO(LogColumn column, SortDirection direction) {

    private static final SortRequestDTO DEFAULT =
            new SortRequestDTO(ColumnRegistry.TIMESTAMP, SortDirection.DESCENDING);

    /**
     * @return newest log lines first
     */
    public static SortRequestDTO defaultOrder() {
        return DEFAULT;
    }

    /**
     * Build the ORDER BY clause body (without the {@code ORDER BY} keyword).
     *
     * @return e.g. {@code asli.host_name ASC}
     */
    public String buildOrderByClause() {
        return column.qualifiedName() + " " + direction.sql();
    }
}
