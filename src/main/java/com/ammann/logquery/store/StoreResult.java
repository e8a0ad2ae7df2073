/* (C)2026 */
package com.ammann.logquery.store;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by one statement, each an ordered column-label to value map.
 *
 * @param rows result rows in database order
 * @param rowCount number of rows
 */
public record StoreResult(List<Map<String, Object>> rows, int rowCount) {

    private static final StoreResult EMPTY = new StoreResult(List.of(), 0);

    public StoreResult {
        rows = List.copyOf(rows);
    }

    public static StoreResult of(List<Map<String, Object>> rows) {
        return new StoreResult(rows, rows.size());
    }

    public static StoreResult empty() {
        return EMPTY;
    }
}
