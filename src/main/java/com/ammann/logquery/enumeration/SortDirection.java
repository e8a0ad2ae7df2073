/* (C)2026 */
package com.ammann.logquery.enumeration;

/**
 * Direction of the row query ORDER BY clause.
 */
public enum SortDirection {
    /** Oldest / smallest first */
    ASCENDING("ASC"),
    /** Newest / largest first (default) */
    DESCENDING("DESC");

    private final String sql;

    SortDirection(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /**
     * Parse a caller-supplied direction. Accepts {@code asc}/{@code ascending} in any case;
     * everything else, including {@code null}, is descending.
     *
     * @param value raw direction
     * @return parsed direction
     */
    public static SortDirection fromString(String value) {
        if (value == null) {
            return DESCENDING;
        }
        String normalized = value.trim();
        if ("asc".equalsIgnoreCase(normalized) || "ascending".equalsIgnoreCase(normalized)) {
            return ASCENDING;
        }
        return DESCENDING;
    }
}
