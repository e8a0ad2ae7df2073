/* (C)2026 */
package com.ammann.logquery.registry;

/**
 * Storage type of a registered column; decides how a filter on it is compiled.
 */
public enum ColumnType {
    /** Prefix match, {@code LIKE 'value%'}. */
    TEXT,
    /** Exact match on a parameter cast to INTEGER. */
    INTEGER,
    /** Not filterable by value; reachable through the time window only. */
    TIMESTAMP
}
