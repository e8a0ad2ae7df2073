/* (C)2026 */
package com.ammann.logquery.enumeration;

/**
 * The query variants derived from one compiled predicate.
 */
public enum StatementKind {
    /** Joined, sorted, paginated row listing */
    ROWS,
    /** Total number of matching rows */
    COUNT,
    /** Frequency aggregate over one column */
    GROUP,
    /** Hourly buckets split by one column */
    BREAKDOWN
}
