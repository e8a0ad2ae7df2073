/* (C)2026 */
package com.ammann.logquery.observability;

/**
 * Record kinds written once per request phase.
 */
public enum ObservabilityEvent {
    /** Request received, before any processing */
    REQUEST_ARRIVED("request_arrived"),
    /** Compiled statements with their bound parameters */
    SQL_EXECUTED("sql_executed"),
    /** Final status, timings and sizes */
    REQUEST_COMPLETED("request_completed");

    private final String label;

    ObservabilityEvent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
