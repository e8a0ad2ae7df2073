/* (C)2026 */
package com.ammann.logquery.enumeration;

/**
 * Whether an endpoint refuses requests that carry no time window.
 */
public enum TimeWindowPolicy {
    /** Reject with "missing time window" */
    REQUIRED,
    /** Proceed unbounded */
    OPTIONAL
}
