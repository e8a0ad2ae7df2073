/* (C)2026 */
package com.ammann.logquery.observability;

/**
 * Append-only destination of observability records.
 *
 * <p>Implementations must tolerate concurrent appends from in-flight requests and must not
 * throw; a failed append is reported through application logging only.
 */
public interface LogSink {

    void append(ObservabilityRecord record);
}
