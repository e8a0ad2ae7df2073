/* (C)2026 */
package com.ammann.logquery.observability;

import com.ammann.logquery.query.SqlStatement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Logging context of one request; emits the completion record exactly once, on {@link #close()}.
 *
 * <p>Phases that were never reached keep a timing of {@code 0}. A scope closed before any
 * status was reported completes as {@code 500}.
 *
 * <p>Not thread-safe: a scope belongs to the thread handling its request.
 */
public class RequestLogScope implements AutoCloseable
{
    static final int UNREPORTED_STATUS = 500;
    static final String UNREPORTED_ERROR = "request ended without a response";

    private final ObservabilityRecorder recorder;
    private final String endpoint;
    private final String remoteAddress;
    private final long startNanos;

    private long compileMs;
    private long sqlMs;
    private long transformMs;
    private int rowCount;
    private long totalCount;
    private long responseSize;
    private boolean compressed;
    private boolean truncated;
    private Integer status;
    private String error;
    private boolean closed;

    RequestLogScope(ObservabilityRecorder recorder, String endpoint, String remoteAddress)
    {
        this.recorder = recorder;
        this.endpoint = endpoint;
        this.remoteAddress = remoteAddress;
        this.startNanos = System.nanoTime();
    }

    public void compiled(long compileMs)
    {
        this.compileMs = compileMs;
    }

    /**
     * Emit the SQL record for the executed batch. SQL text and parameters stay in the log.
     *
     * @param statements statements submitted to the store
     * @param sqlMs wall-clock time of the concurrent phase
     * @param failure error message if the batch failed, otherwise {@code null}
     */
    public void sqlExecuted(List<SqlStatement> statements, long sqlMs, String failure)
    {
        this.sqlMs = sqlMs;

        List<Map<String, Object>> entries = new ArrayList<>(statements.size());
        for (SqlStatement statement : statements) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", statement.kind().name());
            entry.put("query", statement.sql());
            entry.put("params", loggableParameters(statement.parameters()));
            entries.add(entry);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("statements", entries);
        fields.put("sql_ms", sqlMs);
        if (failure != null) {
            fields.put("error", failure);
        }
        recorder.emit(ObservabilityEvent.SQL_EXECUTED, endpoint, remoteAddress, fields);
        recorder.sqlTimed(endpoint, sqlMs);
    }

    public void rows(int rowCount, long totalCount)
    {
        this.rowCount = rowCount;
        this.totalCount = totalCount;
    }

    /** The row cap cut off the result. */
    public void truncated()
    {
        this.truncated = true;
    }

    public void transformed(long transformMs, boolean compressed)
    {
        this.transformMs = transformMs;
        this.compressed = compressed;
    }

    /**
     * @param status HTTP status sent to the caller
     * @param responseSize response body size in bytes, as sent
     * @param error error message for non-2xx responses, otherwise {@code null}
     */
    public void responded(int status, long responseSize, String error)
    {
        this.status = status;
        this.responseSize = responseSize;
        this.error = error;
    }

    /**
     * @return milliseconds since the request arrived
     */
    public long elapsedMs()
    {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        int finalStatus = status != null ? status : UNREPORTED_STATUS;
        String finalError = status != null ? error : UNREPORTED_ERROR;
        long durationMs = elapsedMs();

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", finalStatus);
        fields.put("duration_ms", durationMs);
        fields.put("compile_ms", compileMs);
        fields.put("sql_ms", sqlMs);
        fields.put("transform_ms", transformMs);
        fields.put("row_count", rowCount);
        fields.put("total_count", totalCount);
        fields.put("response_size", responseSize);
        fields.put("compressed", compressed);
        if (truncated) {
            fields.put("truncated", true);
        }
        if (finalError != null) {
            fields.put("error", finalError);
        }
        recorder.emit(ObservabilityEvent.REQUEST_COMPLETED, endpoint, remoteAddress, fields);
        recorder.completed(endpoint, finalStatus, durationMs, responseSize, finalError);
    }

    private static List<Object> loggableParameters(List<Object> parameters)
    {
        List<Object> loggable = new ArrayList<>(parameters.size());
        for (Object parameter : parameters) {
            if (parameter instanceof Number || parameter instanceof Boolean || parameter instanceof String) {
                loggable.add(parameter);
            } else {
                loggable.add(String.valueOf(parameter));
            }
        }
        return loggable;
    }
}
