/* (C)2026 */
package com.ammann.logquery.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Emits the arrival, SQL and completion records of every query request.
 *
 * <p>Callers open a {@link RequestLogScope} when the request arrives and close it in a
 * try-with-resources block; the completion record is written on close, on every exit path.
 * Records go to the {@link LogSink}; a summary line goes to application logging and request
 * counts and SQL latency go to Micrometer.
 */
@ApplicationScoped
public class ObservabilityRecorder
{
    private static final Logger LOG = Logger.getLogger(ObservabilityRecorder.class);

    static final String REQUESTS_METRIC = "logquery_requests_total";
    static final String SQL_DURATION_METRIC = "logquery_sql_duration";

    private final LogSink sink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Inject
    public ObservabilityRecorder(LogSink sink, MeterRegistry meterRegistry)
    {
        this(sink, meterRegistry, Clock.systemUTC());
    }

    ObservabilityRecorder(LogSink sink, MeterRegistry meterRegistry, Clock clock)
    {
        this.sink = sink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Record the arrival of a request and open its logging scope.
     *
     * @param endpoint request path
     * @param remoteAddress caller address
     * @param request request body as received (parsed JSON or raw text)
     * @return scope that emits the completion record when closed
     */
    public RequestLogScope open(String endpoint, String remoteAddress, Object request)
    {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("request", request);
        emit(ObservabilityEvent.REQUEST_ARRIVED, endpoint, remoteAddress, fields);
        LOG.debugf("Request arrived: %s from %s", endpoint, remoteAddress);
        return new RequestLogScope(this, endpoint, remoteAddress);
    }

    void emit(ObservabilityEvent event, String endpoint, String remoteAddress, Map<String, Object> fields)
    {
        ObservabilityRecord record =
                new ObservabilityRecord(event, clock.instant(), endpoint, remoteAddress, fields);
        try {
            sink.append(record);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Log sink rejected %s record for %s", event.label(), endpoint);
        }
    }

    void sqlTimed(String endpoint, long sqlMs)
    {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder(SQL_DURATION_METRIC)
                .description("Wall-clock time of the concurrent SQL phase")
                .tag("endpoint", endpoint)
                .register(meterRegistry)
                .record(Duration.ofMillis(sqlMs));
    }

    void completed(String endpoint, int status, long durationMs, long responseSize, String error)
    {
        if (meterRegistry != null) {
            Counter.builder(REQUESTS_METRIC)
                    .description("Count of completed log query requests")
                    .tag("endpoint", endpoint)
                    .tag("status", String.valueOf(status))
                    .register(meterRegistry)
                    .increment();
        }

        if (status >= 500) {
            LOG.errorf("%s -> %d in %dms: %s", endpoint, status, durationMs, error);
        } else if (status >= 400) {
            LOG.warnf("%s -> %d in %dms: %s", endpoint, status, durationMs, error);
        } else {
            LOG.infof("%s -> %d in %dms (%d bytes)", endpoint, status, durationMs, responseSize);
        }
    }
}
