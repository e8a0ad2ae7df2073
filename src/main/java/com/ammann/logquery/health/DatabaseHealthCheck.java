/* (C)2026 */
package com.ammann.logquery.health;

import com.ammann.logquery.store.JdbcLogStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that verifies PostgreSQL connectivity through the log store's pool.
 *
 * <p>Reports DOWN if the probe fails or takes longer than 1 second.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final long MAX_PROBE_MILLIS = 1000;

    @Inject
    JdbcLogStore logStore;

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            boolean reachable = logStore.ping();
            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_PROBE_MILLIS;

            return HealthCheckResponse.named("database-health")
                    .status(reachable && performanceOk)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .withData("database-type", "PostgreSQL")
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("database-health")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
