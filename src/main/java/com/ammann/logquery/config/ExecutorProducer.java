/* (C)2026 */
package com.ammann.logquery.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs query variants concurrently.
 *
 * <p>Provides the "log-query-executor" bean used by the query orchestrator. Each faceted
 * request submits at most four statements, so the pool size bounds how many requests hit the
 * database at once.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>logquery.executor.max-async</li>
 *   <li>logquery.executor.max-queued</li>
 * </ul>
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String LOG_QUERY_EXECUTOR = "log-query-executor";

    @ConfigProperty(name = "logquery.executor.max-async", defaultValue = "16")
    int maxAsync;

    @ConfigProperty(name = "logquery.executor.max-queued", defaultValue = "256")
    int maxQueued;

    /**
     * Produces a named ManagedExecutor for query variant execution.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(LOG_QUERY_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createLogQueryExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
