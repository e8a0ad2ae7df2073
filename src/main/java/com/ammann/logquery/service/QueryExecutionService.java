/* (C)2026 */
package com.ammann.logquery.service;

import com.ammann.logquery.config.ExecutorProducer;
import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.exception.QueryExecutionException;
import com.ammann.logquery.query.SqlStatement;
import com.ammann.logquery.store.LogStore;
import com.ammann.logquery.store.QueryCancellation;
import com.ammann.logquery.store.StoreResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs the statements of one request concurrently and joins them all-or-nothing.
 *
 * <p>Every statement is submitted to the "log-query-executor" at once. Results are collected
 * in completion order; the first failure, the request deadline, or an interrupt of the calling
 * thread cancels every sibling that is still running and fails the whole batch. Cancelling
 * aborts the statement on the database through its {@link QueryCancellation} and interrupts
 * the worker. Results of cancelled statements are discarded, so no partial result ever leaves
 * this service.
 */
@ApplicationScoped
public class QueryExecutionService
{
    private static final Logger LOG = Logger.getLogger(QueryExecutionService.class);

    private final LogStore logStore;
    private final ExecutorService executor;
    private final Duration timeout;

    @Inject
    public QueryExecutionService(
            LogStore logStore,
            @Named(ExecutorProducer.LOG_QUERY_EXECUTOR) ExecutorService executor,
            @ConfigProperty(name = "logquery.query-timeout", defaultValue = "30s") Duration timeout)
    {
        this.logStore = logStore;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Execute every statement and wait for all of them.
     *
     * @param statements statements of one request, at most one per {@link StatementKind}
     * @return result per variant and the elapsed wall-clock time
     * @throws QueryExecutionException if any statement fails, the deadline passes, or the
     *     calling thread is interrupted
     */
    public ExecutionResult executeAll(List<SqlStatement> statements)
    {
        long startNanos = System.nanoTime();
        long deadline = startNanos + timeout.toNanos();

        CompletionService<Completed> completion = new ExecutorCompletionService<>(executor);
        List<Future<Completed>> futures = new ArrayList<>(statements.size());
        List<QueryCancellation> cancellations = new ArrayList<>(statements.size());
        try {
            for (SqlStatement statement : statements) {
                QueryCancellation cancellation = new QueryCancellation();
                cancellations.add(cancellation);
                futures.add(completion.submit(() -> run(statement, cancellation)));
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures, cancellations);
            throw new QueryExecutionException("Query executor is saturated", e);
        }

        Map<StatementKind, StoreResult> results = new EnumMap<>(StatementKind.class);
        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Completed> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw new QueryExecutionException(
                            "Query timed out after " + timeout.toMillis() + "ms");
                }
                Completed completed = done.get();
                results.put(completed.statement().kind(), completed.result());
            }
        } catch (ExecutionException e) {
            cancelAll(futures, cancellations);
            throw unwrap(e);
        } catch (InterruptedException e) {
            cancelAll(futures, cancellations);
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Query interrupted", e);
        } catch (QueryExecutionException e) {
            cancelAll(futures, cancellations);
            throw e;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        LOG.debugf("Executed %d statements in %dms", statements.size(), elapsedMs);
        return new ExecutionResult(results, elapsedMs);
    }

    private Completed run(SqlStatement statement, QueryCancellation cancellation)
    {
        try {
            return new Completed(statement, logStore.execute(statement, cancellation));
        } catch (SQLException e) {
            LOG.errorf(e, "%s statement failed: %s params=%s",
                    statement.kind(), statement.sql(), statement.parameters());
            throw new QueryExecutionException(e.getMessage(), statement, e);
        }
    }

    private static QueryExecutionException unwrap(ExecutionException e)
    {
        Throwable cause = e.getCause();
        if (cause instanceof QueryExecutionException queryFailure) {
            return queryFailure;
        }
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : "Query execution failed";
        return new QueryExecutionException(message, cause != null ? cause : e);
    }

    private static void cancelAll(List<Future<Completed>> futures, List<QueryCancellation> cancellations)
    {
        for (QueryCancellation cancellation : cancellations) {
            cancellation.cancel();
        }
        for (Future<Completed> future : futures) {
            future.cancel(true);
        }
    }

    private record Completed(SqlStatement statement, StoreResult result) {}
}
