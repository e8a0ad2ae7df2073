/* (C)2026 */
package com.ammann.logquery.service;

import com.ammann.logquery.dto.LogQueryRequestDTO;
import com.ammann.logquery.dto.QueryResultDTO;
import com.ammann.logquery.enumeration.TimeWindowPolicy;
import com.ammann.logquery.exception.QueryExecutionException;
import com.ammann.logquery.observability.RequestLogScope;
import com.ammann.logquery.query.CompiledPredicate;
import com.ammann.logquery.query.PredicateCompiler;
import com.ammann.logquery.query.QueryVariantBuilder;
import com.ammann.logquery.query.QueryVariants;
import com.ammann.logquery.query.RequestValidator;
import com.ammann.logquery.query.SqlStatement;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * The two log query operations: the simple row listing and the faceted query.
 *
 * <p>Both run validate, compile, execute and assemble in that order, reporting each phase to
 * the request's {@link RequestLogScope}. A {@link com.ammann.logquery.exception.ValidationException}
 * is thrown before anything is compiled; a {@link QueryExecutionException} aborts the whole
 * request without partial results.
 */
@ApplicationScoped
public class LogQueryService {

    private static final Logger LOG = Logger.getLogger(LogQueryService.class);

    private final RequestValidator validator;
    private final PredicateCompiler compiler;
    private final QueryVariantBuilder variantBuilder;
    private final QueryExecutionService executionService;
    private final ResultAssembler assembler;
    private final int simpleMaxRows;

    @Inject
    public LogQueryService(
            RequestValidator validator,
            PredicateCompiler compiler,
            QueryVariantBuilder variantBuilder,
            QueryExecutionService executionService,
            ResultAssembler assembler,
            @ConfigProperty(name = "logquery.simple.max-rows", defaultValue = "10000") int simpleMaxRows) {
        this.validator = validator;
        this.compiler = compiler;
        this.variantBuilder = variantBuilder;
        this.executionService = executionService;
        this.assembler = assembler;
        this.simpleMaxRows = simpleMaxRows;
    }

    /**
     * Rows inside a mandatory time window, newest first unless a sort is given.
     *
     * @param body parsed request body
     * @param scope logging scope of the request
     * @return matching rows, at most {@code logquery.simple.max-rows}; reaching the cap is
     *     logged and marked on the request record
     */
    public List<Map<String, Object>> simpleQuery(JsonNode body, RequestLogScope scope) {
        LogQueryRequestDTO request = validator.validate(body, TimeWindowPolicy.REQUIRED);

        long compileStart = System.nanoTime();
        CompiledPredicate predicate = compiler.compile(request);
        SqlStatement rows = variantBuilder.buildSimpleRowQuery(predicate, request.sort(), simpleMaxRows);
        scope.compiled(sinceMs(compileStart));

        ExecutionResult execution = execute(List.of(rows), scope);
        List<Map<String, Object>> result = assembler.rows(execution.result(rows.kind()));
        scope.rows(result.size(), result.size());
        if (result.size() >= simpleMaxRows) {
            LOG.warnf("Simple query hit the %d row cap, result is truncated", simpleMaxRows);
            scope.truncated();
        }
        return result;
    }

    /**
     * One page of rows plus total count, group aggregate and hourly breakdown, all filtered by
     * the same predicate. The time window is optional.
     *
     * @param body parsed request body
     * @param scope logging scope of the request
     * @return composite result
     */
    public QueryResultDTO facetedQuery(JsonNode body, RequestLogScope scope) {
        LogQueryRequestDTO request = validator.validate(body, TimeWindowPolicy.OPTIONAL);

        long compileStart = System.nanoTime();
        CompiledPredicate predicate = compiler.compile(request);
        QueryVariants variants = variantBuilder.build(request, predicate);
        scope.compiled(sinceMs(compileStart));

        ExecutionResult execution = execute(variants.statements(), scope);
        QueryResultDTO result = assembler.assemble(execution);
        scope.rows(result.rows().size(), result.totalCount());

        LOG.debugf("Faceted query returned %d of %d rows, %d groups, %d buckets",
                result.rows().size(), result.totalCount(),
                result.groupData().size(), result.chartData().size());
        return result;
    }

    private ExecutionResult execute(List<SqlStatement> statements, RequestLogScope scope) {
        long start = System.nanoTime();
        try {
            ExecutionResult execution = executionService.executeAll(statements);
            scope.sqlExecuted(statements, execution.elapsedMs(), null);
            return execution;
        } catch (QueryExecutionException e) {
            scope.sqlExecuted(statements, sinceMs(start), e.getMessage());
            throw e;
        }
    }

    private static long sinceMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
