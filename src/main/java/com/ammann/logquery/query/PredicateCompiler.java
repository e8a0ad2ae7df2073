/* (C)2026 */
package com.ammann.logquery.query;

import com.ammann.logquery.dto.LogQueryRequestDTO;
import com.ammann.logquery.dto.TimeWindowDTO;
import com.ammann.logquery.registry.ColumnRegistry;
import com.ammann.logquery.registry.LogColumn;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles the time window and filters of a validated request into one
 * {@link CompiledPredicate}.
 *
 * <p>Security: caller values only ever travel as bound parameters. Identifiers come from
 * {@link LogColumn#qualifiedName()}; the relative interval is bound and cast to
 * {@code INTERVAL} by the database rather than spliced into the SQL text.
 *
 * <p>Parameters are appended in exactly the order their fragments are emitted: time window
 * first, then filters in request order. Compiling the same request twice yields identical
 * fragments and parameters.
 */
@ApplicationScoped
public class PredicateCompiler {

    static final String RELATIVE_WINDOW =
            ColumnRegistry.TIMESTAMP.qualifiedName() + " > NOW() - CAST(? AS INTERVAL)";
    static final String RANGE_WINDOW =
            ColumnRegistry.TIMESTAMP.qualifiedName() + " BETWEEN ? AND ?";

    /**
     * Compile the shared predicate of a request.
     *
     * @param request validated request
     * @return fragments and their parameter vector
     */
    public CompiledPredicate compile(LogQueryRequestDTO request) {
        List<String> fragments = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();

        TimeWindowDTO window = request.timeWindow();
        if (window.isRelative()) {
            fragments.add(RELATIVE_WINDOW);
            parameters.add(window.interval());
        } else if (window.isRange()) {
            fragments.add(RANGE_WINDOW);
            parameters.add(OffsetDateTime.ofInstant(window.from(), ZoneOffset.UTC));
            parameters.add(OffsetDateTime.ofInstant(window.to(), ZoneOffset.UTC));
        }

        for (Map.Entry<LogColumn, String> filter : request.filters().entrySet()) {
            LogColumn column = filter.getKey();
            switch (column.type()) {
                case INTEGER -> {
                    fragments.add(column.qualifiedName() + " = CAST(? AS INTEGER)");
                    parameters.add(filter.getValue());
                }
                case TEXT -> {
                    fragments.add(column.qualifiedName() + " LIKE ?");
                    parameters.add(filter.getValue() + "%");
                }
                default -> throw new IllegalStateException(
                        "Column " + column.columnName() + " is not filterable by value");
            }
        }

        return new CompiledPredicate(fragments, parameters);
    }
}
