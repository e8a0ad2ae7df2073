/* (C)2026 */
package com.ammann.logquery.dto;

import com.ammann.logquery.registry.LogColumn;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable log query request.
 *
 * <p>Every column reference is a registered {@link LogColumn}. Filters keep the order in which
 * the caller listed them, which is also the order their predicates and parameters are emitted.
 *
 * @param timeWindow time window, never {@code null}
 * @param filters filterable column to scalar value, in request order
 * @param sort row order, never {@code null}
 * @param pagination page selection, never {@code null}
 * @param groupBy frequency aggregate column, or {@code null}
 * @param chartBreakdownBy breakdown column, or {@code null}
 */
public record LogQueryRequestDTO(
        TimeWindowDTO timeWindow,
        Map<LogColumn, String> filters,
        SortRequestDTO sort,
        PageRequestDTO pagination,
        LogColumn groupBy,
        LogColumn chartBreakdownBy) {

    public LogQueryRequestDTO {
        timeWindow = timeWindow != null ? timeWindow : TimeWindowDTO.unbounded();
        filters = filters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(filters))
                : Map.of();
        sort = sort != null ? sort : SortRequestDTO.defaultOrder();
        pagination = pagination != null ? pagination : PageRequestDTO.defaults();
    }

    public Optional<LogColumn> groupColumn() {
        return Optional.ofNullable(groupBy);
    }

    public Optional<LogColumn> breakdownColumn() {
        return Optional.ofNullable(chartBreakdownBy);
    }
}
