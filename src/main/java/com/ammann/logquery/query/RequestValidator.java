/* (C)2026 */
package com.ammann.logquery.query;

import com.ammann.logquery.dto.LogQueryRequestDTO;
import com.ammann.logquery.dto.PageRequestDTO;
import com.ammann.logquery.dto.SortRequestDTO;
import com.ammann.logquery.dto.TimeWindowDTO;
import com.ammann.logquery.enumeration.SortDirection;
import com.ammann.logquery.enumeration.TimeWindowPolicy;
import com.ammann.logquery.exception.ValidationException;
import com.ammann.logquery.registry.ColumnRegistry;
import com.ammann.logquery.registry.LogColumn;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Turns a parsed request body into a {@link LogQueryRequestDTO}.
 *
 * <p>Only two conditions are fatal: a body that is not a JSON object, and a missing or
 * unparsable time window on endpoints that require one. Everything else degrades:
 * <ul>
 *   <li>invalid pagination falls back to page 1 / 100 rows</li>
 *   <li>an unknown sort column falls back to the default order</li>
 *   <li>an unknown group or breakdown column omits that aggregate</li>
 *   <li>unknown filter keys and non-scalar filter values are dropped</li>
 * </ul>
 */
@ApplicationScoped
public class RequestValidator {

    private static final Logger LOG = Logger.getLogger(RequestValidator.class);

    /**
     * Validate a request body.
     *
     * @param body parsed JSON body, may be {@code null}
     * @param policy whether a time window is mandatory
     * @return validated request
     * @throws ValidationException if the body is malformed or a required time window is missing
     */
    public LogQueryRequestDTO validate(JsonNode body, TimeWindowPolicy policy) {
        if (body == null || !body.isObject()) {
            throw ValidationException.malformedBody();
        }

        TimeWindowDTO timeWindow = parseTimeWindow(body);
        if (timeWindow.isUnbounded() && policy == TimeWindowPolicy.REQUIRED) {
            throw ValidationException.missingTimeWindow();
        }

        return new LogQueryRequestDTO(
                timeWindow,
                parseFilters(body.get("filters")),
                parseSort(body.get("sort")),
                parsePagination(body.get("pagination")),
                parseAggregateColumn(body.get("groupBy"), "groupBy").orElse(null),
                parseAggregateColumn(body.get("chartBreakdownBy"), "chartBreakdownBy").orElse(null));
    }

    /**
     * A non-blank {@code interval} wins over {@code dateRange} when both are present.
     */
    TimeWindowDTO parseTimeWindow(JsonNode body) {
        JsonNode interval = body.get("interval");
        if (interval != null && interval.isTextual() && !interval.asText().isBlank()) {
            return TimeWindowDTO.relative(interval.asText().trim());
        }

        JsonNode range = body.get("dateRange");
        if (range == null || !range.isObject()) {
            return TimeWindowDTO.unbounded();
        }
        JsonNode from = range.get("from");
        JsonNode to = range.get("to");
        if (from == null || to == null || !from.isTextual() || !to.isTextual()) {
            return TimeWindowDTO.unbounded();
        }

        Instant start = parseInstant("dateRange.from", from.asText());
        Instant end = parseInstant("dateRange.to", to.asText());
        if (start.isAfter(end)) {
            throw ValidationException.invalidParameter(
                    "dateRange.from", from.asText(), "timestamp before dateRange.to");
        }
        return TimeWindowDTO.between(start, end);
    }

    Map<LogColumn, String> parseFilters(JsonNode filters) {
        Map<LogColumn, String> accepted = new LinkedHashMap<>();
        if (filters == null || !filters.isObject()) {
            return accepted;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = filters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<LogColumn> column =
                    ColumnRegistry.lookup(field.getKey()).filter(LogColumn::filterable);
            if (column.isEmpty()) {
                LOG.debugf("Dropping filter on unknown column '%s'", field.getKey());
                continue;
            }
            JsonNode value = field.getValue();
            if (value == null || value.isNull() || !value.isValueNode()) {
                LOG.debugf("Dropping non-scalar filter value for column '%s'", field.getKey());
                continue;
            }
            accepted.put(column.get(), value.asText());
        }
        return accepted;
    }

    SortRequestDTO parseSort(JsonNode sort) {
        if (sort == null || !sort.isObject()) {
            return SortRequestDTO.defaultOrder();
        }
        JsonNode columnNode = sort.get("column");
        String columnName = columnNode != null && columnNode.isTextual() ? columnNode.asText() : null;
        Optional<LogColumn> column = ColumnRegistry.lookup(columnName).filter(LogColumn::sortable);
        if (column.isEmpty()) {
            if (columnName != null) {
                LOG.debugf("Unknown sort column '%s', using default order", columnName);
            }
            return SortRequestDTO.defaultOrder();
        }

        JsonNode directionNode = sort.get("direction");
        String direction =
                directionNode != null && directionNode.isTextual() ? directionNode.asText() : null;
        return new SortRequestDTO(column.get(), SortDirection.fromString(direction));
    }

    PageRequestDTO parsePagination(JsonNode pagination) {
        if (pagination == null || !pagination.isObject()) {
            return PageRequestDTO.defaults();
        }
        int page = parsePositiveInt(pagination.get("page")).orElse(PageRequestDTO.DEFAULT_PAGE);
        int pageSize =
                parsePositiveInt(pagination.get("pageSize"))
                        .orElse(PageRequestDTO.DEFAULT_PAGE_SIZE);
        return new PageRequestDTO(page, Math.min(pageSize, PageRequestDTO.MAX_PAGE_SIZE));
    }

    private Optional<LogColumn> parseAggregateColumn(JsonNode node, String field) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        Optional<LogColumn> column =
                ColumnRegistry.lookup(node.asText()).filter(LogColumn::groupable);
        if (column.isEmpty()) {
            LOG.debugf("Unknown %s column '%s', omitting aggregate", field, node.asText());
        }
        return column;
    }

    private static Optional<Integer> parsePositiveInt(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() && node.intValue() > 0
                    ? Optional.of(node.intValue())
                    : Optional.empty();
        }
        if (node.isTextual()) {
            try {
                int value = Integer.parseInt(node.asText().trim());
                return value > 0 ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Instant parseInstant(String field, String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidParameter(field, value, "ISO-8601 timestamp");
        }
    }
}
