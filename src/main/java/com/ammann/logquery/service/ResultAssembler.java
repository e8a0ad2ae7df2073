/* (C)2026 */
package com.ammann.logquery.service;

import com.ammann.logquery.dto.ChartBucketDTO;
import com.ammann.logquery.dto.GroupCountDTO;
import com.ammann.logquery.dto.QueryResultDTO;
import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.exception.QueryExecutionException;
import com.ammann.logquery.registry.ColumnRegistry;
import com.ammann.logquery.store.StoreResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the per-variant store results into one {@link QueryResultDTO}.
 *
 * <p>Rows pass through with the database column set. Log lines have no natural primary key, so
 * each row gets a display-only {@code id} of {@code <as_instance_id>_<log_date_time>}.
 *
 * <p>Breakdown rows without a category are reported under {@link #NULL_CATEGORY}; a stored value
 * equal to that label is counted into the same entry, so a bucket's breakdown always sums to its
 * count.
 */
@ApplicationScoped
public class ResultAssembler {

    public static final String DISPLAY_KEY = "id";

    public static final String NULL_CATEGORY = "(none)";

    private final ObjectMapper objectMapper;

    @Inject
    public ResultAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public QueryResultDTO assemble(ExecutionResult execution) {
        return new QueryResultDTO(
                rows(execution.result(StatementKind.ROWS)),
                totalCount(execution.result(StatementKind.COUNT)),
                groupData(execution.result(StatementKind.GROUP)),
                chartData(execution.result(StatementKind.BREAKDOWN)));
    }

    /**
     * @param result row statement result
     * @return rows with their display key
     */
    public List<Map<String, Object>> rows(StoreResult result) {
        List<Map<String, Object>> rows = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            rows.add(withDisplayKey(row));
        }
        return rows;
    }

    long totalCount(StoreResult result) {
        if (result.rows().isEmpty()) {
            return 0L;
        }
        return decodeCount(result.rows().get(0).get("total_count"));
    }

    List<GroupCountDTO> groupData(StoreResult result) {
        List<GroupCountDTO> groups = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            groups.add(new GroupCountDTO(row.get("group_key"), decodeCount(row.get("group_count"))));
        }
        return groups;
    }

    List<ChartBucketDTO> chartData(StoreResult result) {
        List<ChartBucketDTO> buckets = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            buckets.add(new ChartBucketDTO(
                    String.valueOf(row.get("bucket_timestamp")),
                    decodeCount(row.get("total_count")),
                    decodeBreakdown(row.get("breakdown"))));
        }
        return buckets;
    }

    /**
     * Counts arrive as integers, {@code numeric}, or text depending on the aggregate and driver.
     */
    static long decodeCount(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new QueryExecutionException("Unexpected count value: " + value, e);
        }
    }

    private Map<String, Long> decodeBreakdown(Object value) {
        if (value == null) {
            return Map.of();
        }
        JsonNode pairs;
        try {
            pairs = objectMapper.readTree(value.toString());
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Unexpected breakdown value: " + value, e);
        }
        if (!pairs.isArray()) {
            throw new QueryExecutionException("Unexpected breakdown value: " + value);
        }

        Map<String, Long> counts = new LinkedHashMap<>();
        for (JsonNode pair : pairs) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new QueryExecutionException("Unexpected breakdown entry: " + pair);
            }
            JsonNode category = pair.get(0);
            String key = category.isNull() ? NULL_CATEGORY : category.asText();
            counts.merge(key, decodeCount(pair.get(1).asText()), Long::sum);
        }

        Map<String, Long> ordered = new LinkedHashMap<>(counts.size() * 2);
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
        return ordered;
    }

    private static Map<String, Object> withDisplayKey(Map<String, Object> row) {
        if (row.containsKey(DISPLAY_KEY)) {
            return row;
        }
        Object instance = row.get(ColumnRegistry.JOIN_KEY.columnName());
        Object timestamp = row.get(ColumnRegistry.TIMESTAMP.columnName());
        if (instance == null || timestamp == null) {
            return row;
        }

        Map<String, Object> keyed = new LinkedHashMap<>(row.size() * 2);
        keyed.put(DISPLAY_KEY, instance + "_" + timestamp);
        keyed.putAll(row);
        return keyed;
    }
}
