/* (C)2026 */
package com.ammann.logquery.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds rows shaped like the store's output for the joined log tables. */
public final class LogRows {

    private LogRows() {}

    public static Map<String, Object> logRow(String instanceId, Instant logDateTime, String userId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("log_date_time", logDateTime);
        row.put("host_name", "app-01");
        row.put("port_number", 8080);
        row.put("user_id", userId);
        row.put("error_number", 0);
        row.put("log_message", "ok");
        row.put("as_instance_id", instanceId);
        return row;
    }

    public static List<Map<String, Object>> logRows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>(count);
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < count; i++) {
            rows.add(logRow("inst-" + i, base.plusSeconds(i), "user-" + (i % 3)));
        }
        return rows;
    }

    public static Map<String, Object> countRow(long total) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("total_count", total);
        return row;
    }

    public static Map<String, Object> groupRow(Object key, long count) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("group_key", key);
        row.put("group_count", count);
        return row;
    }

    public static Map<String, Object> bucketRow(String bucket, long total, String breakdownJson) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("bucket_timestamp", bucket);
        row.put("total_count", total);
        row.put("breakdown", breakdownJson);
        return row;
    }
}
