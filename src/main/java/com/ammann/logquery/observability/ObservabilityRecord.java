/* (C)2026 */
package com.ammann.logquery.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable structured log entry.
 *
 * @param event record kind
 * @param time creation time
 * @param endpoint request path
 * @param remoteAddress caller address
 * @param fields phase-specific fields, in insertion order
 */
public record ObservabilityRecord(
        ObservabilityEvent event,
        Instant time,
        String endpoint,
        String remoteAddress,
        Map<String, Object> fields) {

    public ObservabilityRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Flatten into the line layout of the log file.
     *
     * @return {@code event, time, endpoint, remote_addr} followed by the phase fields
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("event", event.label());
        map.put("time", time.toString());
        map.put("endpoint", endpoint);
        map.put("remote_addr", remoteAddress);
        map.putAll(fields);
        return map;
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
