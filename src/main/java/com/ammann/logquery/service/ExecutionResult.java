/* (C)2026 */
package com.ammann.logquery.service;

import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.store.StoreResult;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Results of one concurrently executed batch.
 *
 * @param results result per executed variant
 * @param elapsedMs wall-clock time of the whole batch
 */
public record ExecutionResult(Map<StatementKind, StoreResult> results, long elapsedMs) {

    public ExecutionResult {
        results = results.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(results));
    }

    /**
     * @param kind variant
     * @return its result, or an empty result for a variant that was not executed
     */
    public StoreResult result(StatementKind kind) {
        return results.getOrDefault(kind, StoreResult.empty());
    }
}
