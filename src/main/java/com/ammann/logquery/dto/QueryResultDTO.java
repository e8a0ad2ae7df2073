/* (C)2026 */
package com.ammann.logquery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Composite response of a faceted log query.
 *
 * @param rows the requested page of joined log rows
 * @param totalCount number of rows matching the predicate across all pages
 * @param groupData frequency aggregate, empty when no valid {@code groupBy} was requested
 * @param chartData hourly breakdown, empty when no valid {@code chartBreakdownBy} was requested
 */
public record QueryResultDTO(
        @JsonProperty("rows") List<Map<String, Object>> rows,
        @JsonProperty("totalCount") long totalCount,
        @JsonProperty("groupData") List<GroupCountDTO> groupData,
        @JsonProperty("chartData") List<ChartBucketDTO> chartData) {}
