/* (C)2026 */
package com.ammann.logquery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One hourly bucket of the breakdown chart.
 *
 * @param bucketTimestamp bucket start, ISO-8601 in UTC
 * @param count rows in the bucket
 * @param breakdown category to row count, largest first
 */
public record ChartBucketDTO(
        @JsonProperty("bucketTimestamp") String bucketTimestamp,
        @JsonProperty("count") long count,
        @JsonProperty("breakdown") Map<String, Long> breakdown) {}
