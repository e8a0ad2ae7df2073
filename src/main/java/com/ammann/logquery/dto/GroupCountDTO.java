/* (C)2026 */
package com.ammann.logquery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the group aggregate.
 *
 * @param key grouped column value, {@code null} for rows where the column is null
 * @param count number of matching rows with that value
 */
public record GroupCountDTO(
        @JsonProperty("key") Object key,
        @JsonProperty("count") long count) {}
