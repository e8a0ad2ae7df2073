/* (C)2026 */
package com.ammann.logquery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "API error response")
/**
 * Error payload returned for 400 and 500 responses.
 *
 * @param error human-readable reason
 */
public record ErrorResponseDTO(
        @Schema(description = "Error message describing what went wrong")
        @JsonProperty("error") String error) {}
