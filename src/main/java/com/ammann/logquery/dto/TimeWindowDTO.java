/* (C)2026 */
package com.ammann.logquery.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Validated time window of a log query.
 *
 * <p>Exactly one form is set: a relative interval (e.g. {@code "24 hours"}), an explicit
 * {@code from}/{@code to} range, or neither for an unbounded query.
 *
 * @param interval relative interval, interpreted by the database as "now minus interval"
 * @param from inclusive range start
 * @param to inclusive range end
 */
@Schema(description = "Time window applied to the primary log timestamp")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeWindowDTO(
        @Schema(description = "Relative interval such as '24 hours'") String interval,
        @Schema(description = "Range start (ISO-8601)") Instant from,
        @Schema(description = "Range end (ISO-8601)") Instant to) {

    private static final TimeWindowDTO UNBOUNDED = new TimeWindowDTO(null, null, null);

    public static TimeWindowDTO relative(String interval) {
        return new TimeWindowDTO(interval, null, null);
    }

    public static TimeWindowDTO between(Instant from, Instant to) {
        return new TimeWindowDTO(null, from, to);
    }

    public static TimeWindowDTO unbounded() {
        return UNBOUNDED;
    }

    public boolean isRelative() {
        return interval != null;
    }

    public boolean isRange() {
        return interval == null && from != null && to != null;
    }

    public boolean isUnbounded() {
        return !isRelative() && !isRange();
    }
}
