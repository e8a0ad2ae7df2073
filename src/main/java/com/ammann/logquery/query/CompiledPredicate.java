/* (C)2026 */
package com.ammann.logquery.query;

import java.util.List;

/**
 * Ordered predicate fragments and the parameter vector bound to them.
 *
 * <p>One instance is shared by every query variant of a request, so the rows, count, group
 * and breakdown statements always filter on identical conditions with identical values.
 *
 * @param fragments boolean SQL fragments, joined with AND
 * @param parameters bound values, in placeholder order across all fragments
 */
public record CompiledPredicate(List<String> fragments, List<Object> parameters) {

    public CompiledPredicate {
        fragments = List.copyOf(fragments);
        parameters = List.copyOf(parameters);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * @return {@code " WHERE a AND b"}, or an empty string when there are no fragments
     */
    public String whereClause() {
        if (fragments.isEmpty()) {
            return "";
        }
        return " WHERE " + String.join(" AND ", fragments);
    }
}
