/* (C)2026 */
package com.ammann.logquery.registry;

import com.ammann.logquery.exception.UnknownColumnException;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static whitelist of queryable, sortable and groupable log columns (Security Boundary).
 *
 * <p>Column names cannot be bound as statement parameters, so every identifier that reaches
 * SQL text is drawn from this registry. Table qualification is derived from which table owns
 * the column, never from caller input. Lookups are exact and case-sensitive.
 */
public final class ColumnRegistry {

    private static final Map<String, LogColumn> BY_NAME;

    static {
        Map<String, LogColumn> byName = new LinkedHashMap<>();
        for (LogColumn column : LogColumn.values()) {
            byName.put(column.columnName(), column);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private static final String PROJECTION =
            Arrays.stream(LogColumn.values())
                    .map(LogColumn::qualifiedName)
                    .collect(Collectors.joining(", "));

    /** Column joining the two tables; owned by the primary table. */
    public static final LogColumn JOIN_KEY = LogColumn.AS_INSTANCE_ID;

    /** Primary timestamp, used for the time window, default order and hourly buckets. */
    public static final LogColumn TIMESTAMP = LogColumn.LOG_DATE_TIME;

    private ColumnRegistry() {}

    /**
     * Resolve a caller-supplied name against the registry.
     *
     * @param name column name as sent by the caller, may be {@code null}
     * @return the registered column, or empty if the name is unknown
     */
    public static Optional<LogColumn> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isFilterable(String name) {
        return lookup(name).map(LogColumn::filterable).orElse(false);
    }

    public static boolean isSortable(String name) {
        return lookup(name).map(LogColumn::sortable).orElse(false);
    }

    public static boolean isGroupable(String name) {
        return lookup(name).map(LogColumn::groupable).orElse(false);
    }

    /**
     * Table-qualified name of a registered column.
     *
     * @param name column name
     * @return qualified name such as {@code ali.user_id}
     * @throws UnknownColumnException if the name is not registered
     */
    public static String qualify(String name) {
        return lookup(name)
                .map(LogColumn::qualifiedName)
                .orElseThrow(() -> new UnknownColumnException(name));
    }

    /**
     * @return the canonical, comma separated, table-qualified projection of the row query
     */
    public static String projection() {
        return PROJECTION;
    }

    /**
     * @param table owning table
     * @return the names of all columns owned by {@code table}
     */
    public static Set<String> columnsOf(LogTable table) {
        return EnumSet.allOf(LogColumn.class).stream()
                .filter(c -> c.table() == table)
                .map(LogColumn::columnName)
                .collect(Collectors.toUnmodifiableSet());
    }
}
