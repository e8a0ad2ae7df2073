/* (C)2026 */
package com.ammann.logquery.registry;

/**
 * The two tables joined by every log query, with the alias used in SQL text.
 */
public enum LogTable {

    /** Per-request log lines. */
    LOG_INFO("as_log_info", "ali"),

    /** Server start records, one per application server instance. */
    START_LOG_INFO("as_start_log_info", "asli");

    private final String tableName;
    private final String alias;

    LogTable(String tableName, String alias) {
        this.tableName = tableName;
        this.alias = alias;
    }

    public String tableName() {
        return tableName;
    }

    public String alias() {
        return alias;
    }

    /**
     * @return {@code table alias} as it appears in a FROM clause
     */
    public String fromItem() {
        return tableName + " " + alias;
    }
}
