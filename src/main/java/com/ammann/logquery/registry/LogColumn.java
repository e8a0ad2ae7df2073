/* (C)2026 */
package com.ammann.logquery.registry;

/**
 * Closed set of columns the query compiler may place into SQL text.
 *
 * <p>Declaration order is the canonical projection order of the row query.
 */
public enum LogColumn {
    LOG_DATE_TIME("log_date_time", LogTable.LOG_INFO, ColumnType.TIMESTAMP, false, true, false),
    HOST_NAME("host_name", LogTable.START_LOG_INFO, ColumnType.TEXT, true, true, true),
    REPOSITORY_PATH("repository_path", LogTable.START_LOG_INFO, ColumnType.TEXT, true, true, true),
    PORT_NUMBER("port_number", LogTable.START_LOG_INFO, ColumnType.INTEGER, true, true, true),
    VERSION_NUMBER("version_number", LogTable.START_LOG_INFO, ColumnType.TEXT, true, true, true),
    AS_SERVER_MODE("as_server_mode", LogTable.START_LOG_INFO, ColumnType.TEXT, true, true, true),
    AS_START_DATE_TIME("as_start_date_time", LogTable.START_LOG_INFO, ColumnType.TIMESTAMP, false, true, false),
    AS_SERVER_CONFIG("as_server_config", LogTable.START_LOG_INFO, ColumnType.TEXT, true, false, false),
    USER_ID("user_id", LogTable.LOG_INFO, ColumnType.TEXT, true, true, true),
    REPORT_ID_NAME("report_id_name", LogTable.LOG_INFO, ColumnType.TEXT, true, true, true),
    ERROR_NUMBER("error_number", LogTable.LOG_INFO, ColumnType.INTEGER, true, true, true),
    XQL_QUERY_ID("xql_query_id", LogTable.LOG_INFO, ColumnType.TEXT, true, true, true),
    LOG_MESSAGE("log_message", LogTable.LOG_INFO, ColumnType.TEXT, true, true, false),
    AS_INSTANCE_ID("as_instance_id", LogTable.LOG_INFO, ColumnType.TEXT, true, true, true);

    private final String columnName;
    private final LogTable table;
    private final ColumnType type;
    private final boolean filterable;
    private final boolean sortable;
    private final boolean groupable;

    LogColumn(
            String columnName,
            LogTable table,
            ColumnType type,
            boolean filterable,
            boolean sortable,
            boolean groupable) {
        this.columnName = columnName;
        this.table = table;
        this.type = type;
        this.filterable = filterable;
        this.sortable = sortable;
        this.groupable = groupable;
    }

    public String columnName() {
        return columnName;
    }

    public LogTable table() {
        return table;
    }

    public ColumnType type() {
        return type;
    }

    public boolean filterable() {
        return filterable;
    }

    public boolean sortable() {
        return sortable;
    }

    public boolean groupable() {
        return groupable;
    }

    /**
     * @return {@code alias.column}, e.g. {@code asli.host_name}
     */
    public String qualifiedName() {
        return table.alias() + "." + columnName;
    }
}
