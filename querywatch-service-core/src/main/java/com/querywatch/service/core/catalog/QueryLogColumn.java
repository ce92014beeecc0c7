package com.querywatch.service.core.catalog;

/**
 * Retrievable columns of the query log, in presentation order.
 */
public enum QueryLogColumn {
    QUERY_ID("query_id", ColumnType.STRING, false),
    QUERY("query", ColumnType.STRING, false),
    EVENT_TIME("event_time", ColumnType.TIMESTAMP, true),
    EVENT_DATE("event_date", ColumnType.TIMESTAMP, true),
    TYPE("type", ColumnType.STRING, true),
    QUERY_DURATION_MS("query_duration_ms", ColumnType.UNSIGNED_INTEGER, true),
    MEMORY_USAGE("memory_usage", ColumnType.SIGNED_INTEGER, true),
    READ_ROWS("read_rows", ColumnType.UNSIGNED_INTEGER, true),
    READ_BYTES("read_bytes", ColumnType.UNSIGNED_INTEGER, true),
    WRITTEN_ROWS("written_rows", ColumnType.UNSIGNED_INTEGER, true),
    WRITTEN_BYTES("written_bytes", ColumnType.UNSIGNED_INTEGER, true),
    RESULT_ROWS("result_rows", ColumnType.UNSIGNED_INTEGER, true),
    RESULT_BYTES("result_bytes", ColumnType.UNSIGNED_INTEGER, true),
    DATABASES("databases", ColumnType.STRING_ARRAY, false),
    TABLES("tables", ColumnType.STRING_ARRAY, false),
    EXCEPTION_CODE("exception_code", ColumnType.SIGNED_INTEGER, true),
    EXCEPTION("exception", ColumnType.STRING, false),
    USER("user", ColumnType.STRING, true),
    CLIENT_HOSTNAME("client_hostname", ColumnType.STRING, true),
    HTTP_USER_AGENT("http_user_agent", ColumnType.STRING, false),
    INITIAL_USER("initial_user", ColumnType.STRING, true),
    INITIAL_QUERY_ID("initial_query_id", ColumnType.STRING, false),
    IS_INITIAL_QUERY("is_initial_query", ColumnType.FLAG, true);

    private final String columnName;
    private final ColumnType type;
    private final boolean sortable;

    QueryLogColumn(String columnName, ColumnType type, boolean sortable) {
        this.columnName = columnName;
        this.type = type;
        this.sortable = sortable;
    }

    /** Column name as stored and as exposed on the wire. */
    public String columnName() {
        return columnName;
    }

    public ColumnType type() {
        return type;
    }

    public boolean sortable() {
        return sortable;
    }
}
