package com.querywatch.service.core.error;

/** Read operations issued against the log store, with the message shown to callers on failure. */
public enum StoreOperation {
    LIST_LOGS("Failed to retrieve query logs"),
    EXPORT_LOGS("Failed to retrieve query logs for export"),
    AGGREGATE_METRICS("Failed to retrieve aggregated metrics"),
    LIST_DATABASES("Failed to retrieve databases"),
    GET_BY_ID("Failed to retrieve query log"),
    PING("Database ping failed");

    private final String publicMessage;

    StoreOperation(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
