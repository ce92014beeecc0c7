package com.querywatch.service.core.error;

public class QueryLogNotFoundException extends RuntimeException {

    private final String queryId;

    public QueryLogNotFoundException(String queryId) {
        super("Query log not found");
        this.queryId = queryId;
    }

    public String queryId() {
        return queryId;
    }
}
