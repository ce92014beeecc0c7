package com.querywatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * One query-log entry in its full fixed shape. Read-only: the store emits it, this service only
 * filters and reshapes it.
 */
public record LogRecord(
        @JsonProperty("query_id") String queryId,
        @JsonProperty("query") String query,
        @JsonProperty("event_time") Instant eventTime,
        @JsonProperty("event_date") Instant eventDate,
        @JsonProperty("type") String type,
        @JsonProperty("query_duration_ms") long queryDurationMs,
        @JsonProperty("memory_usage") long memoryUsage,
        @JsonProperty("read_rows") long readRows,
        @JsonProperty("read_bytes") long readBytes,
        @JsonProperty("written_rows") long writtenRows,
        @JsonProperty("written_bytes") long writtenBytes,
        @JsonProperty("result_rows") long resultRows,
        @JsonProperty("result_bytes") long resultBytes,
        @JsonProperty("databases") List<String> databases,
        @JsonProperty("tables") List<String> tables,
        @JsonProperty("exception_code") long exceptionCode,
        @JsonProperty("exception") String exception,
        @JsonProperty("user") String user,
        @JsonProperty("client_hostname") String clientHostname,
        @JsonProperty("http_user_agent") String httpUserAgent,
        @JsonProperty("initial_user") String initialUser,
        @JsonProperty("initial_query_id") String initialQueryId,
        @JsonProperty("is_initial_query") int isInitialQuery) {

    public LogRecord {
        databases = databases == null ? List.of() : List.copyOf(databases);
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    @JsonIgnore
    public boolean isFailed() {
        return QueryPhase.isFailed(type, exceptionCode);
    }
}
