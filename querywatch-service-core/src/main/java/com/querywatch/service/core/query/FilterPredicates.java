package com.querywatch.service.core.query;

import com.querywatch.service.core.filter.LogFilter;
import com.querywatch.service.core.model.QueryPhase;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * WHERE-clause conditions shared by the listing and aggregation builders. Conditions are appended
 * in a fixed order and every caller-supplied value becomes a bound argument.
 */
final class FilterPredicates {

    static final String NOT_STARTED = "type != '" + QueryPhase.QUERY_START.wireValue() + "'";
    static final String FAILED = "(exception_code != 0 OR type = '" + QueryPhase.EXCEPTION_BEFORE_START.wireValue() + "')";
    static final String SUCCEEDED = "(type = '" + QueryPhase.QUERY_FINISH.wireValue() + "' AND exception_code = 0)";

    private FilterPredicates() {}

    static void append(LogFilter filter, StringBuilder sql, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        // start events carry no completed metrics
        conditions.add(NOT_STARTED);

        if (filter.dbName() != null) {
            conditions.add("has(databases, ?)");
            args.add(filter.dbName());
        }
        if (filter.queryId() != null) {
            conditions.add("query_id = ?");
            args.add(filter.queryId());
        }
        if (filter.onlyFailed()) {
            conditions.add(FAILED);
        }
        if (filter.onlySuccess()) {
            conditions.add(SUCCEEDED);
        }
        if (filter.minDurationMs() > 0) {
            conditions.add("query_duration_ms > ?");
            args.add(filter.minDurationMs());
        }
        if (filter.user() != null) {
            conditions.add("user = ?");
            args.add(filter.user());
        }
        if (filter.queryContains() != null) {
            conditions.add("positionCaseInsensitive(query, ?) > 0");
            args.add(filter.queryContains());
        }
        if (filter.queryKind() != null) {
            conditions.add("query_kind = ?");
            args.add(filter.queryKind());
        }
        if (filter.startTime() != null) {
            conditions.add("event_time >= ?");
            args.add(Timestamp.from(filter.startTime()));
        }
        if (filter.endTime() != null) {
            conditions.add("event_time <= ?");
            args.add(Timestamp.from(filter.endTime()));
        }

        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
    }

    /** Accepts {@code table} or {@code database.table} made of identifier characters only. */
    static String requireTableName(String table) {
        if (table == null || !table.matches("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?")) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        return table;
    }
}
