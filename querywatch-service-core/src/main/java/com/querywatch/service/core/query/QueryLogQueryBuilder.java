package com.querywatch.service.core.query;

import com.querywatch.service.core.catalog.ColumnRegistry;
import com.querywatch.service.core.catalog.QueryLogColumn;
import com.querywatch.service.core.filter.LogFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the row-listing query: projection, filter predicates, ORDER BY, LIMIT and (when positive)
 * OFFSET. Column names come from {@link QueryLogColumn} only.
 */
public final class QueryLogQueryBuilder {

    private final String table;

    public QueryLogQueryBuilder(String table) {
        this.table = FilterPredicates.requireTableName(table);
    }

    /** Projects the filter's columns, or every registry column when it has none. */
    public BuiltQuery build(LogFilter filter) {
        return build(filter, filter.hasProjection() ? filter.columns() : ColumnRegistry.allColumns());
    }

    public BuiltQuery build(LogFilter filter, List<QueryLogColumn> projection) {
        if (projection == null || projection.isEmpty()) {
            throw new IllegalArgumentException("projection must contain at least one column");
        }
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(512);
        sql.append("SELECT ")
                .append(projection.stream().map(QueryLogColumn::columnName).collect(Collectors.joining(", ")))
                .append(" FROM ")
                .append(table);

        FilterPredicates.append(filter, sql, args);

        sql.append(" ORDER BY ")
                .append(filter.sortBy().columnName())
                .append(' ')
                .append(filter.sortDirection().sql());

        sql.append(" LIMIT ?");
        args.add(filter.limit());
        if (filter.offset() > 0) {
            sql.append(" OFFSET ?");
            args.add(filter.offset());
        }
        return new BuiltQuery(sql.toString(), args);
    }

    /**
     * Newest entry with exactly this id, whatever its phase: a query that is still running only has
     * its start event.
     */
    public BuiltQuery byId(String queryId) {
        String columns = ColumnRegistry.allColumns().stream()
                .map(QueryLogColumn::columnName)
                .collect(Collectors.joining(", "));
        return new BuiltQuery(
                "SELECT " + columns + " FROM " + table + " WHERE query_id = ? ORDER BY "
                        + QueryLogColumn.EVENT_TIME.columnName() + " DESC LIMIT 1",
                List.of(queryId));
    }

    /** Lists database names, sorted by name. */
    public static BuiltQuery databaseNames(String databasesTable) {
        return new BuiltQuery(
                "SELECT name FROM " + FilterPredicates.requireTableName(databasesTable) + " ORDER BY name", List.of());
    }
}
