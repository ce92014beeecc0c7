package com.querywatch.service.core.filter;

import com.querywatch.service.core.catalog.ColumnRegistry;
import com.querywatch.service.core.catalog.QueryLogColumn;
import java.time.Instant;
import java.util.List;

/**
 * Normalized query constraints. Every constraint is optional: {@code null}, {@code false} and
 * {@code 0} mean "not constrained". {@code limit} is already clamped for the retrieval path and the
 * sort column is always a sortable registry column.
 */
public record LogFilter(
        String dbName,
        String queryId,
        boolean onlyFailed,
        boolean onlySuccess,
        long minDurationMs,
        String user,
        String queryContains,
        String queryKind,
        Instant startTime,
        Instant endTime,
        int limit,
        long offset,
        List<QueryLogColumn> columns,
        QueryLogColumn sortBy,
        SortDirection sortDirection) {

    public LogFilter {
        dbName = blankToNull(dbName);
        queryId = blankToNull(queryId);
        user = blankToNull(user);
        queryContains = blankToNull(queryContains);
        queryKind = blankToNull(queryKind);
        if (minDurationMs < 0) {
            throw new IllegalArgumentException("minDurationMs must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be clamped before constructing a filter");
        }
        offset = Math.max(0L, offset);
        columns = (columns == null || columns.isEmpty()) ? null : List.copyOf(columns);
        sortBy = (sortBy == null || !sortBy.sortable()) ? ColumnRegistry.DEFAULT_SORT : sortBy;
        sortDirection = sortDirection == null ? SortDirection.DESC : sortDirection;
    }

    public boolean hasProjection() {
        return columns != null;
    }

    public List<String> columnNames() {
        return columns == null
                ? List.of()
                : columns.stream().map(QueryLogColumn::columnName).toList();
    }

    public static Builder builder(LimitPolicy policy) {
        return new Builder(policy);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    public static final class Builder {
        private final LimitPolicy policy;
        private String dbName;
        private String queryId;
        private boolean onlyFailed;
        private boolean onlySuccess;
        private long minDurationMs;
        private String user;
        private String queryContains;
        private String queryKind;
        private Instant startTime;
        private Instant endTime;
        private Long limit;
        private long offset;
        private List<QueryLogColumn> columns;
        private QueryLogColumn sortBy;
        private SortDirection sortDirection;

        private Builder(LimitPolicy policy) {
            this.policy = policy;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder queryId(String queryId) {
            this.queryId = queryId;
            return this;
        }

        public Builder onlyFailed(boolean onlyFailed) {
            this.onlyFailed = onlyFailed;
            return this;
        }

        public Builder onlySuccess(boolean onlySuccess) {
            this.onlySuccess = onlySuccess;
            return this;
        }

        public Builder minDurationMs(long minDurationMs) {
            this.minDurationMs = minDurationMs;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder queryContains(String queryContains) {
            this.queryContains = queryContains;
            return this;
        }

        public Builder queryKind(String queryKind) {
            this.queryKind = queryKind;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder limit(Long limit) {
            this.limit = limit;
            return this;
        }

        public Builder limit(long limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        public Builder columns(List<QueryLogColumn> columns) {
            this.columns = columns;
            return this;
        }

        public Builder sortBy(QueryLogColumn sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder sortDirection(SortDirection sortDirection) {
            this.sortDirection = sortDirection;
            return this;
        }

        public LogFilter build() {
            return new LogFilter(
                    dbName,
                    queryId,
                    onlyFailed,
                    onlySuccess,
                    minDurationMs,
                    user,
                    queryContains,
                    queryKind,
                    startTime,
                    endTime,
                    policy.clamp(limit),
                    offset,
                    columns,
                    sortBy,
                    sortDirection);
        }
    }
}
