package com.querywatch.service.core.filter;

import com.querywatch.service.core.catalog.ColumnRegistry;
import com.querywatch.service.core.catalog.QueryLogColumn;
import com.querywatch.service.core.error.ValidationException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw request parameters into a {@link LogFilter}: type coercion, limit clamping and column
 * validation. An unknown {@code sort_by} falls back to the default sort; an unknown entry in
 * {@code columns} rejects the request.
 */
@Slf4j
public final class LogFilterParser {

    public static final String DB_NAME = "db_name";
    public static final String QUERY_ID = "query_id";
    public static final String ONLY_FAILED = "only_failed";
    public static final String ONLY_SUCCESS = "only_success";
    public static final String MIN_DURATION_MS = "min_duration_ms";
    public static final String USER = "user";
    public static final String QUERY_CONTAINS = "query_contains";
    public static final String QUERY_KIND = "query_kind";
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";
    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String COLUMNS = "columns";
    public static final String SORT_BY = "sort_by";
    public static final String SORT_ORDER = "sort_order";

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "FALSE", "false", "False");

    private LogFilterParser() {}

    public static LogFilter parse(Map<String, String> params, LimitPolicy policy) {
        Map<String, String> p = params == null ? Map.of() : params;
        return LogFilter.builder(policy)
                .dbName(p.get(DB_NAME))
                .queryId(p.get(QUERY_ID))
                .onlyFailed(parseBoolean(ONLY_FAILED, p.get(ONLY_FAILED)))
                .onlySuccess(parseBoolean(ONLY_SUCCESS, p.get(ONLY_SUCCESS)))
                .minDurationMs(parseNonNegativeLong(MIN_DURATION_MS, p.get(MIN_DURATION_MS)))
                .user(p.get(USER))
                .queryContains(p.get(QUERY_CONTAINS))
                .queryKind(p.get(QUERY_KIND))
                .startTime(parseInstant(START_TIME, p.get(START_TIME)))
                .endTime(parseInstant(END_TIME, p.get(END_TIME)))
                .limit(parseLimit(p.get(LIMIT)))
                .offset(parseOffset(p.get(OFFSET)))
                .columns(isEmpty(p.get(COLUMNS)) ? null : ColumnRegistry.parseProjection(p.get(COLUMNS)))
                .sortBy(resolveSort(p.get(SORT_BY)))
                .sortDirection(SortDirection.fromParameter(p.get(SORT_ORDER)))
                .build();
    }

    static QueryLogColumn resolveSort(String sortBy) {
        if (isBlank(sortBy)) {
            return ColumnRegistry.DEFAULT_SORT;
        }
        Optional<QueryLogColumn> column = ColumnRegistry.find(sortBy.trim()).filter(QueryLogColumn::sortable);
        if (column.isEmpty()) {
            log.debug("Ignoring non-sortable sort_by, falling back to {}", ColumnRegistry.DEFAULT_SORT.columnName());
            return ColumnRegistry.DEFAULT_SORT;
        }
        return column.get();
    }

    static boolean parseBoolean(String name, String value) {
        if (isBlank(value)) {
            return false;
        }
        String v = value.trim();
        if (TRUE_VALUES.contains(v)) {
            return true;
        }
        if (FALSE_VALUES.contains(v)) {
            return false;
        }
        throw invalid(name + " must be a boolean");
    }

    static long parseNonNegativeLong(String name, String value) {
        if (isBlank(value)) {
            return 0L;
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw invalid(name + " must be a non-negative integer", e);
        }
        if (parsed < 0) {
            throw invalid(name + " must be a non-negative integer");
        }
        return parsed;
    }

    /** Any integral value is accepted; the policy clamps it, however large. */
    static Long parseLimit(String value) {
        if (isBlank(value)) {
            return null;
        }
        String v = value.trim();
        try {
            return Long.valueOf(v);
        } catch (NumberFormatException e) {
            if (v.matches("[+-]?\\d+")) {
                return v.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
            }
            throw invalid(LIMIT + " must be an integer", e);
        }
    }

    static long parseOffset(String value) {
        if (isBlank(value)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw invalid(OFFSET + " must be an integer", e);
        }
    }

    static Instant parseInstant(String name, String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw invalid(name + " must be an RFC3339 timestamp", e);
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(ValidationException.INVALID_PARAMETERS, message);
    }

    private static ValidationException invalid(String message, Throwable cause) {
        return new ValidationException(ValidationException.INVALID_PARAMETERS, message, cause);
    }
}
