package com.querywatch.service.core.catalog;

import com.querywatch.service.core.error.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of retrievable query-log columns. Every component that accepts a caller-supplied column
 * name resolves it here before the name reaches a query string.
 */
public final class ColumnRegistry {

    /** Sort column used when the caller asks for none, or for one that is not sortable. */
    public static final QueryLogColumn DEFAULT_SORT = QueryLogColumn.EVENT_TIME;

    private static final List<QueryLogColumn> ALL = List.of(QueryLogColumn.values());
    private static final List<String> ALL_NAMES =
            ALL.stream().map(QueryLogColumn::columnName).toList();
    private static final Map<String, QueryLogColumn> BY_NAME = index();

    private ColumnRegistry() {}

    public static List<QueryLogColumn> allColumns() {
        return ALL;
    }

    public static List<String> allColumnNames() {
        return ALL_NAMES;
    }

    public static boolean isColumn(String name) {
        return name != null && BY_NAME.containsKey(name);
    }

    public static boolean isSortable(String name) {
        return find(name).map(QueryLogColumn::sortable).orElse(false);
    }

    public static Optional<QueryLogColumn> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
    }

    /** Resolves a name or fails with {@code invalid_columns}. */
    public static QueryLogColumn require(String name) {
        return find(name)
                .orElseThrow(() -> new ValidationException(ValidationException.INVALID_COLUMNS, "invalid column: " + name));
    }

    /**
     * Resolves a projection. The whole request is rejected on the first unknown name; nothing is
     * dropped silently.
     */
    public static List<QueryLogColumn> resolveProjection(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ValidationException(
                    ValidationException.INVALID_COLUMNS, "at least one valid column is required");
        }
        List<QueryLogColumn> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(require(name));
        }
        return List.copyOf(resolved);
    }

    /** Parses a comma-separated column list; entries are trimmed and blank entries skipped. */
    public static List<QueryLogColumn> parseProjection(String csv) {
        if (csv == null) {
            return resolveProjection(List.of());
        }
        List<String> names = Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return resolveProjection(names);
    }

    private static Map<String, QueryLogColumn> index() {
        Map<String, QueryLogColumn> byName = new LinkedHashMap<>();
        for (QueryLogColumn column : QueryLogColumn.values()) {
            byName.put(column.columnName(), column);
        }
        return Map.copyOf(byName);
    }
}
