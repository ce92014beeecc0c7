package com.querywatch.service.core.service;

import java.util.List;
import java.util.Map;

/**
 * Rows restricted to a projection. {@code columns} is the presentation order; the row maps are keyed
 * by column name.
 */
public record ProjectedLogPage(List<Map<String, Object>> rows, List<String> columns, int count) {
    public ProjectedLogPage {
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
    }
}
