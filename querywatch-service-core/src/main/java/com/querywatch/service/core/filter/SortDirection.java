package com.querywatch.service.core.filter;

public enum SortDirection {
    ASC,
    DESC;

    /** Only {@code asc} (any case) sorts ascending; anything else keeps the newest-first default. */
    public static SortDirection fromParameter(String value) {
        return value != null && "asc".equalsIgnoreCase(value.trim()) ? ASC : DESC;
    }

    public String sql() {
        return name();
    }
}
