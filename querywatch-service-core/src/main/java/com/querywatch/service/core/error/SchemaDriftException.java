package com.querywatch.service.core.error;

import com.querywatch.service.core.catalog.ColumnType;

/**
 * The store returned a value whose runtime shape disagrees with the registry's declared type for the
 * column. The registry is stale relative to the store; the value is never coerced.
 */
public class SchemaDriftException extends RuntimeException {

    private final String column;
    private final ColumnType expected;

    public SchemaDriftException(String column, ColumnType expected, Object observed) {
        super("Column '" + column + "' expected " + expected + " but store returned "
                + (observed == null ? "null" : observed.getClass().getName()));
        this.column = column;
        this.expected = expected;
    }

    public SchemaDriftException(String message) {
        super(message);
        this.column = null;
        this.expected = null;
    }

    public String column() {
        return column;
    }

    public ColumnType expected() {
        return expected;
    }
}
