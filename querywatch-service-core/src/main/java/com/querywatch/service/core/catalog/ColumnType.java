package com.querywatch.service.core.catalog;

/**
 * Scalar kind of a query-log column. Decoding of raw store values is a total match over these tags.
 */
public enum ColumnType {
    STRING,
    TIMESTAMP,
    UNSIGNED_INTEGER,
    SIGNED_INTEGER,
    FLAG,
    STRING_ARRAY
}
