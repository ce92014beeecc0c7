package com.querywatch.service.core.materialize;

import com.querywatch.service.core.catalog.ColumnRegistry;
import com.querywatch.service.core.catalog.ColumnType;
import com.querywatch.service.core.catalog.QueryLogColumn;
import com.querywatch.service.core.error.SchemaDriftException;
import com.querywatch.service.core.model.LogRecord;
import com.querywatch.service.core.model.MetricBucket;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps positional store rows to {@link LogRecord}s, projected column maps, or {@link MetricBucket}s.
 *
 * <p>Each value is decoded by the {@link ColumnType} the registry declares for its column. Local
 * date-times from the driver are read as UTC. A value of the wrong shape fails the request with
 * {@link SchemaDriftException}; nothing is coerced across kinds.
 */
public final class RowMaterializer {

    private static final List<QueryLogColumn> FULL = ColumnRegistry.allColumns();
    private static final int METRIC_COLUMNS = 9;

    private RowMaterializer() {}

    /** Decodes a row laid out in registry order into the fixed record shape. */
    public static LogRecord toRecord(Object[] raw) {
        Object[] v = decodeAll(FULL, raw);
        return new LogRecord(
                (String) v[0],
                (String) v[1],
                (Instant) v[2],
                (Instant) v[3],
                (String) v[4],
                (Long) v[5],
                (Long) v[6],
                (Long) v[7],
                (Long) v[8],
                (Long) v[9],
                (Long) v[10],
                (Long) v[11],
                (Long) v[12],
                strings(v[13]),
                strings(v[14]),
                (Long) v[15],
                (String) v[16],
                (String) v[17],
                (String) v[18],
                (String) v[19],
                (String) v[20],
                (String) v[21],
                (Integer) v[22]);
    }

    /** Decodes a row laid out in projection order into a column-name keyed map. */
    public static Map<String, Object> toProjectedRow(List<QueryLogColumn> projection, Object[] raw) {
        Object[] decoded = decodeAll(projection, raw);
        Map<String, Object> row = new LinkedHashMap<>(projection.size() * 2);
        for (int i = 0; i < projection.size(); i++) {
            row.put(projection.get(i).columnName(), decoded[i]);
        }
        return row;
    }

    public static MetricBucket toMetricBucket(Object[] raw) {
        if (raw == null || raw.length != METRIC_COLUMNS) {
            throw new SchemaDriftException("Metrics row has " + (raw == null ? 0 : raw.length)
                    + " values, expected " + METRIC_COLUMNS);
        }
        return new MetricBucket(
                decodeTimestamp("time_bucket", raw[0]),
                decodeInteger("total_queries", ColumnType.UNSIGNED_INTEGER, raw[1]),
                decodeDouble("avg_duration_ms", raw[2]),
                decodeInteger("max_duration_ms", ColumnType.UNSIGNED_INTEGER, raw[3]),
                decodeDouble("avg_memory_usage", raw[4]),
                decodeInteger("max_memory_usage", ColumnType.SIGNED_INTEGER, raw[5]),
                decodeInteger("total_read_bytes", ColumnType.UNSIGNED_INTEGER, raw[6]),
                decodeInteger("total_written_bytes", ColumnType.UNSIGNED_INTEGER, raw[7]),
                decodeInteger("failed_queries", ColumnType.UNSIGNED_INTEGER, raw[8]));
    }

    /** Decodes a single-column string row, e.g. a database name. */
    public static String toName(Object[] raw) {
        if (raw == null || raw.length != 1) {
            throw new SchemaDriftException("Expected a single name column");
        }
        return decodeString("name", raw[0]);
    }

    public static Object decode(QueryLogColumn column, Object raw) {
        String name = column.columnName();
        return switch (column.type()) {
            case STRING -> decodeString(name, raw);
            case TIMESTAMP -> decodeTimestamp(name, raw);
            case UNSIGNED_INTEGER, SIGNED_INTEGER -> decodeInteger(name, column.type(), raw);
            case FLAG -> decodeFlag(name, raw);
            case STRING_ARRAY -> decodeStringArray(name, raw);
        };
    }

    private static Object[] decodeAll(List<QueryLogColumn> columns, Object[] raw) {
        if (raw == null || raw.length != columns.size()) {
            throw new SchemaDriftException("Row has " + (raw == null ? 0 : raw.length)
                    + " values, expected " + columns.size());
        }
        Object[] decoded = new Object[raw.length];
        for (int i = 0; i < raw.length; i++) {
            decoded[i] = decode(columns.get(i), raw[i]);
        }
        return decoded;
    }

    private static String decodeString(String column, Object raw) {
        if (raw instanceof String s) {
            return s;
        }
        throw new SchemaDriftException(column, ColumnType.STRING, raw);
    }

    private static Instant decodeTimestamp(String column, Object raw) {
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (raw instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (raw instanceof LocalDate ld) {
            return ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (raw instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        throw new SchemaDriftException(column, ColumnType.TIMESTAMP, raw);
    }

    private static Long decodeInteger(String column, ColumnType type, Object raw) {
        long value;
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger big) {
            try {
                value = big.longValueExact();
            } catch (ArithmeticException e) {
                throw new SchemaDriftException(column, type, raw);
            }
        } else {
            throw new SchemaDriftException(column, type, raw);
        }
        if (type == ColumnType.UNSIGNED_INTEGER && value < 0) {
            throw new SchemaDriftException(column, type, raw);
        }
        return value;
    }

    private static Integer decodeFlag(String column, Object raw) {
        if (raw instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte || raw instanceof Long) {
            long value = ((Number) raw).longValue();
            if (value >= 0 && value <= 255) {
                return (int) value;
            }
        }
        throw new SchemaDriftException(column, ColumnType.FLAG, raw);
    }

    private static List<String> decodeStringArray(String column, Object raw) {
        Iterable<?> items;
        if (raw instanceof Object[] array) {
            items = List.of(array);
        } else if (raw instanceof List<?> list) {
            items = list;
        } else {
            throw new SchemaDriftException(column, ColumnType.STRING_ARRAY, raw);
        }
        List<String> out = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof String s)) {
                throw new SchemaDriftException(column, ColumnType.STRING_ARRAY, raw);
            }
            out.add(s);
        }
        return List.copyOf(out);
    }

    private static double decodeDouble(String column, Object raw) {
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return ((Number) raw).doubleValue();
        }
        // an average over an empty group can come back as an integral zero
        if (raw instanceof Long || raw instanceof Integer || raw instanceof BigInteger) {
            return ((Number) raw).doubleValue();
        }
        throw new SchemaDriftException("Column '" + column + "' expected a floating point value but store returned "
                + (raw == null ? "null" : raw.getClass().getName()));
    }

    @SuppressWarnings("unchecked")
    private static List<String> strings(Object decoded) {
        return (List<String>) decoded;
    }
}
