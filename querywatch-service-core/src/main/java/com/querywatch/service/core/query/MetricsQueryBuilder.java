package com.querywatch.service.core.query;

import com.querywatch.service.core.filter.LogFilter;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the time-bucketed aggregation over the same predicates as listing. Pagination, projection
 * and sort do not apply; buckets come back in ascending time order.
 */
public final class MetricsQueryBuilder {

    private final String table;

    public MetricsQueryBuilder(String table) {
        this.table = FilterPredicates.requireTableName(table);
    }

    public BuiltQuery build(LogFilter filter, BucketSpec bucket) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(768);
        // interval comes from the closed BucketSpec set, never from the request
        sql.append("SELECT toStartOfInterval(event_time, INTERVAL ")
                .append(bucket.interval())
                .append(") AS time_bucket, ")
                .append("COUNT(*) AS total_queries, ")
                .append("AVG(query_duration_ms) AS avg_duration_ms, ")
                .append("MAX(query_duration_ms) AS max_duration_ms, ")
                .append("AVG(memory_usage) AS avg_memory_usage, ")
                .append("MAX(memory_usage) AS max_memory_usage, ")
                .append("SUM(read_bytes) AS total_read_bytes, ")
                .append("SUM(written_bytes) AS total_written_bytes, ")
                .append("SUM(CASE WHEN ")
                .append(FilterPredicates.FAILED)
                .append(" THEN 1 ELSE 0 END) AS failed_queries")
                .append(" FROM ")
                .append(table);

        FilterPredicates.append(filter, sql, args);

        sql.append(" GROUP BY time_bucket ORDER BY time_bucket ASC");
        return new BuiltQuery(sql.toString(), args);
    }
}
