package com.querywatch.service.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Aggregates for one time slice of the query log. */
public record MetricBucket(
        @JsonProperty("time_bucket") Instant timeBucket,
        @JsonProperty("total_queries") long totalQueries,
        @JsonProperty("avg_duration_ms") double avgDurationMs,
        @JsonProperty("max_duration_ms") long maxDurationMs,
        @JsonProperty("avg_memory_usage") double avgMemoryUsage,
        @JsonProperty("max_memory_usage") long maxMemoryUsage,
        @JsonProperty("total_read_bytes") long totalReadBytes,
        @JsonProperty("total_written_bytes") long totalWrittenBytes,
        @JsonProperty("failed_queries") long failedQueries) {}
