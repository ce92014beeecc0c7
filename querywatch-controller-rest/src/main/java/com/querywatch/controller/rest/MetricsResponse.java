package com.querywatch.controller.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.querywatch.service.core.model.MetricBucket;
import com.querywatch.service.core.query.BucketSpec;
import java.util.List;

/**
 * Metrics envelope. {@code bucket_size} carries the short label ("1m") and {@code bucket_label} the
 * interval expression ("1 MINUTE"); existing dashboards read them this way round.
 */
public record MetricsResponse(
        List<MetricBucket> data,
        @JsonProperty("bucket_size") String bucketSize,
        @JsonProperty("bucket_label") String bucketLabel) {

    static MetricsResponse of(List<MetricBucket> data, BucketSpec bucket) {
        return new MetricsResponse(data, bucket.label(), bucket.interval());
    }
}
