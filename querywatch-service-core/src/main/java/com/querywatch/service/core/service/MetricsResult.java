package com.querywatch.service.core.service;

import com.querywatch.service.core.model.MetricBucket;
import com.querywatch.service.core.query.BucketSpec;
import java.util.List;

public record MetricsResult(List<MetricBucket> buckets, BucketSpec bucket) {
    public MetricsResult {
        buckets = List.copyOf(buckets);
    }
}
