package com.querywatch.service.core.query;

import java.time.Duration;
import java.time.Instant;

/**
 * Picks a bucket width from the requested time span so a series stays at roughly 60-170 points.
 */
public final class BucketSizer {

    public static final BucketSpec DEFAULT = BucketSpec.M1;

    private BucketSizer() {}

    public static BucketSpec forRange(Instant start, Instant end) {
        if (start == null || end == null) {
            return DEFAULT;
        }
        return forSpan(Duration.between(start, end));
    }

    public static BucketSpec forSpan(Duration span) {
        for (BucketSpec spec : BucketSpec.values()) {
            if (spec.maxSpan() == null || span.compareTo(spec.maxSpan()) <= 0) {
                return spec;
            }
        }
        return BucketSpec.D1;
    }
}
