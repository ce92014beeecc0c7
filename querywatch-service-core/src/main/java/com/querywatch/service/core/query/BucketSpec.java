package com.querywatch.service.core.query;

import java.time.Duration;

/**
 * Closed set of aggregation granularities. {@link #interval()} is inlined into the bucketing
 * expression, so it must only ever come from this enum.
 */
public enum BucketSpec {
    S5("5 SECOND", "5s", Duration.ofSeconds(5), Duration.ofMinutes(5)),
    S30("30 SECOND", "30s", Duration.ofSeconds(30), Duration.ofMinutes(30)),
    M1("1 MINUTE", "1m", Duration.ofMinutes(1), Duration.ofHours(2)),
    M3("3 MINUTE", "3m", Duration.ofMinutes(3), Duration.ofHours(6)),
    M15("15 MINUTE", "15m", Duration.ofMinutes(15), Duration.ofDays(1)),
    H1("1 HOUR", "1h", Duration.ofHours(1), Duration.ofDays(7)),
    H6("6 HOUR", "6h", Duration.ofHours(6), Duration.ofDays(30)),
    D1("1 DAY", "1d", Duration.ofDays(1), null);

    private final String interval;
    private final String label;
    private final Duration width;
    private final Duration maxSpan;

    BucketSpec(String interval, String label, Duration width, Duration maxSpan) {
        this.interval = interval;
        this.label = label;
        this.width = width;
        this.maxSpan = maxSpan;
    }

    /** Interval expression, e.g. {@code 1 MINUTE}. */
    public String interval() {
        return interval;
    }

    /** Short label, e.g. {@code 1m}. */
    public String label() {
        return label;
    }

    public Duration width() {
        return width;
    }

    /** Largest span this bucket covers; {@code null} for the catch-all. */
    Duration maxSpan() {
        return maxSpan;
    }
}
