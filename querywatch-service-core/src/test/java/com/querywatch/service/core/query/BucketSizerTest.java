package com.querywatch.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class BucketSizerTest {

    @Test
    void fourMinuteSpanUsesFiveSecondBuckets() {
        BucketSpec spec = BucketSizer.forRange(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:04:00Z"));
        assertEquals("5 SECOND", spec.interval());
        assertEquals("5s", spec.label());
    }

    @Test
    void fourteenDaySpanUsesSixHourBuckets() {
        BucketSpec spec = BucketSizer.forRange(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-15T00:00:00Z"));
        assertEquals("6 HOUR", spec.interval());
        assertEquals("6h", spec.label());
    }

    @Test
    void missingBoundDefaultsToOneMinute() {
        assertEquals(BucketSpec.M1, BucketSizer.forRange(null, Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals(BucketSpec.M1, BucketSizer.forRange(Instant.parse("2024-01-01T00:00:00Z"), null));
        assertEquals(BucketSpec.M1, BucketSizer.forRange(null, null));
    }

    @Test
    void boundariesAreInclusive() {
        assertEquals(BucketSpec.S5, BucketSizer.forSpan(Duration.ofMinutes(5)));
        assertEquals(BucketSpec.S30, BucketSizer.forSpan(Duration.ofMinutes(5).plusSeconds(1)));
        assertEquals(BucketSpec.M1, BucketSizer.forSpan(Duration.ofHours(2)));
        assertEquals(BucketSpec.M3, BucketSizer.forSpan(Duration.ofHours(6)));
        assertEquals(BucketSpec.M15, BucketSizer.forSpan(Duration.ofDays(1)));
        assertEquals(BucketSpec.H1, BucketSizer.forSpan(Duration.ofDays(7)));
        assertEquals(BucketSpec.H6, BucketSizer.forSpan(Duration.ofDays(30)));
        assertEquals(BucketSpec.D1, BucketSizer.forSpan(Duration.ofDays(31)));
    }

    @Test
    void reversedRangeFallsIntoFinestBucket() {
        BucketSpec spec = BucketSizer.forRange(
                Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"));
        assertEquals(BucketSpec.S5, spec);
    }

    @Test
    void granularityNeverShrinksAsSpanGrows() {
        Duration previousWidth = Duration.ZERO;
        for (long minutes = 0; minutes <= 60L * 24 * 90; minutes += 7) {
            Duration width = BucketSizer.forSpan(Duration.ofMinutes(minutes)).width();
            assertThat(width).isGreaterThanOrEqualTo(previousWidth);
            previousWidth = width;
        }
    }
}
