package com.querywatch.service.core.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LimitPolicyTest {

    @Test
    void missingOrNonPositiveLimitUsesPathDefault() {
        assertEquals(100, LimitPolicy.LISTING.clamp(null));
        assertEquals(100, LimitPolicy.LISTING.clamp(0));
        assertEquals(100, LimitPolicy.LISTING.clamp(-5));
        assertEquals(1000, LimitPolicy.EXPORT.clamp(null));
        assertEquals(1000, LimitPolicy.EXPORT.clamp(-1));
    }

    @Test
    void oversizedLimitIsCappedAtPathMaximum() {
        assertEquals(1000, LimitPolicy.LISTING.clamp(1001));
        assertEquals(1000, LimitPolicy.LISTING.clamp(Integer.MAX_VALUE));
        assertEquals(100_000, LimitPolicy.EXPORT.clamp(250_000));
        assertEquals(1000, LimitPolicy.LISTING.clamp(5_000_000_000L));
        assertEquals(100_000, LimitPolicy.EXPORT.clamp(Long.MAX_VALUE));
    }

    @Test
    void inRangeLimitIsKept() {
        assertEquals(1, LimitPolicy.LISTING.clamp(1));
        assertEquals(1000, LimitPolicy.LISTING.clamp(1000));
        assertEquals(5000, LimitPolicy.EXPORT.clamp(5000));
    }

    @Test
    void clampingIsIdempotent() {
        for (int requested : new int[] {-10, 0, 1, 99, 100, 999, 1000, 1001, 50_000}) {
            int once = LimitPolicy.LISTING.clamp(requested);
            assertEquals(once, LimitPolicy.LISTING.clamp(once));
        }
    }
}
