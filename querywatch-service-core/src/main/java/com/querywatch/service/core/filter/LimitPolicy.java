package com.querywatch.service.core.filter;

/**
 * Row limits per retrieval path. A requested limit of zero or less falls back to the default; one
 * above the maximum is capped.
 */
public enum LimitPolicy {
    LISTING(100, 1000),
    EXPORT(1000, 100_000);

    private final int defaultLimit;
    private final int maxLimit;

    LimitPolicy(int defaultLimit, int maxLimit) {
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public int maxLimit() {
        return maxLimit;
    }

    public int clamp(Long requested) {
        return requested == null ? defaultLimit : clamp(requested.longValue());
    }

    public int clamp(long requested) {
        if (requested <= 0) {
            return defaultLimit;
        }
        return (int) Math.min(requested, maxLimit);
    }
}
