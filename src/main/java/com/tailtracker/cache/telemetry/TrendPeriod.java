package com.tailtracker.cache.telemetry;

import com.tailtracker.cache.constant.CacheConstants;

/**
 * 趋势周期：分桶大小与保留点数
 */
public enum TrendPeriod {
    HOUR(CacheConstants.ONE_HOUR_MS, 24),
    DAY(CacheConstants.ONE_DAY_MS, 30),
    WEEK(7 * CacheConstants.ONE_DAY_MS, 12);

    private final long bucketMs;
    private final int maxPoints;

    TrendPeriod(long bucketMs, int maxPoints) {
        this.bucketMs = bucketMs;
        this.maxPoints = maxPoints;
    }

    public long bucketMs() {
        return bucketMs;
    }

    public int maxPoints() {
        return maxPoints;
    }

    public long bucketOf(long timestamp) {
        return Math.floorDiv(timestamp, bucketMs) * bucketMs;
    }
}
