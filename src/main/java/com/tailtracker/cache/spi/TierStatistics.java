package com.tailtracker.cache.spi;

/**
 * 物理缓存层统计快照
 *
 * @param usagePercentage 内存使用百分比（0-100）
 */
public record TierStatistics(
    long hitCount,
    long missCount,
    double hitRate,
    long memoryUsage,
    long diskUsage,
    long evictionCount,
    double usagePercentage,
    double compressionRatio
) {

    public static TierStatistics empty() {
        return new TierStatistics(0, 0, 0, 0, 0, 0, 0, 1.0);
    }
}
