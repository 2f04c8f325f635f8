package com.tailtracker.cache.telemetry;

import com.tailtracker.cache.spi.AssetMetrics;
import com.tailtracker.cache.spi.ImageStats;
import com.tailtracker.cache.spi.TierStatistics;

/**
 * 一次监控采集从各缓存层拉取的统计
 */
public record TelemetrySnapshot(
    TierStatistics tierStatistics,
    AssetMetrics assetMetrics,
    ImageStats imageStats,
    long totalPredictions,
    long successfulPredictions,
    double memoryFragmentation
) {

    public static TelemetrySnapshot empty() {
        return new TelemetrySnapshot(TierStatistics.empty(), AssetMetrics.empty(), ImageStats.empty(), 0, 0, 0);
    }
}
