package com.tailtracker.cache.telemetry;

/**
 * 效率评分（百分制）
 * overallScore = 缓存 40% + 网络 30% + 内存 30%
 */
public record EfficiencyScores(
    double cacheEfficiency,
    double networkEfficiency,
    double memoryEfficiency,
    long overallScore
) {

    static EfficiencyScores of(CacheMetrics metrics) {
        double cache = metrics.getHitRatio();
        double network = (double) metrics.getNetworkSavings() / Math.max(metrics.getBytesDownloaded(), 1);
        double memory = 1 - metrics.getMemoryUtilization();
        double overall = (cache * 0.4 + network * 0.3 + memory * 0.3) * 100;
        return new EfficiencyScores(cache * 100, network * 100, memory * 100, Math.round(overall));
    }
}
