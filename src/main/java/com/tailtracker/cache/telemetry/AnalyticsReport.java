package com.tailtracker.cache.telemetry;

import java.util.List;

/**
 * 遥测分析报告
 */
public record AnalyticsReport(
    CacheMetrics metrics,
    List<String> insights,
    List<PerformanceAlert> alerts,
    List<OptimizationRecommendation> recommendations,
    EfficiencyScores efficiency
) {
}
