package com.tailtracker.cache.telemetry;

import java.util.List;
import java.util.Map;

/**
 * 遥测数据导出
 */
public record AnalyticsExport(
    CacheMetrics metrics,
    List<CacheEvent> events,
    List<PerformanceAlert> alerts,
    Map<TrendPeriod, CacheTrend> trends
) {
}
