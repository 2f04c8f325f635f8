package com.tailtracker.cache.query;

import java.util.List;

/**
 * 查询统计汇总
 */
public record QueryAnalytics(
    int totalQueries,
    int slowQueries,
    double averageExecutionTime,
    double cacheHitRate,
    List<SlowQuery> topSlowQueries,
    double optimizationScore
) {

    public record SlowQuery(String pattern, double avgTime, long frequency) {
    }
}
