package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.telemetry.CacheMetrics;

import java.util.List;
import java.util.Map;

/**
 * 一次调优的结果
 *
 * @param improvements 指标变化（after - before），内存与响应时间为负表示改善
 */
public record OptimizationOutcome(
    CacheMetrics before,
    CacheMetrics after,
    Map<String, Double> improvements,
    List<String> actions,
    List<String> recommendations
) {
}
