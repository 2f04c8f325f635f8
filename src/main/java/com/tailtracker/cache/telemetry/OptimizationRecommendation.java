package com.tailtracker.cache.telemetry;

import com.tailtracker.cache.spi.CachePriority;

/**
 * 调优建议，按 impactScore 降序返回
 */
public record OptimizationRecommendation(
    String id,
    RecommendationType type,
    CachePriority priority,
    String description,
    String expectedImprovement,
    String implementation,
    double impactScore
) {
}
