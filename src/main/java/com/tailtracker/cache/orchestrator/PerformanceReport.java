package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.telemetry.CacheMetrics;

import java.util.List;
import java.util.Map;

/**
 * 综合性能报告
 *
 * @param overallScore    0-100
 * @param componentScores 各组成部分得分（0-100）
 */
public record PerformanceReport(
    double overallScore,
    String grade,
    String status,
    Map<String, Double> componentScores,
    CacheMetrics metrics,
    List<String> recommendations,
    long generatedAt
) {
}
