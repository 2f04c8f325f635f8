package com.tailtracker.cache.prediction;

/**
 * 预测器统计快照
 */
public record PredictorMetrics(
    long totalPredictions,
    long successfulPredictions,
    long failedPredictions,
    double averagePredictionAccuracy,
    long totalDataPreloaded,
    double cacheHitImprovement,
    double networkSavings,
    int patternsCount,
    int queueLength
) {
}
