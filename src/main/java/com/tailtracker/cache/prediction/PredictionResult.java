package com.tailtracker.cache.prediction;

/**
 * 单条预测结果
 *
 * @param probability     置信度 × 上下文相似度
 * @param estimatedSize   预估字节数
 * @param cacheDurationMs 预取数据的缓存时长
 */
public record PredictionResult(
    String dataType,
    double probability,
    LoadingStrategy strategy,
    long estimatedSize,
    long cacheDurationMs
) {
}
