package com.tailtracker.cache.prediction;

import com.tailtracker.cache.spi.CachePriority;

/**
 * 预取加载策略
 */
public record LoadingStrategy(
    LoadingType type,
    CachePriority priority,
    int batchSize,
    int retryCount,
    long timeoutMs,
    boolean networkDependent
) {
}
