package com.tailtracker.cache.spi;

/**
 * CDN 资源拉取统计
 */
public record AssetMetrics(
    long totalRequests,
    long cacheHits,
    long cacheMisses,
    long dataTransferred,
    long compressionSavings
) {

    public static AssetMetrics empty() {
        return new AssetMetrics(0, 0, 0, 0, 0);
    }
}
