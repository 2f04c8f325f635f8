package com.tailtracker.cache.telemetry;

import lombok.Data;

/**
 * 汇总缓存指标
 * 由遥测服务独占修改，对外只返回副本
 */
@Data
public class CacheMetrics {

    private long totalRequests;
    private long cacheHits;
    private long cacheMisses;
    private long errorCount;
    /** 命中率 = cacheHits / totalRequests */
    private double hitRatio;
    /** 命中耗时 EMA（毫秒） */
    private double averageHitTime;
    /** 未命中耗时 EMA（毫秒） */
    private double averageMissTime;
    /** 按请求数加权的平均响应时间（毫秒） */
    private double totalResponseTime;

    private long memoryUsage;
    /** 内存使用率（0-1） */
    private double memoryUtilization;
    private long diskUsage;
    private double memoryFragmentation;

    /** 压缩后 / 原始大小 */
    private double compressionRatio = 1.0;
    private long networkSavings;
    private long bytesServedFromCache;
    private long bytesDownloaded;

    private double evictionRate;
    private double prefetchAccuracy;

    public double getErrorRate() {
        return totalRequests > 0 ? (double) errorCount / totalRequests : 0;
    }

    public void recomputeHitRatio() {
        this.hitRatio = totalRequests > 0 ? (double) cacheHits / totalRequests : 0;
    }

    public CacheMetrics copy() {
        CacheMetrics copy = new CacheMetrics();
        copy.totalRequests = totalRequests;
        copy.cacheHits = cacheHits;
        copy.cacheMisses = cacheMisses;
        copy.errorCount = errorCount;
        copy.hitRatio = hitRatio;
        copy.averageHitTime = averageHitTime;
        copy.averageMissTime = averageMissTime;
        copy.totalResponseTime = totalResponseTime;
        copy.memoryUsage = memoryUsage;
        copy.memoryUtilization = memoryUtilization;
        copy.diskUsage = diskUsage;
        copy.memoryFragmentation = memoryFragmentation;
        copy.compressionRatio = compressionRatio;
        copy.networkSavings = networkSavings;
        copy.bytesServedFromCache = bytesServedFromCache;
        copy.bytesDownloaded = bytesDownloaded;
        copy.evictionRate = evictionRate;
        copy.prefetchAccuracy = prefetchAccuracy;
        return copy;
    }
}
