package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.spi.CachePriority;

/**
 * 读写策略
 *
 * @param ttlMs            写入过期时间，null 表示使用默认值
 * @param enablePrediction 回源写入时是否喂给预测器
 */
public record CacheStrategy(
    CacheLevel level,
    CachePriority priority,
    Long ttlMs,
    boolean enableCompression,
    boolean enablePrediction
) {

    public CacheStrategy {
        if (level == null) {
            level = CacheLevel.AUTO;
        }
        if (priority == null) {
            priority = CachePriority.MEDIUM;
        }
    }

    public static CacheStrategy auto() {
        return new CacheStrategy(CacheLevel.AUTO, CachePriority.MEDIUM, null, false, true);
    }

    public CacheStrategy withTtl(long newTtlMs) {
        return new CacheStrategy(level, priority, newTtlMs, enableCompression, enablePrediction);
    }

    public CacheStrategy withLevel(CacheLevel newLevel) {
        return new CacheStrategy(newLevel, priority, ttlMs, enableCompression, enablePrediction);
    }

    public CacheStrategy withPriority(CachePriority newPriority) {
        return new CacheStrategy(level, newPriority, ttlMs, enableCompression, enablePrediction);
    }

    public CacheStrategy withoutPrediction() {
        return new CacheStrategy(level, priority, ttlMs, enableCompression, false);
    }
}
