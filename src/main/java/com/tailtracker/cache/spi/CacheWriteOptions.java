package com.tailtracker.cache.spi;

import java.time.Duration;

/**
 * 物理缓存层写入参数
 *
 * @param ttl         过期时间，null 表示使用缓存层默认值
 * @param priority    条目优先级
 * @param compression 是否压缩
 * @param persist     是否落盘
 */
public record CacheWriteOptions(Duration ttl, CachePriority priority, boolean compression, boolean persist) {

    public CacheWriteOptions {
        if (priority == null) {
            priority = CachePriority.MEDIUM;
        }
    }

    public static CacheWriteOptions defaults() {
        return new CacheWriteOptions(null, CachePriority.MEDIUM, false, true);
    }

    public static CacheWriteOptions withTtl(Duration ttl) {
        return new CacheWriteOptions(ttl, CachePriority.MEDIUM, false, true);
    }
}
