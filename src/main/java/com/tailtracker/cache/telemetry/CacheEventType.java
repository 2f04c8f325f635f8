package com.tailtracker.cache.telemetry;

/**
 * 缓存事件类型
 */
public enum CacheEventType {
    HIT,
    MISS,
    EVICTION,
    PREFETCH,
    ERROR;

    /**
     * 是否计入请求总数
     */
    public boolean countsAsRequest() {
        return this == HIT || this == MISS || this == ERROR;
    }
}
