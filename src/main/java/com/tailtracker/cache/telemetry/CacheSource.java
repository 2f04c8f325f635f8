package com.tailtracker.cache.telemetry;

/**
 * 事件来源层
 */
public enum CacheSource {
    MEMORY,
    DISK,
    NETWORK,
    CDN
}
