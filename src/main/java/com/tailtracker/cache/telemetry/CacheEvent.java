package com.tailtracker.cache.telemetry;

import java.util.Map;

/**
 * 单次缓存访问事件
 *
 * @param duration 耗时（毫秒）
 * @param size     数据大小（字节），未知为 null
 */
public record CacheEvent(
    String id,
    long timestamp,
    CacheEventType type,
    String key,
    double duration,
    Long size,
    CacheSource source,
    Map<String, Object> metadata
) {
}
