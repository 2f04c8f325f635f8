package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.telemetry.CacheSource;

/**
 * 读取结果
 *
 * @param value     未取到时为 null
 * @param fromCache 由缓存层链返回为 true，回源或未取到为 false
 * @param source    命中的层，未取到时为 null
 */
public record CacheResult<T>(T value, boolean fromCache, CacheSource source, double durationMs) {

    public static <T> CacheResult<T> empty(double durationMs) {
        return new CacheResult<>(null, false, null, durationMs);
    }

    public boolean isPresent() {
        return value != null;
    }
}
