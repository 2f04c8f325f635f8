package com.tailtracker.cache.spi;

/**
 * 物理缓存层（内存 / 磁盘键值缓存）
 */
public interface CacheTier {

    /**
     * 读取条目，未命中或已过期返回 null
     */
    Object get(String key);

    boolean set(String key, Object data, CacheWriteOptions options);

    void remove(String key);

    TierStatistics getStatistics();

    TierSettings getSettings();

    void applySettings(TierSettings settings);

    /**
     * 执行过期清理，返回清理前后条目数差值
     */
    long cleanUp();
}
