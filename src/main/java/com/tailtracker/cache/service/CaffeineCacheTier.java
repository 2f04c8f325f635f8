package com.tailtracker.cache.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.Weigher;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.TierSettings;
import com.tailtracker.cache.spi.TierStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Caffeine 的内存缓存层
 * 按条目 TTL 过期，按估算字节数做容量限制（W-TinyLFU 淘汰）
 */
@Slf4j
public class CaffeineCacheTier implements CacheTier {

    private final Cache<String, TierEntry> cache;
    private final PayloadSizeEstimator sizeEstimator;
    private final long defaultTtlNanos;

    private volatile TierSettings settings;

    public CaffeineCacheTier(CacheProperties.MemoryTier config, PayloadSizeEstimator sizeEstimator, Ticker ticker) {
        this.sizeEstimator = sizeEstimator;
        this.defaultTtlNanos = TimeUnit.MILLISECONDS.toNanos(config.getDefaultTtlMs());
        this.settings = new TierSettings(config.getMaxSizeBytes(), config.isCompressionEnabled());

        Caffeine<String, TierEntry> builder = Caffeine.newBuilder()
            .initialCapacity(config.getInitialCapacity())
            .maximumWeight(config.getMaxSizeBytes())
            .weigher((Weigher<String, TierEntry>) (key, entry) -> entry.weight())
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .removalListener((String key, TierEntry entry, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Memory tier evicted due to size: key={}", key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Memory tier entry expired: key={}", key);
                }
            });
        if (config.isRecordStats()) {
            builder.recordStats();
        }
        this.cache = builder.build();
    }

    @Override
    public Object get(String key) {
        TierEntry entry = cache.getIfPresent(key);
        return entry != null ? entry.data() : null;
    }

    @Override
    public boolean set(String key, Object data, CacheWriteOptions options) {
        if (key == null || data == null) {
            return false;
        }
        CacheWriteOptions opts = options != null ? options : CacheWriteOptions.defaults();
        long ttlNanos = opts.ttl() != null ? opts.ttl().toNanos() : defaultTtlNanos;
        if (ttlNanos <= 0) {
            return false;
        }
        long size = sizeEstimator.estimate(data) + key.length() * 2L;
        boolean compressed = opts.compression() && settings.compressionEnabled();
        cache.put(key, new TierEntry(data, ttlNanos, size, opts.priority(), compressed));
        return true;
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public TierStatistics getStatistics() {
        CacheStats stats = cache.stats();
        long weightedSize = cache.policy().eviction()
            .map(eviction -> eviction.weightedSize().orElse(0L))
            .orElse(0L);
        long maxSize = settings.maxSizeBytes();
        double usagePercentage = maxSize > 0 ? (double) weightedSize / maxSize * 100 : 0;
        return new TierStatistics(
            stats.hitCount(),
            stats.missCount(),
            stats.hitRate(),
            weightedSize,
            0,
            stats.evictionCount(),
            Math.min(usagePercentage, 100.0),
            1.0
        );
    }

    @Override
    public TierSettings getSettings() {
        return settings;
    }

    @Override
    public void applySettings(TierSettings newSettings) {
        if (newSettings == null || newSettings.maxSizeBytes() <= 0) {
            return;
        }
        cache.policy().eviction().ifPresent(eviction -> eviction.setMaximum(newSettings.maxSizeBytes()));
        this.settings = newSettings;
        log.info("Memory tier settings applied: maxSizeBytes={}, compression={}",
            newSettings.maxSizeBytes(), newSettings.compressionEnabled());
    }

    @Override
    public long cleanUp() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        return Math.max(0, before - cache.estimatedSize());
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 底层 Caffeine 缓存，用于绑定 Micrometer 指标
     */
    public Cache<String, TierEntry> nativeCache() {
        return cache;
    }

    // ========== 内部类型 ==========

    public record TierEntry(Object data, long ttlNanos, long sizeBytes, CachePriority priority, boolean compressed) {

        int weight() {
            return (int) Math.min(Math.max(sizeBytes, 1), Integer.MAX_VALUE);
        }

        Duration ttl() {
            return Duration.ofNanos(ttlNanos);
        }
    }

    private static class EntryExpiry implements Expiry<String, TierEntry> {

        @Override
        public long expireAfterCreate(String key, TierEntry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TierEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, TierEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
