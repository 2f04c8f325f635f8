package com.tailtracker.cache.service;

import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.config.JacksonConfig;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.TierStatistics;
import com.tailtracker.cache.support.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 内存缓存层单元测试
 */
class CaffeineCacheTierTest {

    private FakeTicker ticker;
    private CaffeineCacheTier tier;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        CacheProperties.MemoryTier config = new CacheProperties.MemoryTier();
        config.setMaxSizeBytes(1024 * 1024);
        config.setDefaultTtlMs(60_000);
        tier = new CaffeineCacheTier(config, new PayloadSizeEstimator(JacksonConfig.createObjectMapper()), ticker);
    }

    @Test
    @DisplayName("写入和读取")
    void testSetAndGet() {
        assertTrue(tier.set("pet:1", Map.of("name", "Rex"), CacheWriteOptions.defaults()));

        assertEquals(Map.of("name", "Rex"), tier.get("pet:1"));
        assertNull(tier.get("pet:2"));
    }

    @Test
    @DisplayName("按条目 TTL 过期")
    void testEntryTtlExpiry() {
        tier.set("short", "a", CacheWriteOptions.withTtl(Duration.ofMillis(1000)));
        tier.set("long", "b", CacheWriteOptions.withTtl(Duration.ofMinutes(10)));

        ticker.advance(Duration.ofMillis(999));
        assertEquals("a", tier.get("short"));

        ticker.advance(Duration.ofMillis(2));
        assertNull(tier.get("short"));
        assertEquals("b", tier.get("long"));
    }

    @Test
    @DisplayName("读取不会延长过期时间")
    void testReadDoesNotExtendTtl() {
        tier.set("k", "v", CacheWriteOptions.withTtl(Duration.ofMillis(1000)));

        ticker.advance(Duration.ofMillis(800));
        assertEquals("v", tier.get("k"));

        ticker.advance(Duration.ofMillis(201));
        assertNull(tier.get("k"));
    }

    @Test
    @DisplayName("未指定 TTL 时使用默认值")
    void testDefaultTtl() {
        tier.set("k", "v", new CacheWriteOptions(null, CachePriority.HIGH, false, false));

        ticker.advance(Duration.ofSeconds(59));
        assertEquals("v", tier.get("k"));

        ticker.advance(Duration.ofSeconds(2));
        assertNull(tier.get("k"));
    }

    @Test
    @DisplayName("非法写入被拒绝")
    void testRejectInvalidWrites() {
        assertFalse(tier.set(null, "v", CacheWriteOptions.defaults()));
        assertFalse(tier.set("k", null, CacheWriteOptions.defaults()));
        assertFalse(tier.set("k", "v", CacheWriteOptions.withTtl(Duration.ZERO)));
        assertNull(tier.get("k"));
    }

    @Test
    @DisplayName("删除条目")
    void testRemove() {
        tier.set("k", "v", CacheWriteOptions.defaults());
        tier.remove("k");

        assertNull(tier.get("k"));
    }

    @Test
    @DisplayName("命中统计与容量调整")
    void testStatisticsAndSettings() {
        tier.set("k", "v", CacheWriteOptions.defaults());
        tier.get("k");
        tier.get("missing");

        TierStatistics stats = tier.getStatistics();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 1e-9);
        assertTrue(stats.memoryUsage() > 0);
        assertTrue(stats.usagePercentage() >= 0 && stats.usagePercentage() <= 100);

        tier.applySettings(tier.getSettings().withMaxSizeBytes(2 * 1024 * 1024));
        assertEquals(2 * 1024 * 1024, tier.getSettings().maxSizeBytes());
    }
}
