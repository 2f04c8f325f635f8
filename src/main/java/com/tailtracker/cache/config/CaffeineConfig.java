package com.tailtracker.cache.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tailtracker.cache.service.CaffeineCacheTier;
import com.tailtracker.cache.service.PayloadSizeEstimator;
import com.tailtracker.cache.spi.CacheTier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 内存缓存层配置
 */
@Slf4j
@Configuration
public class CaffeineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    /**
     * 内存缓存层，注册 Caffeine 指标
     */
    @Bean
    @ConditionalOnMissingBean(CacheTier.class)
    public CaffeineCacheTier memoryTier(CacheProperties properties,
                                        PayloadSizeEstimator sizeEstimator,
                                        Ticker cacheTicker,
                                        MeterRegistry meterRegistry) {
        CacheProperties.MemoryTier config = properties.getMemoryTier();
        CaffeineCacheTier tier = new CaffeineCacheTier(config, sizeEstimator, cacheTicker);

        CaffeineCacheMetrics.monitor(meterRegistry, tier.nativeCache(), "memory_tier");

        log.info("Memory tier initialized: initialCapacity={}, maxSize={}bytes, defaultTtl={}ms",
            config.getInitialCapacity(), config.getMaxSizeBytes(), config.getDefaultTtlMs());
        return tier;
    }
}
