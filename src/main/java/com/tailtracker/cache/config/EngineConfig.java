package com.tailtracker.cache.config;

import com.tailtracker.cache.service.InMemoryKeyValueStore;
import com.tailtracker.cache.service.JdbcQueryExecutor;
import com.tailtracker.cache.service.JvmMemoryPoolManager;
import com.tailtracker.cache.service.MicrometerMetricsSink;
import com.tailtracker.cache.service.NoopAssetFetcher;
import com.tailtracker.cache.service.NoopImagePipeline;
import com.tailtracker.cache.service.NoopPredictionDataLoader;
import com.tailtracker.cache.service.StaticDeviceStateProvider;
import com.tailtracker.cache.service.UnconfiguredQueryExecutor;
import com.tailtracker.cache.spi.AssetFetcher;
import com.tailtracker.cache.spi.DeviceStateProvider;
import com.tailtracker.cache.spi.ImagePipeline;
import com.tailtracker.cache.spi.KeyValueStore;
import com.tailtracker.cache.spi.MemoryPoolManager;
import com.tailtracker.cache.spi.MetricsSink;
import com.tailtracker.cache.spi.PredictionDataLoader;
import com.tailtracker.cache.spi.QueryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * 外部协作方的默认实现
 * 宿主应用声明同类型 Bean 即可替换
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore() {
        return new InMemoryKeyValueStore();
    }

    /**
     * 存在 JdbcTemplate 时走 JDBC，否则调用即报错
     */
    @Bean
    @ConditionalOnMissingBean
    public QueryExecutor queryExecutor(ObjectProvider<JdbcTemplate> jdbcTemplate) {
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template == null) {
            log.warn("No JdbcTemplate available, query execution is disabled");
            return new UnconfiguredQueryExecutor();
        }
        return new JdbcQueryExecutor(template);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSink metricsSink(MeterRegistry meterRegistry) {
        return new MicrometerMetricsSink(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public MemoryPoolManager memoryPoolManager() {
        return new JvmMemoryPoolManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceStateProvider deviceStateProvider() {
        return new StaticDeviceStateProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public AssetFetcher assetFetcher() {
        return new NoopAssetFetcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ImagePipeline imagePipeline() {
        return new NoopImagePipeline();
    }

    @Bean
    @ConditionalOnMissingBean
    public PredictionDataLoader predictionDataLoader() {
        return new NoopPredictionDataLoader();
    }
}
