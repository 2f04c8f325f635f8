package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.MetricsSink;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 将外部指标写入 Micrometer 分布摘要（按 name / category 打标签）
 */
@Slf4j
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordMetric(String name, double value, long timestamp, String category, Map<String, Object> metadata) {
        DistributionSummary.builder("engine.metric")
            .tag("name", name)
            .tag("category", category != null ? category : "general")
            .register(meterRegistry)
            .record(value);
        if (log.isDebugEnabled()) {
            log.debug("Metric recorded: name={}, value={}, category={}, metadata={}", name, value, category, metadata);
        }
    }
}
