package com.tailtracker.cache.spi;

import java.util.Map;

/**
 * 外部指标上报
 */
public interface MetricsSink {

    void recordMetric(String name, double value, long timestamp, String category, Map<String, Object> metadata);
}
