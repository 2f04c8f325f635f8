package com.tailtracker.cache.telemetry;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 某一周期的指标快照序列及其预测
 */
@Data
@NoArgsConstructor
public class CacheTrend {

    private TrendPeriod period;
    private List<CacheMetrics> metrics = new ArrayList<>();
    private List<Long> timestamps = new ArrayList<>();
    private List<CacheMetrics> predictions = new ArrayList<>();

    public CacheTrend(TrendPeriod period) {
        this.period = period;
    }

    public Long lastTimestamp() {
        return timestamps.isEmpty() ? null : timestamps.get(timestamps.size() - 1);
    }

    /**
     * 追加一个数据点，超过周期上限时丢弃最旧的点
     */
    public void append(long bucketTimestamp, CacheMetrics snapshot) {
        timestamps.add(bucketTimestamp);
        metrics.add(snapshot);
        int maxPoints = period.maxPoints();
        while (metrics.size() > maxPoints) {
            metrics.remove(0);
            timestamps.remove(0);
        }
    }

    public CacheTrend copy() {
        CacheTrend copy = new CacheTrend(period);
        metrics.forEach(m -> copy.metrics.add(m.copy()));
        copy.timestamps.addAll(timestamps);
        predictions.forEach(p -> copy.predictions.add(p.copy()));
        return copy;
    }
}
