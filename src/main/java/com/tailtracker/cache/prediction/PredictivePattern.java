package com.tailtracker.cache.prediction;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 学习到的访问模式
 */
@Data
@NoArgsConstructor
public class PredictivePattern {

    /** hash(route, timeOfDay, dayOfWeek, action) */
    private String id;
    private List<String> sequence = new ArrayList<>();
    /** 置信度（0-1） */
    private double confidence;
    private long frequency;
    private LoadingContext context;
    /** 成功率（0-1） */
    private double successRate;
    /** 平均加载耗时（毫秒） */
    private double averageLoadTime;
    private long lastUsed;

    public String primaryAction() {
        return sequence.isEmpty() ? null : sequence.get(0);
    }

    public PredictivePattern copy() {
        PredictivePattern copy = new PredictivePattern();
        copy.id = id;
        copy.sequence = new ArrayList<>(sequence);
        copy.confidence = confidence;
        copy.frequency = frequency;
        copy.context = context;
        copy.successRate = successRate;
        copy.averageLoadTime = averageLoadTime;
        copy.lastUsed = lastUsed;
        return copy;
    }
}
