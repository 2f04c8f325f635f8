package com.tailtracker.cache.query;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 归一化 SQL 的聚合统计
 */
@Data
public class QueryPattern {

    /** 归一化后的 SQL */
    private String pattern;
    private long frequency;
    /** 平均执行时间（毫秒），累积均值 */
    private double averageExecutionTime;
    private long lastExecuted;
    private boolean cacheable;
    private List<String> indexSuggestions = new ArrayList<>();
    /** 0-10 */
    private double optimizationScore;

    public static QueryPattern create(String pattern, boolean cacheable) {
        QueryPattern p = new QueryPattern();
        p.setPattern(pattern);
        p.setCacheable(cacheable);
        return p;
    }

    /**
     * 计入一次执行，更新累积均值
     */
    public void recordExecution(double executionTime, long timestamp) {
        frequency++;
        averageExecutionTime = (averageExecutionTime * (frequency - 1) + executionTime) / frequency;
        lastExecuted = timestamp;
    }

    public QueryPattern copy() {
        QueryPattern copy = new QueryPattern();
        copy.setPattern(pattern);
        copy.setFrequency(frequency);
        copy.setAverageExecutionTime(averageExecutionTime);
        copy.setLastExecuted(lastExecuted);
        copy.setCacheable(cacheable);
        copy.setIndexSuggestions(new ArrayList<>(indexSuggestions));
        copy.setOptimizationScore(optimizationScore);
        return copy;
    }
}
