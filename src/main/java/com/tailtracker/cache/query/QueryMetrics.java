package com.tailtracker.cache.query;

import java.util.List;

/**
 * 单次查询执行记录
 */
public record QueryMetrics(
    String queryId,
    String sql,
    double executionTime,
    int resultCount,
    boolean cacheHit,
    long timestamp,
    List<Object> parameters,
    String errorMessage
) {

    public boolean failed() {
        return errorMessage != null;
    }
}
