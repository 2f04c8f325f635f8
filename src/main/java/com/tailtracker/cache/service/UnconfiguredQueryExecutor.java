package com.tailtracker.cache.service;

import com.tailtracker.cache.exception.QueryExecutionException;
import com.tailtracker.cache.spi.QueryExecutor;
import com.tailtracker.cache.spi.QueryResult;

import java.util.List;

/**
 * 未配置数据源时的占位执行器，所有调用都失败
 */
public class UnconfiguredQueryExecutor implements QueryExecutor {

    @Override
    public QueryResult execute(String sql, List<Object> params) {
        throw new QueryExecutionException("No query executor configured");
    }
}
