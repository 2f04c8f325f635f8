package com.tailtracker.cache.spi;

import java.util.List;

/**
 * 数据库执行原语，查询顾问只做包装
 */
public interface QueryExecutor {

    QueryResult execute(String sql, List<Object> params);
}
