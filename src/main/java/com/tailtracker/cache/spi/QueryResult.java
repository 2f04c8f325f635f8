package com.tailtracker.cache.spi;

import java.util.List;
import java.util.Map;

/**
 * 数据库执行结果：查询返回行，写操作返回影响行数
 */
public record QueryResult(List<Map<String, Object>> rows, int affectedRows, boolean write) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult ofRows(List<Map<String, Object>> rows) {
        return new QueryResult(rows, 0, false);
    }

    public static QueryResult ofAffected(int affectedRows) {
        return new QueryResult(List.of(), affectedRows, true);
    }

    /**
     * 结果条数，写操作计为 1
     */
    public int resultCount() {
        return write ? 1 : rows.size();
    }

    public QueryResult limit(int maxRows) {
        if (write || maxRows <= 0 || rows.size() <= maxRows) {
            return this;
        }
        return new QueryResult(rows.subList(0, maxRows), affectedRows, false);
    }
}
