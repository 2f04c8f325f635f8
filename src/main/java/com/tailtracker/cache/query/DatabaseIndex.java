package com.tailtracker.cache.query;

import java.util.List;

/**
 * 索引建议（仅作参考，不会真正建索引）
 *
 * @param usage         引用该索引的查询频次总和
 * @param effectiveness 0-10
 */
public record DatabaseIndex(
    String name,
    String table,
    List<String> columns,
    String type,
    boolean unique,
    long size,
    long usage,
    double effectiveness
) {

    public String toDdl() {
        return "CREATE INDEX " + name + " ON " + table + "(" + String.join(", ", columns) + ")";
    }
}
