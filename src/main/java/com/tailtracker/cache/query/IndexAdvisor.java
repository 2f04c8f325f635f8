package com.tailtracker.cache.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 FROM / WHERE / JOIN 子句的索引建议
 */
public final class IndexAdvisor {

    private static final Pattern FROM_TABLE = Pattern.compile("\\bfrom\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    /** WHERE 子句主体，截止到 GROUP/ORDER/LIMIT */
    private static final Pattern WHERE_CLAUSE = Pattern.compile(
        "\\bwhere\\s+(.*?)(?:\\bgroup\\s+by\\b|\\border\\s+by\\b|\\blimit\\b|\\)|$)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern WHERE_COLUMN = Pattern.compile(
        "(?:\\w+\\.)?(\\w+)\\s*(?:<=|>=|<>|!=|=|<|>|\\blike\\b|\\bin\\b)", Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_ON = Pattern.compile(
        "\\bjoin\\s+\\w+(?:\\s+\\w+)?\\s+on\\s+(\\w+)\\.(\\w+)\\s*=\\s*(\\w+)\\.(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern DDL = Pattern.compile("CREATE INDEX (\\w+) ON (\\w+)\\(([^)]+)\\)");

    private IndexAdvisor() {}

    /**
     * 为单条（归一化后的）SQL 生成去重后的 CREATE INDEX 建议
     */
    public static List<String> suggest(String sql) {
        Set<String> suggestions = new LinkedHashSet<>();
        if (sql == null || sql.isBlank()) {
            return List.of();
        }

        List<String> tables = new ArrayList<>();
        Matcher from = FROM_TABLE.matcher(sql);
        while (from.find()) {
            tables.add(from.group(1));
        }
        if (tables.isEmpty()) {
            return List.of();
        }

        Set<String> columns = new LinkedHashSet<>();
        Matcher where = WHERE_CLAUSE.matcher(sql);
        while (where.find()) {
            Matcher column = WHERE_COLUMN.matcher(where.group(1));
            while (column.find()) {
                String name = column.group(1);
                if (!isKeyword(name)) {
                    columns.add(name);
                }
            }
        }
        for (String table : tables) {
            for (String column : columns) {
                suggestions.add(ddl(table, column));
            }
        }

        Matcher join = JOIN_ON.matcher(sql);
        while (join.find()) {
            suggestions.add(ddl(join.group(1), join.group(2)));
            suggestions.add(ddl(join.group(3), join.group(4)));
        }
        return List.copyOf(suggestions);
    }

    /**
     * 跨模式聚合：只统计频次大于 minFrequency 的模式，按频次加权取前 limit 条
     */
    public static List<DatabaseIndex> aggregate(Collection<QueryPattern> patterns, long minFrequency, int limit) {
        Map<String, Long> weights = new HashMap<>();
        for (QueryPattern pattern : patterns) {
            if (pattern.getFrequency() <= minFrequency) {
                continue;
            }
            for (String suggestion : pattern.getIndexSuggestions()) {
                weights.merge(suggestion, pattern.getFrequency(), Long::sum);
            }
        }
        return weights.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(limit)
            .map(e -> parse(e.getKey(), e.getValue()))
            .toList();
    }

    /**
     * 引用频次越高越有效，log 压缩后封顶 10
     */
    static double effectiveness(long usage) {
        return Math.min(10.0, Math.log1p(Math.max(0, usage)) * 2);
    }

    static DatabaseIndex parse(String suggestion, long usage) {
        Matcher m = DDL.matcher(suggestion);
        if (m.matches()) {
            List<String> columns = Arrays.stream(m.group(3).split(","))
                .map(String::trim)
                .toList();
            return new DatabaseIndex(m.group(1), m.group(2), columns, "btree", false, 0, usage, effectiveness(usage));
        }
        return new DatabaseIndex("unknown", "unknown", List.of(), "btree", false, 0, usage, 0);
    }

    // ========== 私有方法 ==========

    private static String ddl(String table, String column) {
        return "CREATE INDEX idx_" + table + "_" + column + " ON " + table + "(" + column + ")";
    }

    private static boolean isKeyword(String word) {
        return switch (word.toLowerCase()) {
            case "and", "or", "not", "where", "is", "null", "like", "in" -> true;
            default -> false;
        };
    }
}
