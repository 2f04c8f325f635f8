package com.tailtracker.cache.query;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SQL 归一化与轻量特征判断
 */
public final class QueryNormalizer {

    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WRITE_STATEMENT = Pattern.compile("^(INSERT|UPDATE|DELETE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VOLATILE_TIME = Pattern.compile("NOW\\(\\)|CURRENT_TIMESTAMP", Pattern.CASE_INSENSITIVE);

    private QueryNormalizer() {}

    /**
     * 字面量替换为 ?，空白折叠，转小写
     */
    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        String result = STRING_LITERAL.matcher(sql).replaceAll("?");
        result = NUMBER_LITERAL.matcher(result).replaceAll("?");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isWriteStatement(String sql) {
        return sql != null && WRITE_STATEMENT.matcher(sql.trim()).find();
    }

    public static boolean hasVolatileTimeFunction(String sql) {
        return sql != null && VOLATILE_TIME.matcher(sql).find();
    }

    /**
     * 不依赖结果集的可缓存判断
     */
    public static boolean isCacheable(String sql) {
        return !isWriteStatement(sql) && !hasVolatileTimeFunction(sql);
    }

    /**
     * 按语句复杂度估算耗时（毫秒）
     */
    public static double estimateQueryTime(String sql) {
        if (sql == null) {
            return 0;
        }
        String lower = sql.toLowerCase(Locale.ROOT);
        double time = 50;
        if (lower.contains("join")) {
            time += 100;
        }
        if (lower.contains("group by")) {
            time += 80;
        }
        if (lower.contains("order by")) {
            time += 60;
        }
        if (lower.contains("subquery") || lower.contains("(select")) {
            time += 200;
        }
        return time;
    }
}
