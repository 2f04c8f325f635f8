package com.tailtracker.cache.query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 固定顺序的查询规则表
 */
public final class QueryRules {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    /** col = 'a' OR col = 'b' [OR col = 'c' ...] */
    private static final Pattern OR_CHAIN = Pattern.compile(
        "\\b(\\w+)\\s*=\\s*'[^']*'(?:\\s+OR\\s+\\1\\s*=\\s*'[^']*')+", Pattern.CASE_INSENSITIVE);

    private static final Pattern LITERAL = Pattern.compile("'([^']*)'");

    /** 链前只能是 WHERE 或左括号 */
    private static final Pattern CHAIN_OPENS = Pattern.compile("(?:\\bWHERE|\\()\\s*$", FLAGS);

    /** 链后只能是结尾、右括号或子句关键字 */
    private static final Pattern CHAIN_CLOSES = Pattern.compile(
        "^\\s*(?:$|\\)|;|ORDER\\s+BY\\b|GROUP\\s+BY\\b|HAVING\\b|LIMIT\\b|UNION\\b)", FLAGS);

    public static final List<QueryOptimizationRule> DEFAULT_RULES = List.of(
        new QueryOptimizationRule(
            "select_star",
            "Avoid SELECT *",
            "SELECT * can be inefficient and return unnecessary data",
            Pattern.compile("SELECT\\s+\\*\\s+FROM", FLAGS),
            IssueSeverity.MEDIUM,
            "Specify only the columns you need instead of using SELECT *",
            null,
            6),
        new QueryOptimizationRule(
            "missing_where",
            "Missing WHERE clause",
            "UPDATE or DELETE without WHERE clause touches every row",
            Pattern.compile("^\\s*(UPDATE|DELETE)\\b(?!.*\\bWHERE\\b)", FLAGS),
            IssueSeverity.HIGH,
            "Add a WHERE clause to limit the affected rows",
            null,
            8),
        new QueryOptimizationRule(
            "function_in_where",
            "Function in WHERE clause",
            "Functions in WHERE clause prevent index usage",
            Pattern.compile("\\bWHERE\\b.*?\\b(?!(?:IN|EXISTS|AND|OR|NOT)\\()\\w+\\(", FLAGS),
            IssueSeverity.HIGH,
            "Avoid functions on columns in WHERE clause",
            null,
            8),
        new QueryOptimizationRule(
            "not_equals",
            "NOT EQUAL operator",
            "NOT EQUAL (!=, <>) operators can be slow",
            Pattern.compile("(!=|<>)"),
            IssueSeverity.MEDIUM,
            "Consider using positive conditions instead of NOT EQUAL",
            null,
            5),
        new QueryOptimizationRule(
            "or_conditions",
            "Multiple OR conditions",
            "Multiple OR conditions can prevent efficient index usage",
            Pattern.compile("\\bOR\\b.*\\bOR\\b", FLAGS),
            IssueSeverity.MEDIUM,
            "Consider using UNION or IN clause instead of multiple ORs",
            QueryRules::collapseOrToIn,
            6),
        new QueryOptimizationRule(
            "like_prefix",
            "LIKE with leading wildcard",
            "LIKE patterns starting with % prevent index usage",
            Pattern.compile("LIKE\\s+['\"]%", FLAGS),
            IssueSeverity.HIGH,
            "Avoid leading wildcards in LIKE patterns",
            null,
            8),
        new QueryOptimizationRule(
            "subquery_in_select",
            "Subquery in SELECT",
            "Subqueries in the SELECT list run once per row",
            Pattern.compile("^\\s*SELECT\\b(?:(?!\\bFROM\\b).)*\\(\\s*SELECT\\b", FLAGS),
            IssueSeverity.MEDIUM,
            "Consider using JOINs instead of subqueries in SELECT",
            null,
            7),
        new QueryOptimizationRule(
            "missing_limit",
            "Missing LIMIT clause",
            "Sorted queries without LIMIT may return too many rows",
            Pattern.compile("\\bORDER\\s+BY\\b(?!.*\\bLIMIT\\b)", FLAGS),
            IssueSeverity.LOW,
            "Add LIMIT clause for large result sets",
            null,
            4)
    );

    private QueryRules() {}

    /**
     * 按规则表逐条匹配，每命中一条扣 impact * 0.1 分，得分限制在 0-10
     */
    public static QueryAnalysis analyze(String sql) {
        List<QueryIssue> issues = new ArrayList<>();
        double score = 10;
        for (QueryOptimizationRule rule : DEFAULT_RULES) {
            if (rule.matches(sql)) {
                issues.add(QueryIssue.of(rule));
                score -= rule.impact() * 0.1;
            }
        }
        return new QueryAnalysis(
            issues,
            Math.max(0, Math.min(10, score)),
            QueryNormalizer.estimateQueryTime(sql),
            IndexAdvisor.suggest(QueryNormalizer.normalize(sql)));
    }

    /**
     * 同一列的等值 OR 链合并为 IN
     * a = 'x' OR a = 'y' OR a = 'z' -> a IN ('x', 'y', 'z')
     * 仅当该链构成整个 WHERE 条件或独占一对括号时改写，与 AND 相邻时保持原样
     */
    public static String collapseOrToIn(String sql) {
        return replaceAll(OR_CHAIN, sql, m -> {
            String before = sql.substring(0, m.start());
            String after = sql.substring(m.end());
            if (!CHAIN_OPENS.matcher(before).find() || !CHAIN_CLOSES.matcher(after).find()) {
                return m.group();
            }
            List<String> values = new ArrayList<>();
            Matcher literal = LITERAL.matcher(m.group());
            while (literal.find()) {
                values.add("'" + literal.group(1) + "'");
            }
            return m.group(1) + " IN (" + String.join(", ", values) + ")";
        });
    }

    private static String replaceAll(Pattern pattern, String input,
                                     Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacer.apply(matcher)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
