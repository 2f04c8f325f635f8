package com.tailtracker.cache.query;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * 静态查询规则
 *
 * @param pattern 命中条件（find 语义）
 * @param autoFix 自动改写，null 表示仅提示
 * @param impact  影响权重，评分扣减 impact × 0.1
 */
public record QueryOptimizationRule(
    String id,
    String name,
    String description,
    Pattern pattern,
    IssueSeverity severity,
    String suggestion,
    UnaryOperator<String> autoFix,
    double impact
) {

    public boolean matches(String sql) {
        return sql != null && pattern.matcher(sql).find();
    }

    public boolean hasAutoFix() {
        return autoFix != null;
    }
}
