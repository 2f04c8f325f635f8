package com.tailtracker.cache.query;

/**
 * 单条规则命中
 */
public record QueryIssue(String ruleId, String rule, IssueSeverity severity, String suggestion) {

    static QueryIssue of(QueryOptimizationRule rule) {
        return new QueryIssue(rule.id(), rule.name(), rule.severity(), rule.suggestion());
    }
}
