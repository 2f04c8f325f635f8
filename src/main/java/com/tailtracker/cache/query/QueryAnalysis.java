package com.tailtracker.cache.query;

import java.util.List;

/**
 * 静态分析结果
 *
 * @param optimizationScore 0-10，10 表示无问题
 * @param estimatedTime     估算耗时（毫秒）
 */
public record QueryAnalysis(
    List<QueryIssue> issues,
    double optimizationScore,
    double estimatedTime,
    List<String> indexSuggestions
) {

    public QueryAnalysis {
        issues = issues == null ? List.of() : List.copyOf(issues);
        indexSuggestions = indexSuggestions == null ? List.of() : List.copyOf(indexSuggestions);
    }

    public boolean hasIssue(String ruleId) {
        return issues.stream().anyMatch(issue -> issue.ruleId().equals(ruleId));
    }
}
