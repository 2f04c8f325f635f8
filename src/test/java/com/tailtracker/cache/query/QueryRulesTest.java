package com.tailtracker.cache.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询规则表、归一化与索引建议单元测试
 */
class QueryRulesTest {

    @Test
    @DisplayName("规范查询没有问题，得分满分")
    void testCleanQuery() {
        QueryAnalysis analysis = QueryRules.analyze("SELECT name FROM pets WHERE id = ?");

        assertTrue(analysis.issues().isEmpty());
        assertEquals(10.0, analysis.optimizationScore(), 1e-9);
    }

    @Test
    @DisplayName("SELECT * 只命中一条规则")
    void testSelectStar() {
        QueryAnalysis analysis = QueryRules.analyze("SELECT * FROM pets");

        assertEquals(1, analysis.issues().size());
        assertTrue(analysis.hasIssue("select_star"));
        assertEquals(9.4, analysis.optimizationScore(), 1e-9);
    }

    @Test
    @DisplayName("无 WHERE 的 UPDATE/DELETE")
    void testMissingWhere() {
        assertTrue(QueryRules.analyze("DELETE FROM pets").hasIssue("missing_where"));
        assertTrue(QueryRules.analyze("update pets set name = 'x'").hasIssue("missing_where"));
        assertFalse(QueryRules.analyze("DELETE FROM pets WHERE id = 1").hasIssue("missing_where"));
        assertFalse(QueryRules.analyze("SELECT * FROM pets").hasIssue("missing_where"));
    }

    @Test
    @DisplayName("WHERE 中的函数与前置通配符")
    void testIndexDefeatingPredicates() {
        QueryAnalysis analysis = QueryRules.analyze("SELECT id FROM pets WHERE UPPER(name) LIKE '%REX'");

        assertTrue(analysis.hasIssue("function_in_where"));
        assertTrue(analysis.hasIssue("like_prefix"));
        assertFalse(QueryRules.analyze("SELECT id FROM pets WHERE id IN (1, 2)").hasIssue("function_in_where"));
        assertFalse(QueryRules.analyze("SELECT id FROM pets WHERE name LIKE 'Re%'").hasIssue("like_prefix"));
    }

    @Test
    @DisplayName("排序未限制条数")
    void testMissingLimit() {
        assertTrue(QueryRules.analyze("SELECT id FROM pets ORDER BY name").hasIssue("missing_limit"));
        assertFalse(QueryRules.analyze("SELECT id FROM pets ORDER BY name LIMIT 10").hasIssue("missing_limit"));
    }

    @Test
    @DisplayName("分析结果稳定")
    void testAnalysisIsDeterministic() {
        String sql = "SELECT * FROM pets p JOIN owners o ON p.owner_id = o.id WHERE p.status != 'lost' ORDER BY p.name";

        QueryAnalysis first = QueryRules.analyze(sql);
        QueryAnalysis second = QueryRules.analyze(sql);

        assertEquals(first.issues(), second.issues());
        assertEquals(first.optimizationScore(), second.optimizationScore());
        assertEquals(first.estimatedTime(), second.estimatedTime());
        assertEquals(50 + 100 + 60, first.estimatedTime(), 1e-9);
    }

    @Test
    @DisplayName("同列 OR 链合并为 IN")
    void testCollapseOrToIn() {
        String rewritten = QueryRules.collapseOrToIn(
            "SELECT id FROM pets WHERE species = 'dog' OR species = 'cat' OR species = 'bird'");

        assertEquals("SELECT id FROM pets WHERE species IN ('dog', 'cat', 'bird')", rewritten);
    }

    @Test
    @DisplayName("不同列的 OR 不改写")
    void testCollapseOrKeepsDifferentColumns() {
        String sql = "SELECT id FROM pets WHERE species = 'dog' OR color = 'black'";

        assertEquals(sql, QueryRules.collapseOrToIn(sql));
    }

    @Test
    @DisplayName("OR 链与 AND 相邻时保持原样")
    void testCollapseOrKeepsAndPrecedence() {
        String sql = "SELECT name FROM pets WHERE species = 'cat' OR species = 'dog' AND age > 3 OR name = 'rex'";

        assertEquals(sql, QueryRules.collapseOrToIn(sql));
        assertEquals("SELECT name FROM pets WHERE age > 3 AND species = 'cat' OR species = 'dog'",
            QueryRules.collapseOrToIn("SELECT name FROM pets WHERE age > 3 AND species = 'cat' OR species = 'dog'"));
    }

    @Test
    @DisplayName("括号内的 OR 链可以改写")
    void testCollapseOrInsideParentheses() {
        String rewritten = QueryRules.collapseOrToIn(
            "SELECT name FROM pets WHERE (species = 'cat' OR species = 'dog') AND age > 3 ORDER BY name");

        assertEquals("SELECT name FROM pets WHERE (species IN ('cat', 'dog')) AND age > 3 ORDER BY name", rewritten);
        assertEquals("SELECT id FROM pets WHERE species IN ('dog', 'cat') LIMIT 5",
            QueryRules.collapseOrToIn("SELECT id FROM pets WHERE species = 'dog' OR species = 'cat' LIMIT 5"));
    }

    @Test
    @DisplayName("归一化替换字面量")
    void testNormalize() {
        assertEquals("select * from pets where name = ? and age > ?",
            QueryNormalizer.normalize("SELECT *  FROM pets\n WHERE name = 'Rex 2' AND age > 3"));
        assertTrue(QueryNormalizer.isWriteStatement("  insert into pets values (1)"));
        assertFalse(QueryNormalizer.isCacheable("SELECT * FROM visits WHERE at > NOW()"));
    }

    @Test
    @DisplayName("按 WHERE 列生成索引建议")
    void testIndexSuggestions() {
        List<String> suggestions = IndexAdvisor.suggest(
            "select name from pets where owner_id = ? and species = ? order by name");

        assertEquals(List.of(
            "CREATE INDEX idx_pets_owner_id ON pets(owner_id)",
            "CREATE INDEX idx_pets_species ON pets(species)"), suggestions);
        assertTrue(IndexAdvisor.suggest("select 1").isEmpty());
    }

    @Test
    @DisplayName("慢模式额外扣分")
    void testPatternScoreWithSlowPenalty() {
        QueryPattern pattern = QueryPattern.create("select * from pets", true);
        pattern.recordExecution(1500, 0);

        assertEquals(5.4, DatabaseOptimizationService.calculateOptimizationScore(pattern, 1000), 1e-9);
        assertEquals(9.4, DatabaseOptimizationService.calculateOptimizationScore(pattern, 2000), 1e-9);
    }
}
