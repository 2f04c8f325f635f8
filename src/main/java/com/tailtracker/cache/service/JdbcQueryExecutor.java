package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.QueryExecutor;
import com.tailtracker.cache.spi.QueryResult;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Locale;

/**
 * 基于 JdbcTemplate 的查询执行
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private final JdbcTemplate jdbcTemplate;

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public QueryResult execute(String sql, List<Object> params) {
        Object[] args = params != null ? params.toArray() : new Object[0];
        String head = sql.stripLeading().toLowerCase(Locale.ROOT);
        if (head.startsWith("select") || head.startsWith("with")) {
            return QueryResult.ofRows(jdbcTemplate.queryForList(sql, args));
        }
        return QueryResult.ofAffected(jdbcTemplate.update(sql, args));
    }
}
