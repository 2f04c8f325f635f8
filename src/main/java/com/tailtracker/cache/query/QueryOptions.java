package com.tailtracker.cache.query;

/**
 * 单次查询选项
 *
 * @param cacheTtlMs  null 表示使用全局配置
 * @param maxResults  0 表示不截断
 */
public record QueryOptions(boolean useCache, Long cacheTtlMs, boolean enableOptimization, int maxResults) {

    private static final QueryOptions DEFAULTS = new QueryOptions(true, null, true, 0);

    public static QueryOptions defaults() {
        return DEFAULTS;
    }

    public static QueryOptions noCache() {
        return new QueryOptions(false, null, true, 0);
    }

    public QueryOptions withCacheTtl(long ttlMs) {
        return new QueryOptions(useCache, ttlMs, enableOptimization, maxResults);
    }

    public QueryOptions withMaxResults(int max) {
        return new QueryOptions(useCache, cacheTtlMs, enableOptimization, max);
    }
}
