package com.tailtracker.cache.constant;

/**
 * 缓存引擎常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== 持久化 Key ====================

    public static final String ANALYTICS_METRICS_KEY = "cache_analytics_metrics";
    public static final String ANALYTICS_EVENTS_KEY = "cache_analytics_events";
    public static final String ANALYTICS_ALERTS_KEY = "cache_analytics_alerts";
    public static final String ANALYTICS_TRENDS_KEY = "cache_analytics_trends";
    public static final String ANALYTICS_CONFIG_KEY = "cache_analytics_config";

    public static final String PREDICTIVE_PATTERNS_KEY = "predictive_patterns";
    public static final String PREDICTIVE_METRICS_KEY = "predictive_metrics";

    public static final String DB_PATTERNS_KEY = "db_optimization_patterns";
    public static final String DB_INDEXES_KEY = "db_optimization_indexes";
    public static final String DB_CONFIG_KEY = "db_optimization_config";
    public static final String DB_METRICS_KEY = "db_optimization_metrics";

    // ==================== 缓存 Key 前缀 ====================

    /** 查询结果缓存前缀 */
    public static final String QUERY_RESULT_PREFIX = "db_query_";

    /** 预测预取数据前缀 */
    public static final String PREFETCH_PREFIX = "prefetch:";

    /** 查询类 Key 前缀（编排器据此路由到查询顾问） */
    public static final String QUERY_KEY_PREFIX = "query:";

    /** 资源类 Key 前缀 */
    public static final String ASSET_KEY_PREFIX = "asset:";

    /** 图片类 Key 前缀 */
    public static final String IMAGE_KEY_PREFIX = "image:";

    // ==================== 统计常量 ====================

    /** 平均响应时间 EMA 系数 */
    public static final double EMA_ALPHA = 0.1;

    /** 事件环溢出后保留比例 */
    public static final double EVENT_RETAIN_RATIO = 0.8;

    /** 趋势预测使用的最近点数 */
    public static final int FORECAST_WINDOW = 5;

    /** 趋势预测步数 */
    public static final int FORECAST_STEPS = 3;

    /** 分析窗口（毫秒） */
    public static final long ANALYSIS_WINDOW_MS = 5 * 60 * 1000L;

    public static final long ONE_HOUR_MS = 60 * 60 * 1000L;
    public static final long ONE_DAY_MS = 24 * ONE_HOUR_MS;

    /** 单条查询保留的执行记录数 */
    public static final int MAX_EXECUTIONS_PER_QUERY = 100;

    /** 持久化时每条查询保留的执行记录数 */
    public static final int PERSISTED_EXECUTIONS_PER_QUERY = 10;

    /** 索引建议保留数量 */
    public static final int MAX_INDEX_SUGGESTIONS = 20;

    /** 告警历史上限 */
    public static final int MAX_ALERT_HISTORY = 100;
}
