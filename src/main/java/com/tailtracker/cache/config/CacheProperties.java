package com.tailtracker.cache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 缓存引擎配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "adaptive-cache")
public class CacheProperties {

    /** 遥测与趋势预测配置 */
    private Telemetry telemetry = new Telemetry();

    /** 模式预测器配置 */
    private Predictor predictor = new Predictor();

    /** 查询优化顾问配置 */
    private Query query = new Query();

    /** 编排器配置 */
    private Orchestrator orchestrator = new Orchestrator();

    /** 内存缓存层配置 */
    private MemoryTier memoryTier = new MemoryTier();

    @Data
    public static class Telemetry {
        /** 是否随应用启动监控循环 */
        private boolean autoStart = true;
        /** 监控间隔（毫秒） */
        private long monitoringIntervalMs = 10_000;
        /** 事件环容量 */
        private int maxEventsHistory = 1000;
        /** 每隔多少次监控持久化一次 */
        private int persistEveryTicks = 6;
        /** 是否生成实时告警 */
        private boolean enableRealTimeAlerts = true;
        /** 告警阈值 */
        private AlertThresholds alertThresholds = new AlertThresholds();
    }

    @Data
    public static class AlertThresholds {
        /** 命中率下限 */
        private double hitRatio = 0.7;
        /** 内存使用率上限 */
        private double memoryUtilization = 0.85;
        /** 平均响应时间上限（毫秒） */
        private double averageResponseTime = 500;
        /** 驱逐率上限 */
        private double evictionRate = 0.1;
        /** 错误率上限 */
        private double errorRate = 0.05;
        /** 网络延迟上限（毫秒），与平均未命中耗时比较 */
        private double networkLatency = 1000;

        public AlertThresholds copy() {
            AlertThresholds copy = new AlertThresholds();
            copy.setHitRatio(hitRatio);
            copy.setMemoryUtilization(memoryUtilization);
            copy.setAverageResponseTime(averageResponseTime);
            copy.setEvictionRate(evictionRate);
            copy.setErrorRate(errorRate);
            copy.setNetworkLatency(networkLatency);
            return copy;
        }
    }

    @Data
    public static class Predictor {
        /** 是否启用预测 */
        private boolean enabled = true;
        /** 是否随应用启动后台循环 */
        private boolean autoStart = true;
        /** 模式容量上限，超出时淘汰最久未使用的模式 */
        private int maxPatterns = 500;
        /** 最低置信度 */
        private double minConfidence = 0.3;
        /** 最低上下文相似度 */
        private double minContextSimilarity = 0.3;
        /** 模式保留天数 */
        private int patternRetentionDays = 30;
        /** wifi 下预测数量上限 */
        private int maxPredictionsWifi = 10;
        /** 蜂窝网络下预测数量上限 */
        private int maxPredictionsCellular = 3;
        /** 其他网络下预测数量上限 */
        private int maxPredictionsDefault = 5;
        /** 低电量时预测数量上限 */
        private int maxPredictionsLowBattery = 2;
        /** 自调优间隔（毫秒） */
        private long optimizationIntervalMs = 15 * 60 * 1000L;
        /** 后台加载错峰间隔（毫秒） */
        private long backgroundStaggerMs = 1000;
        /** 抢先加载节流间隔（毫秒） */
        private long preemptivePacingMs = 500;
        /** 抢先队列检查间隔（毫秒） */
        private long preemptiveCheckIntervalMs = 30_000;
        /** 每记录多少次用户行为持久化一次模式 */
        private int persistEveryActions = 20;
    }

    @Data
    public static class Query {
        private boolean enableCaching = true;
        private boolean enableBatching = true;
        private boolean enableRewriting = true;
        /** 查询结果缓存条目上限 */
        private int maxCacheSize = 1000;
        /** 查询结果缓存过期时间（毫秒） */
        private long cacheTtlMs = 5 * 60 * 1000L;
        /** 慢查询阈值（毫秒） */
        private long slowQueryThresholdMs = 1000;
        /** 可缓存结果集上限 */
        private int maxResultSetSize = 10_000;
        /** 批量执行大小 */
        private int batchSize = 10;
        /** 批量防抖时间（毫秒） */
        private long batchDebounceMs = 100;
        /** 查询模式容量上限 */
        private int maxPatterns = 1000;
        /** 每执行多少次查询持久化一次 */
        private int persistEveryExecutions = 10;
        /** 周期优化间隔（毫秒） */
        private long optimizationIntervalMs = 5 * 60 * 1000L;
        /** 是否随应用启动周期优化 */
        private boolean autoStart = true;

        public Query copy() {
            Query copy = new Query();
            copy.setEnableCaching(enableCaching);
            copy.setEnableBatching(enableBatching);
            copy.setEnableRewriting(enableRewriting);
            copy.setMaxCacheSize(maxCacheSize);
            copy.setCacheTtlMs(cacheTtlMs);
            copy.setSlowQueryThresholdMs(slowQueryThresholdMs);
            copy.setMaxResultSetSize(maxResultSetSize);
            copy.setBatchSize(batchSize);
            copy.setBatchDebounceMs(batchDebounceMs);
            copy.setMaxPatterns(maxPatterns);
            copy.setPersistEveryExecutions(persistEveryExecutions);
            copy.setOptimizationIntervalMs(optimizationIntervalMs);
            copy.setAutoStart(autoStart);
            return copy;
        }
    }

    @Data
    public static class Orchestrator {
        /** 是否随应用启动健康检查循环 */
        private boolean autoStart = true;
        /** 健康检查间隔（毫秒） */
        private long healthCheckIntervalMs = 60_000;
        /** 每隔多少次健康检查刷新基线 */
        private int baselineRefreshEveryTicks = 10;
        /** 触发自动优化的退化阈值 */
        private double degradationThreshold = 0.2;
        /** 碎片率超过该值时整理内存池 */
        private double fragmentationThreshold = 0.3;
        /** 回填时默认 TTL（毫秒） */
        private long defaultTtlMs = 60 * 60 * 1000L;
    }

    @Data
    public static class MemoryTier {
        /** 最大容量（字节） */
        private long maxSizeBytes = 64L * 1024 * 1024;
        /** 默认过期时间（毫秒） */
        private long defaultTtlMs = 60 * 60 * 1000L;
        /** 初始容量 */
        private int initialCapacity = 256;
        /** 是否开启压缩标记 */
        private boolean compressionEnabled = false;
        /** 是否开启统计 */
        private boolean recordStats = true;
    }
}
