package com.tailtracker.cache.telemetry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.constant.CacheConstants;
import com.tailtracker.cache.service.JsonStateStore;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.MetricsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 缓存遥测与趋势预测服务
 *
 * 核心职责：
 * 1. 事件记录 - 有界事件环 + 实时指标（EMA 耗时、命中率）
 * 2. 周期监控 - 采集各缓存层统计、分析最近 5 分钟窗口、推进趋势分桶
 * 3. 阈值告警 - 同类型最多一条未确认告警
 * 4. 趋势预测 - 最近 5 个点的最小二乘外推
 * 5. 调优建议 - 基于当前指标的固定阈值规则
 */
@Slf4j
@Service
public class CacheAnalyticsService {

    private final CacheProperties.Telemetry config;
    private final JsonStateStore stateStore;
    private final TelemetrySnapshotSource snapshotSource;
    private final MetricsSink metricsSink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // ========== 状态（stateLock 保护） ==========
    private final ReentrantLock stateLock = new ReentrantLock();
    private final List<CacheEvent> events = new ArrayList<>();
    private final List<PerformanceAlert> alerts = new ArrayList<>();
    private final Map<TrendPeriod, CacheTrend> trends = new EnumMap<>(TrendPeriod.class);
    private CacheMetrics metrics = new CacheMetrics();
    private CacheProperties.AlertThresholds alertThresholds;
    private CacheMetrics recentWindowMetrics;
    private List<OptimizationRecommendation> windowRecommendations = List.of();

    // ========== 调度 ==========
    private final ScheduledExecutorService monitorExecutor;
    private ScheduledFuture<?> monitoringTask;
    private final AtomicLong tickCounter = new AtomicLong(0);
    private final AtomicLong eventSequence = new AtomicLong(0);
    private final AtomicLong alertSequence = new AtomicLong(0);

    // ========== 指标 ==========
    private final Map<CacheEventType, Counter> eventCounters = new EnumMap<>(CacheEventType.class);
    private final Counter alertCounter;
    private final Timer monitoringTimer;

    public CacheAnalyticsService(CacheProperties properties,
                                 JsonStateStore stateStore,
                                 TelemetrySnapshotSource snapshotSource,
                                 MetricsSink metricsSink,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.config = properties.getTelemetry();
        this.stateStore = stateStore;
        this.snapshotSource = snapshotSource;
        this.metricsSink = metricsSink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.alertThresholds = config.getAlertThresholds().copy();

        for (CacheEventType type : CacheEventType.values()) {
            eventCounters.put(type, Counter.builder("telemetry.events")
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        this.alertCounter = Counter.builder("telemetry.alerts.raised").register(meterRegistry);
        this.monitoringTimer = Timer.builder("telemetry.monitoring.latency").register(meterRegistry);

        this.monitorExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-telemetry-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 加载持久化数据并按配置启动监控
     */
    @PostConstruct
    public void initialize() {
        Gauge.builder("telemetry.hit.ratio", this, s -> s.getCurrentMetrics().getHitRatio())
            .register(meterRegistry);
        Gauge.builder("telemetry.alerts.active", this, s -> s.getActiveAlerts().size())
            .register(meterRegistry);
        Gauge.builder("telemetry.events.size", this, s -> s.eventCount())
            .register(meterRegistry);

        loadStoredData();

        if (config.isAutoStart()) {
            startMonitoring(config.getMonitoringIntervalMs());
        }
        log.info("CacheAnalyticsService initialized: maxEventsHistory={}, monitoringInterval={}ms",
            config.getMaxEventsHistory(), config.getMonitoringIntervalMs());
    }

    // ========== 事件记录 ==========

    public void recordEvent(CacheEventType type, String key, double duration, Long size,
                            CacheSource source, Map<String, Object> metadata) {
        long now = clock.millis();
        CacheEvent event = new CacheEvent(
            "evt_" + now + "_" + eventSequence.incrementAndGet(),
            now, type, key, duration, size, source,
            metadata != null ? Map.copyOf(metadata) : null);

        stateLock.lock();
        try {
            events.add(event);
            int max = config.getMaxEventsHistory();
            if (events.size() > max) {
                int retain = (int) Math.floor(max * CacheConstants.EVENT_RETAIN_RATIO);
                events.subList(0, events.size() - retain).clear();
            }
            updateMetricsFromEvent(event);
        } finally {
            stateLock.unlock();
        }
        eventCounters.get(type).increment();
        log.debug("Cache event recorded: type={}, key={}, duration={}ms, source={}", type, key, duration, source);
    }

    public void recordEvent(CacheEventType type, String key, double duration, CacheSource source) {
        recordEvent(type, key, duration, null, source, null);
    }

    // ========== 监控循环 ==========

    /**
     * 启动监控，已在运行时忽略
     */
    public void startMonitoring(long intervalMs) {
        stateLock.lock();
        try {
            if (monitoringTask != null && !monitoringTask.isDone()) {
                return;
            }
            monitoringTask = monitorExecutor.scheduleAtFixedRate(
                this::runMonitoringCycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } finally {
            stateLock.unlock();
        }
        log.info("Cache monitoring started: interval={}ms", intervalMs);
    }

    public void stopMonitoring() {
        stateLock.lock();
        try {
            if (monitoringTask != null) {
                monitoringTask.cancel(false);
                monitoringTask = null;
            }
        } finally {
            stateLock.unlock();
        }
        log.info("Cache monitoring stopped");
    }

    public boolean isMonitoring() {
        stateLock.lock();
        try {
            return monitoringTask != null && !monitoringTask.isDone();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 一次监控周期，任一步骤失败只记录日志
     */
    void runMonitoringCycle() {
        monitoringTimer.record(() -> {
            runStep("collect metrics", this::collectMetrics);
            runStep("analyze performance", this::analyzePerformance);
            runStep("update trends", this::updateTrends);
            if (config.isEnableRealTimeAlerts()) {
                runStep("check alerts", this::checkAlerts);
            }
            long tick = tickCounter.incrementAndGet();
            int persistEvery = Math.max(1, config.getPersistEveryTicks());
            if (tick % persistEvery == 0) {
                runStep("persist analytics", this::persistData);
            }
        });
    }

    // ========== 告警 ==========

    /**
     * 按当前阈值评估指标，返回新产生的告警
     * 已存在同类型未确认告警时不重复产生
     */
    public List<PerformanceAlert> evaluateAlerts(CacheMetrics snapshot) {
        List<PerformanceAlert> candidates = buildAlerts(snapshot, currentThresholds());
        List<PerformanceAlert> raised = new ArrayList<>();
        stateLock.lock();
        try {
            for (PerformanceAlert alert : candidates) {
                boolean exists = alerts.stream()
                    .anyMatch(existing -> existing.getType() == alert.getType() && !existing.isAcknowledged());
                if (!exists) {
                    alerts.add(alert);
                    raised.add(alert.copy());
                }
            }
            trimAlertHistory();
        } finally {
            stateLock.unlock();
        }
        for (PerformanceAlert alert : raised) {
            alertCounter.increment();
            log.warn("Cache performance alert: type={}, severity={}, message={}",
                alert.getType().code(), alert.getSeverity(), alert.getMessage());
        }
        return raised;
    }

    public List<PerformanceAlert> getActiveAlerts() {
        stateLock.lock();
        try {
            return alerts.stream()
                .filter(alert -> !alert.isAcknowledged())
                .map(PerformanceAlert::copy)
                .toList();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return 告警是否存在
     */
    public boolean acknowledgeAlert(String alertId) {
        boolean found = false;
        stateLock.lock();
        try {
            for (PerformanceAlert alert : alerts) {
                if (alert.getId().equals(alertId)) {
                    alert.setAcknowledged(true);
                    found = true;
                    break;
                }
            }
        } finally {
            stateLock.unlock();
        }
        if (found) {
            persistAlerts();
        }
        return found;
    }

    public void updateAlertThresholds(Map<String, Double> newThresholds) {
        stateLock.lock();
        try {
            CacheProperties.AlertThresholds updated = alertThresholds.copy();
            newThresholds.forEach((name, value) -> {
                switch (name) {
                    case "hitRatio" -> updated.setHitRatio(value);
                    case "memoryUtilization" -> updated.setMemoryUtilization(value);
                    case "averageResponseTime" -> updated.setAverageResponseTime(value);
                    case "evictionRate" -> updated.setEvictionRate(value);
                    case "errorRate" -> updated.setErrorRate(value);
                    case "networkLatency" -> updated.setNetworkLatency(value);
                    default -> log.warn("Unknown alert threshold ignored: {}", name);
                }
            });
            alertThresholds = updated;
        } finally {
            stateLock.unlock();
        }
        persistConfiguration();
        log.info("Alert thresholds updated: {}", newThresholds);
    }

    public CacheProperties.AlertThresholds getAlertThresholds() {
        return currentThresholds();
    }

    // ========== 查询 ==========

    public CacheMetrics getCurrentMetrics() {
        stateLock.lock();
        try {
            return metrics.copy();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 立即从各缓存层采集一次并返回最新指标
     */
    public CacheMetrics refreshMetrics() {
        runStep("collect metrics", this::collectMetrics);
        return getCurrentMetrics();
    }

    /**
     * 最近 count 条事件（按时间升序）
     */
    public List<CacheEvent> getRecentEvents(int count) {
        stateLock.lock();
        try {
            int from = Math.max(0, events.size() - Math.max(count, 0));
            return List.copyOf(events.subList(from, events.size()));
        } finally {
            stateLock.unlock();
        }
    }

    public CacheTrend getTrend(TrendPeriod period) {
        stateLock.lock();
        try {
            CacheTrend trend = trends.get(period);
            return trend != null ? trend.copy() : null;
        } finally {
            stateLock.unlock();
        }
    }

    public Map<TrendPeriod, CacheTrend> getTrends() {
        stateLock.lock();
        try {
            Map<TrendPeriod, CacheTrend> copy = new EnumMap<>(TrendPeriod.class);
            trends.forEach((period, trend) -> copy.put(period, trend.copy()));
            return copy;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 最近一次监控分析得到的 5 分钟窗口指标，尚未分析时为 null
     */
    public CacheMetrics getRecentWindowMetrics() {
        stateLock.lock();
        try {
            return recentWindowMetrics != null ? recentWindowMetrics.copy() : null;
        } finally {
            stateLock.unlock();
        }
    }

    public List<OptimizationRecommendation> getWindowRecommendations() {
        return windowRecommendations;
    }

    public List<OptimizationRecommendation> getOptimizationRecommendations() {
        return generateOptimizationRecommendations(getCurrentMetrics());
    }

    public List<String> getPerformanceInsights() {
        return generatePerformanceInsights(getCurrentMetrics());
    }

    public AnalyticsReport getAnalyticsReport() {
        CacheMetrics snapshot = getCurrentMetrics();
        return new AnalyticsReport(
            snapshot,
            generatePerformanceInsights(snapshot),
            getActiveAlerts(),
            generateOptimizationRecommendations(snapshot),
            EfficiencyScores.of(snapshot));
    }

    // ========== 调优建议 ==========

    /**
     * 根据指标生成调优建议，按影响分降序
     */
    public static List<OptimizationRecommendation> generateOptimizationRecommendations(CacheMetrics m) {
        List<OptimizationRecommendation> recommendations = new ArrayList<>();
        if (m.getEvictionRate() > 0.1) {
            recommendations.add(new OptimizationRecommendation(
                "rec_cache_size", RecommendationType.CACHE_SIZE, CachePriority.HIGH,
                "High eviction rate indicates insufficient cache size",
                "Reduce evictions by 50-70%, improve hit ratio by 10-20%",
                "Increase the memory tier maximum size",
                8.5));
        }
        if (m.getCompressionRatio() > 0.8 && m.getDiskUsage() > 100L * 1024 * 1024) {
            recommendations.add(new OptimizationRecommendation(
                "rec_compression", RecommendationType.COMPRESSION, CachePriority.MEDIUM,
                "Low compression ratio with high disk usage",
                "Reduce storage usage by 20-40%",
                "Enable aggressive compression for large assets",
                6.5));
        }
        if (m.getPrefetchAccuracy() < 0.6) {
            recommendations.add(new OptimizationRecommendation(
                "rec_prefetch", RecommendationType.PREFETCH_STRATEGY, CachePriority.MEDIUM,
                "Low prefetch accuracy indicates suboptimal prediction",
                "Improve cache hit ratio by 15-25%",
                "Refine access patterns and prediction thresholds",
                7.0));
        }
        double hitMissRatio = m.getAverageHitTime() / Math.max(m.getAverageMissTime(), 1);
        if (hitMissRatio > 0.8) {
            recommendations.add(new OptimizationRecommendation(
                "rec_ttl", RecommendationType.TTL_ADJUSTMENT, CachePriority.LOW,
                "Hit times are relatively high compared to miss times",
                "Reduce hit times by 10-15%",
                "Decrease TTL for frequently accessed items",
                4.5));
        }
        recommendations.sort(Comparator.comparingDouble(OptimizationRecommendation::impactScore).reversed());
        return recommendations;
    }

    static List<String> generatePerformanceInsights(CacheMetrics m) {
        List<String> insights = new ArrayList<>();
        if (m.getHitRatio() < 0.5) {
            insights.add("Low cache hit ratio detected. Consider increasing cache size or improving prefetch strategy.");
        } else if (m.getHitRatio() > 0.9) {
            insights.add("Excellent cache hit ratio. Current strategy is performing very well.");
        }
        if (m.getTotalResponseTime() > 500) {
            insights.add("High response times detected. Consider optimizing cache lookup or network performance.");
        }
        if (m.getMemoryUtilization() > 0.9) {
            insights.add("High memory utilization. Consider implementing more aggressive eviction policies.");
        }
        double networkEfficiency = (double) m.getNetworkSavings() / Math.max(m.getBytesDownloaded(), 1);
        if (networkEfficiency < 0.3) {
            insights.add("Low network efficiency. Consider enabling compression and optimizing asset sizes.");
        }
        return insights;
    }

    // ========== 数据管理 ==========

    public AnalyticsExport exportAnalyticsData() {
        stateLock.lock();
        try {
            Map<TrendPeriod, CacheTrend> trendCopy = new EnumMap<>(TrendPeriod.class);
            trends.forEach((period, trend) -> trendCopy.put(period, trend.copy()));
            return new AnalyticsExport(
                metrics.copy(),
                List.copyOf(events),
                alerts.stream().map(PerformanceAlert::copy).toList(),
                trendCopy);
        } finally {
            stateLock.unlock();
        }
    }

    public void clearAnalyticsData() {
        stateLock.lock();
        try {
            metrics = new CacheMetrics();
            events.clear();
            alerts.clear();
            trends.clear();
            recentWindowMetrics = null;
            windowRecommendations = List.of();
        } finally {
            stateLock.unlock();
        }
        persistData();
        log.info("Cache analytics data cleared");
    }

    @PreDestroy
    public void shutdown() {
        stopMonitoring();
        monitorExecutor.shutdownNow();
        persistData();
        log.info("CacheAnalyticsService shutdown");
    }

    // ========== 私有方法 ==========

    private void updateMetricsFromEvent(CacheEvent event) {
        if (event.type().countsAsRequest()) {
            metrics.setTotalRequests(metrics.getTotalRequests() + 1);
        }
        switch (event.type()) {
            case HIT -> {
                metrics.setCacheHits(metrics.getCacheHits() + 1);
                metrics.setAverageHitTime(ema(metrics.getAverageHitTime(), event.duration()));
                if (event.size() != null) {
                    metrics.setBytesServedFromCache(metrics.getBytesServedFromCache() + event.size());
                }
                updateResponseTime();
            }
            case MISS -> {
                metrics.setCacheMisses(metrics.getCacheMisses() + 1);
                metrics.setAverageMissTime(ema(metrics.getAverageMissTime(), event.duration()));
                if (event.size() != null) {
                    metrics.setBytesDownloaded(metrics.getBytesDownloaded() + event.size());
                }
                updateResponseTime();
            }
            case ERROR -> metrics.setErrorCount(metrics.getErrorCount() + 1);
            default -> {
                // eviction / prefetch 由监控采集汇总
            }
        }
        metrics.recomputeHitRatio();
    }

    private static double ema(double current, double sample) {
        return current * (1 - CacheConstants.EMA_ALPHA) + sample * CacheConstants.EMA_ALPHA;
    }

    private void updateResponseTime() {
        metrics.setTotalResponseTime(
            (metrics.getAverageHitTime() * metrics.getCacheHits()
                + metrics.getAverageMissTime() * metrics.getCacheMisses())
                / Math.max(metrics.getTotalRequests(), 1));
    }

    private void collectMetrics() {
        TelemetrySnapshot snapshot = snapshotSource.collect();
        CacheMetrics current;
        stateLock.lock();
        try {
            applySnapshot(snapshot);
            current = metrics.copy();
        } finally {
            stateLock.unlock();
        }
        recordPerformanceSnapshot(current);
    }

    /**
     * 合并各层统计，命中/未命中计数以事件为准不被覆盖
     */
    private void applySnapshot(TelemetrySnapshot snapshot) {
        var tier = snapshot.tierStatistics();
        var asset = snapshot.assetMetrics();
        var image = snapshot.imageStats();

        metrics.setMemoryUsage(tier.memoryUsage());
        metrics.setMemoryUtilization(tier.usagePercentage() / 100);
        metrics.setDiskUsage(tier.diskUsage() + image.totalOptimizedSize());
        metrics.setMemoryFragmentation(snapshot.memoryFragmentation());
        metrics.setNetworkSavings(asset.compressionSavings()
            + Math.max(0, image.totalOriginalSize() - image.totalOptimizedSize()));
        metrics.setEvictionRate((double) tier.evictionCount() / Math.max(metrics.getTotalRequests(), 1));
        metrics.setPrefetchAccuracy(snapshot.totalPredictions() > 0
            ? (double) snapshot.successfulPredictions() / snapshot.totalPredictions()
            : 0);
        metrics.setCompressionRatio(image.averageCompressionRatio());
    }

    private void recordPerformanceSnapshot(CacheMetrics current) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("hitRatio", current.getHitRatio());
        metadata.put("memoryUtilization", current.getMemoryUtilization());
        metadata.put("responseTime", current.getTotalResponseTime());
        metadata.put("networkSavings", current.getNetworkSavings());
        metricsSink.recordMetric("cache_performance_snapshot", current.getHitRatio() * 100,
            clock.millis(), "cache", metadata);
    }

    private void analyzePerformance() {
        long cutoff = clock.millis() - CacheConstants.ANALYSIS_WINDOW_MS;
        List<CacheEvent> window;
        stateLock.lock();
        try {
            window = events.stream().filter(e -> e.timestamp() >= cutoff).toList();
        } finally {
            stateLock.unlock();
        }
        if (window.isEmpty()) {
            return;
        }
        CacheMetrics windowMetrics = calculateMetricsFromEvents(window);
        List<OptimizationRecommendation> recommendations = generateOptimizationRecommendations(windowMetrics);
        stateLock.lock();
        try {
            recentWindowMetrics = windowMetrics;
            windowRecommendations = List.copyOf(recommendations);
        } finally {
            stateLock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Window analysis: events={}, hitRatio={}, insights={}",
                window.size(), windowMetrics.getHitRatio(), generatePerformanceInsights(windowMetrics));
        }
    }

    /**
     * 窗口内指标使用算术平均而非 EMA
     */
    static CacheMetrics calculateMetricsFromEvents(List<CacheEvent> window) {
        CacheMetrics result = new CacheMetrics();
        double hitTimeSum = 0;
        double missTimeSum = 0;
        for (CacheEvent event : window) {
            if (event.type().countsAsRequest()) {
                result.setTotalRequests(result.getTotalRequests() + 1);
            }
            switch (event.type()) {
                case HIT -> {
                    result.setCacheHits(result.getCacheHits() + 1);
                    hitTimeSum += event.duration();
                    if (event.size() != null) {
                        result.setBytesServedFromCache(result.getBytesServedFromCache() + event.size());
                    }
                }
                case MISS -> {
                    result.setCacheMisses(result.getCacheMisses() + 1);
                    missTimeSum += event.duration();
                    if (event.size() != null) {
                        result.setBytesDownloaded(result.getBytesDownloaded() + event.size());
                    }
                }
                case ERROR -> result.setErrorCount(result.getErrorCount() + 1);
                default -> {
                }
            }
        }
        if (result.getCacheHits() > 0) {
            result.setAverageHitTime(hitTimeSum / result.getCacheHits());
        }
        if (result.getCacheMisses() > 0) {
            result.setAverageMissTime(missTimeSum / result.getCacheMisses());
        }
        result.recomputeHitRatio();
        result.setTotalResponseTime((hitTimeSum + missTimeSum) / Math.max(result.getTotalRequests(), 1));
        return result;
    }

    private void updateTrends() {
        long now = clock.millis();
        stateLock.lock();
        try {
            for (TrendPeriod period : TrendPeriod.values()) {
                CacheTrend trend = trends.computeIfAbsent(period, CacheTrend::new);
                long bucket = period.bucketOf(now);
                Long last = trend.lastTimestamp();
                if (last == null || bucket > last) {
                    trend.append(bucket, metrics.copy());
                    trend.setPredictions(TrendForecaster.predict(trend.getMetrics()));
                }
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void checkAlerts() {
        evaluateAlerts(getCurrentMetrics());
        persistAlerts();
    }

    private List<PerformanceAlert> buildAlerts(CacheMetrics m, CacheProperties.AlertThresholds t) {
        List<PerformanceAlert> candidates = new ArrayList<>();
        if (m.getHitRatio() < t.getHitRatio()) {
            candidates.add(newAlert(AlertType.HIGH_MISS_RATE,
                m.getHitRatio() < 0.5 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                String.format(Locale.ROOT, "Cache hit ratio is %.1f%%, below threshold of %.1f%%",
                    m.getHitRatio() * 100, t.getHitRatio() * 100),
                Map.of("hitRatio", m.getHitRatio()),
                List.of("Increase cache size", "Improve prefetch strategy", "Analyze cache keys for patterns")));
        }
        if (m.getMemoryUtilization() > t.getMemoryUtilization()) {
            candidates.add(newAlert(AlertType.MEMORY_PRESSURE,
                m.getMemoryUtilization() > 0.95 ? AlertSeverity.CRITICAL : AlertSeverity.HIGH,
                String.format(Locale.ROOT, "Memory utilization is %.1f%%, exceeding threshold",
                    m.getMemoryUtilization() * 100),
                Map.of("memoryUtilization", m.getMemoryUtilization()),
                List.of("Implement more aggressive eviction", "Increase memory allocation", "Enable compression")));
        }
        if (m.getTotalResponseTime() > t.getAverageResponseTime()) {
            candidates.add(newAlert(AlertType.PERFORMANCE_DEGRADATION,
                m.getTotalResponseTime() > 1000 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                String.format(Locale.ROOT, "Average response time is %.0fms, exceeding threshold",
                    m.getTotalResponseTime()),
                Map.of("responseTime", m.getTotalResponseTime()),
                List.of("Optimize cache lookup performance", "Check network connectivity",
                    "Review database query performance")));
        }
        if (m.getEvictionRate() > t.getEvictionRate()) {
            candidates.add(newAlert(AlertType.HIGH_EVICTION_RATE,
                m.getEvictionRate() > 0.2 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                String.format(Locale.ROOT, "Eviction rate is %.1f%%, exceeding threshold",
                    m.getEvictionRate() * 100),
                Map.of("evictionRate", m.getEvictionRate()),
                List.of("Increase cache size", "Review TTL settings")));
        }
        if (m.getErrorRate() > t.getErrorRate()) {
            candidates.add(newAlert(AlertType.HIGH_ERROR_RATE,
                m.getErrorRate() > 0.1 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                String.format(Locale.ROOT, "Error rate is %.1f%%, exceeding threshold", m.getErrorRate() * 100),
                Map.of("errorRate", m.getErrorRate()),
                List.of("Inspect failing cache keys", "Check tier collaborator health")));
        }
        if (m.getAverageMissTime() > t.getNetworkLatency()) {
            candidates.add(newAlert(AlertType.NETWORK_ISSUES, AlertSeverity.MEDIUM,
                String.format(Locale.ROOT, "Average miss time is %.0fms, network may be degraded",
                    m.getAverageMissTime()),
                Map.of("averageMissTime", m.getAverageMissTime()),
                List.of("Check network connectivity", "Increase prefetching on fast networks")));
        }
        return candidates;
    }

    private PerformanceAlert newAlert(AlertType type, AlertSeverity severity, String message,
                                      Map<String, Double> values, List<String> actions) {
        long now = clock.millis();
        return new PerformanceAlert(
            "alert_" + type.code() + "_" + now + "_" + alertSequence.incrementAndGet(),
            type, severity, message, values, now, false, new ArrayList<>(actions));
    }

    /**
     * 告警历史超过上限时优先丢弃最旧的已确认告警
     */
    private void trimAlertHistory() {
        while (alerts.size() > CacheConstants.MAX_ALERT_HISTORY) {
            int index = -1;
            for (int i = 0; i < alerts.size(); i++) {
                if (alerts.get(i).isAcknowledged()) {
                    index = i;
                    break;
                }
            }
            alerts.remove(index >= 0 ? index : 0);
        }
    }

    private CacheProperties.AlertThresholds currentThresholds() {
        stateLock.lock();
        try {
            return alertThresholds.copy();
        } finally {
            stateLock.unlock();
        }
    }

    private int eventCount() {
        stateLock.lock();
        try {
            return events.size();
        } finally {
            stateLock.unlock();
        }
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (Exception e) {
            log.error("Monitoring step failed: {}", name, e);
        }
    }

    // ========== 持久化 ==========

    private void loadStoredData() {
        stateStore.load(CacheConstants.ANALYTICS_METRICS_KEY, CacheMetrics.class)
            .ifPresent(stored -> {
                stored.recomputeHitRatio();
                withLock(() -> metrics = stored);
            });
        stateStore.load(CacheConstants.ANALYTICS_EVENTS_KEY, new TypeReference<List<CacheEvent>>() {})
            .ifPresent(stored -> withLock(() -> {
                events.clear();
                int from = Math.max(0, stored.size() - config.getMaxEventsHistory());
                events.addAll(stored.subList(from, stored.size()));
            }));
        stateStore.load(CacheConstants.ANALYTICS_ALERTS_KEY, new TypeReference<List<PerformanceAlert>>() {})
            .ifPresent(stored -> withLock(() -> {
                alerts.clear();
                alerts.addAll(stored);
                trimAlertHistory();
            }));
        stateStore.load(CacheConstants.ANALYTICS_TRENDS_KEY, new TypeReference<Map<TrendPeriod, CacheTrend>>() {})
            .ifPresent(stored -> withLock(() -> {
                trends.clear();
                trends.putAll(stored);
            }));
        stateStore.load(CacheConstants.ANALYTICS_CONFIG_KEY, StoredConfig.class)
            .map(StoredConfig::alertThresholds)
            .ifPresent(stored -> withLock(() -> alertThresholds = stored));
    }

    private void persistData() {
        AnalyticsExport snapshot = exportAnalyticsData();
        stateStore.save(CacheConstants.ANALYTICS_METRICS_KEY, snapshot.metrics());
        stateStore.save(CacheConstants.ANALYTICS_EVENTS_KEY, snapshot.events());
        stateStore.save(CacheConstants.ANALYTICS_ALERTS_KEY, snapshot.alerts());
        stateStore.save(CacheConstants.ANALYTICS_TRENDS_KEY, snapshot.trends());
        persistConfiguration();
    }

    private void persistAlerts() {
        List<PerformanceAlert> snapshot;
        stateLock.lock();
        try {
            snapshot = alerts.stream().map(PerformanceAlert::copy).toList();
        } finally {
            stateLock.unlock();
        }
        stateStore.save(CacheConstants.ANALYTICS_ALERTS_KEY, snapshot);
    }

    private void persistConfiguration() {
        Map<String, Object> stored = new HashMap<>();
        stored.put("alertThresholds", currentThresholds());
        stateStore.save(CacheConstants.ANALYTICS_CONFIG_KEY, stored);
    }

    private void withLock(Runnable action) {
        stateLock.lock();
        try {
            action.run();
        } finally {
            stateLock.unlock();
        }
    }

    record StoredConfig(CacheProperties.AlertThresholds alertThresholds) {
    }
}
