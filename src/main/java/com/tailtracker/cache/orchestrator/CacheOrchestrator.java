package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.constant.CacheConstants;
import com.tailtracker.cache.prediction.LoadingContext;
import com.tailtracker.cache.prediction.PredictionResult;
import com.tailtracker.cache.prediction.PredictiveLoadingService;
import com.tailtracker.cache.prediction.PredictorMetrics;
import com.tailtracker.cache.query.DatabaseOptimizationService;
import com.tailtracker.cache.spi.AssetFetcher;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.ImagePipeline;
import com.tailtracker.cache.spi.ImageStats;
import com.tailtracker.cache.spi.MemoryPoolManager;
import com.tailtracker.cache.spi.MemoryPoolStats;
import com.tailtracker.cache.spi.QueryResult;
import com.tailtracker.cache.spi.TierSettings;
import com.tailtracker.cache.telemetry.CacheAnalyticsService;
import com.tailtracker.cache.telemetry.CacheEventType;
import com.tailtracker.cache.telemetry.CacheMetrics;
import com.tailtracker.cache.telemetry.CacheSource;
import com.tailtracker.cache.telemetry.OptimizationRecommendation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import java.util.function.IntSupplier;

/**
 * 缓存编排门面
 *
 * 核心职责：
 * 1. 分层读取 - 内存 → 预测预取 → CDN 资源 → 查询顾问 → 回源
 * 2. 写入分发 - 缓存层写入，按 Key 形态触发资源登记或图片分析，喂给预测器
 * 3. 预取与导航学习
 * 4. 协同调优 - 内存池整理、缓存层参数调整、图片质量调整
 * 5. 健康检查 - 相对基线的退化评分，超阈值时自动调优
 *
 * get / set 不向调用方抛出异常
 */
@Slf4j
@Service
public class CacheOrchestrator {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp", "heic");
    private static final Set<String> ASSET_EXTENSIONS = Set.of(
        "js", "css", "json", "svg", "woff", "woff2", "ttf", "mp4", "mp3", "pdf");

    private static final double CACHE_WEIGHT = 0.30;
    private static final double MEMORY_WEIGHT = 0.20;
    private static final double DATABASE_WEIGHT = 0.20;
    private static final double IMAGE_WEIGHT = 0.15;
    private static final double PREDICTION_WEIGHT = 0.15;

    /** 驱逐率过高时缓存容量放大倍数 */
    private static final double CAPACITY_GROWTH = 1.5;
    /** 缓存层容量上限相对配置值的倍数 */
    private static final double MAX_CAPACITY_FACTOR = 4.0;
    private static final double LOW_UTILIZATION = 0.3;
    private static final double WEAK_COMPRESSION_RATIO = 0.8;
    private static final int IMAGE_QUALITY_STEP = 10;
    private static final int MIN_IMAGE_QUALITY = 50;

    private final CacheProperties.Orchestrator config;
    private final CacheProperties.MemoryTier memoryTierConfig;
    private final CacheTier memoryTier;
    private final CacheAnalyticsService analytics;
    private final PredictiveLoadingService predictor;
    private final DatabaseOptimizationService queryAdvisor;
    private final AssetFetcher assetFetcher;
    private final ImagePipeline imagePipeline;
    private final MemoryPoolManager memoryPoolManager;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // ========== 健康检查 ==========
    private final ScheduledExecutorService healthExecutor;
    private ScheduledFuture<?> healthTask;
    private final AtomicLong healthTicks = new AtomicLong(0);
    private volatile CacheMetrics baseline;
    private volatile double lastDegradation;
    private final AtomicBoolean optimizing = new AtomicBoolean(false);

    // ========== 指标 ==========
    private final Counter tierErrorCounter;
    private final Counter fallbackCounter;
    private final Counter optimizationCounter;
    private final Timer getTimer;

    public CacheOrchestrator(CacheProperties properties,
                             CacheTier memoryTier,
                             CacheAnalyticsService analytics,
                             PredictiveLoadingService predictor,
                             DatabaseOptimizationService queryAdvisor,
                             AssetFetcher assetFetcher,
                             ImagePipeline imagePipeline,
                             MemoryPoolManager memoryPoolManager,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.config = properties.getOrchestrator();
        this.memoryTierConfig = properties.getMemoryTier();
        this.memoryTier = memoryTier;
        this.analytics = analytics;
        this.predictor = predictor;
        this.queryAdvisor = queryAdvisor;
        this.assetFetcher = assetFetcher;
        this.imagePipeline = imagePipeline;
        this.memoryPoolManager = memoryPoolManager;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.tierErrorCounter = Counter.builder("orchestrator.tier.errors").register(meterRegistry);
        this.fallbackCounter = Counter.builder("orchestrator.fallbacks").register(meterRegistry);
        this.optimizationCounter = Counter.builder("orchestrator.optimizations").register(meterRegistry);
        this.getTimer = Timer.builder("orchestrator.get.latency").register(meterRegistry);

        this.healthExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-health-check");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("orchestrator.degradation", this, s -> s.lastDegradation)
            .register(meterRegistry);

        if (config.isAutoStart()) {
            startHealthMonitoring();
        }
        log.info("CacheOrchestrator initialized: healthCheckInterval={}ms, degradationThreshold={}",
            config.getHealthCheckIntervalMs(), config.getDegradationThreshold());
    }

    // ========== 读取 ==========

    public <T> CacheResult<T> get(String key) {
        return get(key, GetOptions.defaults());
    }

    /**
     * 分层读取，全部未命中且提供了回源时回源并写回
     */
    public <T> CacheResult<T> get(String key, GetOptions<T> options) {
        GetOptions<T> opts = options == null ? GetOptions.defaults() : options;
        long start = System.nanoTime();
        try {
            return doGet(key, opts, start);
        } catch (Exception e) {
            log.error("Cache get failed: key={}", key, e);
            double duration = elapsedMs(start);
            recordEvent(CacheEventType.ERROR, key, duration, CacheSource.MEMORY, Map.of("error", messageOf(e)));
            return CacheResult.empty(duration);
        } finally {
            getTimer.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    // ========== 写入 ==========

    public boolean set(String key, Object data) {
        return set(key, data, SetOptions.defaults());
    }

    /**
     * 写入内存层，并按 Key 形态分发给图片管线或资源登记，最后记录用户行为
     */
    public boolean set(String key, Object data, SetOptions options) {
        SetOptions opts = options == null ? SetOptions.defaults() : options;
        if (key == null || data == null) {
            return false;
        }
        long start = System.nanoTime();
        boolean stored = false;
        try {
            stored = memoryTier.set(key, data, writeOptions(opts.strategy()));
        } catch (Exception e) {
            tierErrorCounter.increment();
            log.error("Memory tier write failed: key={}", key, e);
        }

        try {
            if (isImageKey(key)) {
                imagePipeline.analyzeImage(key, data);
            } else if (isAssetKey(key)) {
                assetFetcher.registerAsset(key, data);
            }
        } catch (Exception e) {
            log.warn("Asset or image dispatch failed: key={}", key, e);
        }

        if (!opts.skipPrediction()) {
            try {
                predictor.recordUserAction(key, data, elapsedMs(start));
            } catch (Exception e) {
                log.warn("Failed to record user action: key={}", key, e);
            }
        }
        return stored;
    }

    public void remove(String key) {
        try {
            memoryTier.remove(key);
        } catch (Exception e) {
            log.error("Memory tier remove failed: key={}", key, e);
        }
    }

    // ========== 预取与导航 ==========

    /**
     * 为目标路由生成预测并执行预加载，返回生成的预测
     */
    public List<PredictionResult> prefetchForRoute(String route) {
        try {
            List<PredictionResult> predictions = predictor.generatePredictions(route);
            if (predictions.isEmpty()) {
                return predictions;
            }
            predictor.executePredictiveLoading(predictions);
            for (PredictionResult prediction : predictions) {
                analytics.recordEvent(CacheEventType.PREFETCH, prediction.dataType(), 0,
                    prediction.estimatedSize(), CacheSource.MEMORY,
                    Map.of("route", String.valueOf(route), "probability", prediction.probability()));
            }
            log.debug("Prefetch scheduled: route={}, predictions={}", route, predictions.size());
            return predictions;
        } catch (Exception e) {
            log.error("Prefetch failed: route={}", route, e);
            return List.of();
        }
    }

    /**
     * 把一次导航记录为 from 路由下的 view_&lt;to&gt; 行为，随后切换到 to 路由
     */
    public void trackNavigation(String from, String to, double loadTimeMs) {
        try {
            predictor.updateContext(LoadingContext.ofRoute(from));
            predictor.recordUserAction("view_" + to, null, loadTimeMs);
            predictor.updateContext(LoadingContext.ofRoute(to));
        } catch (Exception e) {
            log.error("Failed to track navigation: from={}, to={}", from, to, e);
        }
    }

    // ========== 协同调优 ==========

    /**
     * 依次执行：内存池整理、缓存层参数调整、慢查询统计、图片质量调整、全局回收
     */
    public OptimizationOutcome optimizePerformance() {
        if (!optimizing.compareAndSet(false, true)) {
            CacheMetrics current = analytics.getCurrentMetrics();
            return new OptimizationOutcome(current, current, Map.of(),
                List.of("Optimization already in progress"), List.of());
        }
        try {
            optimizationCounter.increment();
            CacheMetrics before = analytics.refreshMetrics();
            List<String> actions = new ArrayList<>();
            List<String> recommendations = new ArrayList<>();

            runStep("memory pools", () -> compactFragmentedPools(actions));
            runStep("tier settings", () -> tuneTierSettings(before, actions));
            runStep("slow queries", () -> surfaceSlowQueries(recommendations));
            runStep("image quality", () -> tuneImageQuality(before, actions));
            runStep("final cleanup", () -> finalCleanup(actions));

            CacheMetrics after = analytics.refreshMetrics();
            for (OptimizationRecommendation recommendation : CacheAnalyticsService.generateOptimizationRecommendations(after)) {
                recommendations.add(recommendation.description());
            }

            Map<String, Double> improvements = new LinkedHashMap<>();
            improvements.put("hitRatio", after.getHitRatio() - before.getHitRatio());
            improvements.put("memoryUsage", (double) (after.getMemoryUsage() - before.getMemoryUsage()));
            improvements.put("responseTime", after.getTotalResponseTime() - before.getTotalResponseTime());
            improvements.put("memoryFragmentation", after.getMemoryFragmentation() - before.getMemoryFragmentation());

            log.info("Performance optimization completed: actions={}, recommendations={}",
                actions.size(), recommendations.size());
            return new OptimizationOutcome(before, after, improvements, List.copyOf(actions), List.copyOf(recommendations));
        } finally {
            optimizing.set(false);
        }
    }

    // ========== 健康检查 ==========

    public void startHealthMonitoring() {
        synchronized (healthExecutor) {
            if (healthTask != null && !healthTask.isDone()) {
                return;
            }
            long interval = config.getHealthCheckIntervalMs();
            healthTask = healthExecutor.scheduleAtFixedRate(this::runHealthCheck, interval, interval, TimeUnit.MILLISECONDS);
        }
        log.info("Cache health monitoring started: interval={}ms", config.getHealthCheckIntervalMs());
    }

    public void stopHealthMonitoring() {
        synchronized (healthExecutor) {
            if (healthTask != null) {
                healthTask.cancel(false);
                healthTask = null;
            }
        }
    }

    /**
     * 单次健康检查：首次只建立基线；退化超过阈值时调优；每 N 次刷新基线
     */
    void runHealthCheck() {
        try {
            CacheMetrics current = analytics.getCurrentMetrics();
            CacheMetrics base = baseline;
            if (base == null) {
                baseline = current;
                return;
            }

            double degradation = degradationScore(base, current);
            lastDegradation = degradation;
            if (degradation > config.getDegradationThreshold()) {
                log.warn("Performance degradation detected: score={}, triggering optimization",
                    String.format(Locale.ROOT, "%.3f", degradation));
                optimizePerformance();
            }

            long tick = healthTicks.incrementAndGet();
            if (tick % Math.max(1, config.getBaselineRefreshEveryTicks()) == 0) {
                baseline = analytics.getCurrentMetrics();
                log.debug("Performance baseline refreshed: tick={}", tick);
            }
        } catch (Exception e) {
            log.error("Health check failed", e);
        }
    }

    /**
     * (命中率下降 + 响应时间增长/10000 + 内存增长比例) / 3
     */
    static double degradationScore(CacheMetrics baseline, CacheMetrics current) {
        double hitRatioDrop = Math.max(0, baseline.getHitRatio() - current.getHitRatio());
        double loadTimeIncrease = Math.max(0, current.getTotalResponseTime() - baseline.getTotalResponseTime());
        double memoryGrowthRatio = baseline.getMemoryUsage() > 0
            ? Math.max(0, (double) (current.getMemoryUsage() - baseline.getMemoryUsage()) / baseline.getMemoryUsage())
            : 0;
        return (hitRatioDrop + loadTimeIncrease / 10_000 + memoryGrowthRatio) / 3;
    }

    public double getLastDegradation() {
        return lastDegradation;
    }

    // ========== 性能报告 ==========

    public PerformanceReport getPerformanceReport() {
        CacheMetrics metrics = analytics.getCurrentMetrics();

        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("cache", clampPercent(metrics.getHitRatio() * 100));
        scores.put("memory", clampPercent((1 - metrics.getMemoryUtilization()) * 100));
        scores.put("database", safeScore(() -> clampPercent(queryAdvisor.getQueryAnalytics().optimizationScore() * 10)));
        scores.put("images", safeScore(() -> imageScore(imagePipeline.getOptimizationStats())));
        scores.put("predictions", safeScore(() -> predictionScore(predictor.getMetrics())));

        double overall = scores.get("cache") * CACHE_WEIGHT
            + scores.get("memory") * MEMORY_WEIGHT
            + scores.get("database") * DATABASE_WEIGHT
            + scores.get("images") * IMAGE_WEIGHT
            + scores.get("predictions") * PREDICTION_WEIGHT;

        List<String> recommendations = new ArrayList<>();
        for (OptimizationRecommendation recommendation : analytics.getOptimizationRecommendations()) {
            recommendations.add(recommendation.description());
        }
        int slowPatterns = safeCount(queryAdvisor::getSlowPatternCount);
        if (slowPatterns > 0) {
            recommendations.add(slowPatterns + " slow query patterns detected, review index recommendations");
        }

        return new PerformanceReport(overall, gradeOf(overall), statusOf(overall),
            scores, metrics, List.copyOf(recommendations), clock.millis());
    }

    static String gradeOf(double score) {
        if (score >= 90) {
            return "A";
        }
        if (score >= 80) {
            return "B";
        }
        if (score >= 70) {
            return "C";
        }
        if (score >= 60) {
            return "D";
        }
        return "F";
    }

    static String statusOf(double score) {
        if (score >= 90) {
            return "excellent";
        }
        if (score >= 75) {
            return "good";
        }
        if (score >= 60) {
            return "fair";
        }
        return "poor";
    }

    @PreDestroy
    public void shutdown() {
        stopHealthMonitoring();
        healthExecutor.shutdownNow();
        log.info("CacheOrchestrator shutdown");
    }

    // ========== 私有方法 ==========

    private <T> CacheResult<T> doGet(String key, GetOptions<T> opts, long start) {
        CacheStrategy strategy = opts.strategy();

        if (opts.isCancelled()) {
            return cancelled(key, start);
        }
        T value = probeMemory(key, opts);
        if (value != null) {
            return hit(key, value, CacheSource.MEMORY, start, "memory");
        }

        if (strategy.level() == CacheLevel.AUTO) {
            if (opts.isCancelled()) {
                return cancelled(key, start);
            }
            value = probePredictive(key, opts);
            if (value != null) {
                return hit(key, value, CacheSource.MEMORY, start, "predictive");
            }

            if (opts.isCancelled()) {
                return cancelled(key, start);
            }
            value = probeAsset(key, opts);
            if (value != null) {
                return hit(key, value, CacheSource.CDN, start, "asset");
            }

            if (opts.isCancelled()) {
                return cancelled(key, start);
            }
            value = probeQuery(key, opts);
            if (value != null) {
                return hit(key, value, CacheSource.NETWORK, start, "query");
            }
        }

        if (opts.fallback() == null || opts.isCancelled()) {
            double duration = elapsedMs(start);
            recordEvent(CacheEventType.MISS, key, duration, CacheSource.NETWORK, null);
            return CacheResult.empty(duration);
        }

        fallbackCounter.increment();
        T fresh;
        try {
            fresh = opts.fallback().get();
        } catch (Exception e) {
            double duration = elapsedMs(start);
            log.error("Fallback failed: key={}", key, e);
            recordEvent(CacheEventType.ERROR, key, duration, CacheSource.NETWORK, Map.of("error", messageOf(e)));
            return CacheResult.empty(duration);
        }

        double duration = elapsedMs(start);
        recordEvent(CacheEventType.MISS, key, duration, CacheSource.NETWORK, Map.of("fallback", true));
        if (fresh != null && !opts.isCancelled()) {
            set(key, fresh, SetOptions.of(strategy));
        }
        return new CacheResult<>(fresh, false, fresh != null ? CacheSource.NETWORK : null, duration);
    }

    private <T> T probeMemory(String key, GetOptions<T> opts) {
        Object raw;
        try {
            raw = memoryTier.get(key);
        } catch (Exception e) {
            tierErrorCounter.increment();
            log.warn("Memory tier lookup failed: key={}", key, e);
            return null;
        }
        if (raw == null) {
            return null;
        }
        T value = accept(raw, opts);
        if (value == null) {
            // 校验不通过：删除并记一次驱逐
            remove(key);
            analytics.recordEvent(CacheEventType.EVICTION, key, 0, CacheSource.MEMORY);
            log.debug("Cached value rejected by validation: key={}", key);
        }
        return value;
    }

    private <T> T probePredictive(String key, GetOptions<T> opts) {
        try {
            if (!predictor.hasActivePrediction(key)) {
                return null;
            }
            Object raw = memoryTier.get(PredictiveLoadingService.prefetchKey(key));
            return raw == null ? null : accept(raw, opts);
        } catch (Exception e) {
            tierErrorCounter.increment();
            log.warn("Predictive tier lookup failed: key={}", key, e);
            return null;
        }
    }

    private <T> T probeAsset(String key, GetOptions<T> opts) {
        if (!isAssetKey(key) && !isImageKey(key)) {
            return null;
        }
        try {
            Object raw = assetFetcher.fetchAsset(key);
            if (raw == null) {
                return null;
            }
            T value = accept(raw, opts);
            if (value != null && !opts.isCancelled()) {
                memoryTier.set(key, value, writeOptions(opts.strategy()));
            }
            return value;
        } catch (Exception e) {
            tierErrorCounter.increment();
            log.warn("Asset fetch failed: key={}", key, e);
            return null;
        }
    }

    private <T> T probeQuery(String key, GetOptions<T> opts) {
        String sql = sqlOf(key);
        if (sql == null) {
            return null;
        }
        try {
            QueryResult result = queryAdvisor.executeQuery(sql, List.of());
            return result == null ? null : accept(result, opts);
        } catch (Exception e) {
            tierErrorCounter.increment();
            log.warn("Query tier failed: key={}", key, e);
            return null;
        }
    }

    /**
     * 类型不符或校验不通过返回 null
     */
    private static <T> T accept(Object raw, GetOptions<T> opts) {
        Class<T> type = opts.type();
        if (type != null && !type.isInstance(raw)) {
            return null;
        }
        T value = type != null ? type.cast(raw) : uncheckedCast(raw);
        if (opts.validate() == null) {
            return value;
        }
        try {
            return opts.validate().test(value) ? value : null;
        } catch (ClassCastException e) {
            // 未声明 type 时校验函数收到其他类型的值
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T uncheckedCast(Object raw) {
        return (T) raw;
    }

    private <T> CacheResult<T> hit(String key, T value, CacheSource source, long start, String tier) {
        double duration = elapsedMs(start);
        recordEvent(CacheEventType.HIT, key, duration, source, Map.of("tier", tier));
        return new CacheResult<>(value, true, source, duration);
    }

    private <T> CacheResult<T> cancelled(String key, long start) {
        double duration = elapsedMs(start);
        recordEvent(CacheEventType.MISS, key, duration, CacheSource.MEMORY, Map.of("cancelled", true));
        log.debug("Cache get cancelled: key={}", key);
        return CacheResult.empty(duration);
    }

    private void recordEvent(CacheEventType type, String key, double duration, CacheSource source,
                             Map<String, Object> metadata) {
        try {
            analytics.recordEvent(type, key, duration, null, source, metadata);
        } catch (Exception e) {
            log.warn("Failed to record cache event: key={}", key, e);
        }
    }

    private CacheWriteOptions writeOptions(CacheStrategy strategy) {
        long ttlMs = strategy.ttlMs() != null ? strategy.ttlMs() : config.getDefaultTtlMs();
        return new CacheWriteOptions(Duration.ofMillis(ttlMs), strategy.priority(), strategy.enableCompression(), true);
    }

    private void compactFragmentedPools(List<String> actions) {
        for (MemoryPoolStats pool : memoryPoolManager.getPools()) {
            if (pool.fragmentationLevel() > config.getFragmentationThreshold()) {
                long reclaimed = memoryPoolManager.compact(pool.id());
                actions.add("Compacted memory pool " + pool.id() + " (" + reclaimed + " bytes reclaimed)");
            }
        }
    }

    private void tuneTierSettings(CacheMetrics before, List<String> actions) {
        CacheProperties.AlertThresholds thresholds = analytics.getAlertThresholds();
        TierSettings settings = memoryTier.getSettings();
        long configured = memoryTierConfig.getMaxSizeBytes();
        long ceiling = (long) (configured * MAX_CAPACITY_FACTOR);

        if (before.getEvictionRate() > thresholds.getEvictionRate() && settings.maxSizeBytes() < ceiling) {
            long widened = Math.min(ceiling, (long) (settings.maxSizeBytes() * CAPACITY_GROWTH));
            memoryTier.applySettings(settings.withMaxSizeBytes(widened));
            actions.add("Increased memory tier size to " + widened + " bytes");
        } else if (before.getMemoryUtilization() < LOW_UTILIZATION
            && before.getEvictionRate() == 0
            && settings.maxSizeBytes() > configured) {
            long narrowed = Math.max(configured, (long) (settings.maxSizeBytes() / CAPACITY_GROWTH));
            memoryTier.applySettings(settings.withMaxSizeBytes(narrowed));
            actions.add("Reduced memory tier size to " + narrowed + " bytes");
        }

        if (before.getMemoryUtilization() > thresholds.getMemoryUtilization() && !settings.compressionEnabled()) {
            memoryTier.applySettings(memoryTier.getSettings().withCompressionEnabled(true));
            actions.add("Enabled memory tier compression");
        }
    }

    private void surfaceSlowQueries(List<String> recommendations) {
        int slowPatterns = queryAdvisor.getSlowPatternCount();
        if (slowPatterns > 0) {
            recommendations.add(slowPatterns + " slow query patterns detected, review index recommendations");
        }
    }

    private void tuneImageQuality(CacheMetrics before, List<String> actions) {
        if (before.getCompressionRatio() > WEAK_COMPRESSION_RATIO) {
            int quality = imagePipeline.getCompressionQuality();
            int lowered = Math.max(MIN_IMAGE_QUALITY, quality - IMAGE_QUALITY_STEP);
            if (lowered < quality) {
                imagePipeline.setCompressionQuality(lowered);
                actions.add("Lowered image compression quality to " + lowered);
            }
        }
    }

    private void finalCleanup(List<String> actions) {
        long reclaimed = memoryPoolManager.collectGarbage();
        long expired = memoryTier.cleanUp();
        actions.add("Garbage collection reclaimed " + reclaimed + " bytes, " + expired + " expired entries removed");
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (Exception e) {
            log.error("Optimization step failed: {}", name, e);
        }
    }

    static boolean isImageKey(String key) {
        return key.startsWith(CacheConstants.IMAGE_KEY_PREFIX) || IMAGE_EXTENSIONS.contains(extensionOf(key));
    }

    static boolean isAssetKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return key.startsWith(CacheConstants.ASSET_KEY_PREFIX)
            || lower.startsWith("http://")
            || lower.startsWith("https://")
            || ASSET_EXTENSIONS.contains(extensionOf(key))
            || IMAGE_EXTENSIONS.contains(extensionOf(key));
    }

    /**
     * query: 前缀或以 SELECT 开头的 Key 视为查询，返回 SQL；否则返回 null
     */
    static String sqlOf(String key) {
        if (key.startsWith(CacheConstants.QUERY_KEY_PREFIX)) {
            String sql = key.substring(CacheConstants.QUERY_KEY_PREFIX.length()).trim();
            return sql.isEmpty() ? null : sql;
        }
        String trimmed = key.trim();
        if (trimmed.regionMatches(true, 0, "select ", 0, 7)) {
            return trimmed;
        }
        return null;
    }

    private static String extensionOf(String key) {
        int query = key.indexOf('?');
        String path = query >= 0 ? key.substring(0, query) : key;
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot < 0 || dot < slash || dot == path.length() - 1) {
            return "";
        }
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static double imageScore(ImageStats stats) {
        if (stats.totalOriginalSize() <= 0) {
            return 100;
        }
        // 节省一半体积即满分
        return clampPercent((1 - stats.averageCompressionRatio()) * 200);
    }

    private static double predictionScore(PredictorMetrics metrics) {
        if (metrics.totalPredictions() <= 0) {
            return 100;
        }
        return clampPercent((double) metrics.successfulPredictions() / metrics.totalPredictions() * 100);
    }

    private static double safeScore(DoubleSupplier supplier) {
        try {
            return supplier.getAsDouble();
        } catch (Exception e) {
            log.warn("Failed to compute component score", e);
            return 0;
        }
    }

    private static int safeCount(IntSupplier supplier) {
        try {
            return supplier.getAsInt();
        } catch (Exception e) {
            log.warn("Failed to compute slow query count", e);
            return 0;
        }
    }

    private static double clampPercent(double value) {
        return Math.max(0, Math.min(100, value));
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
