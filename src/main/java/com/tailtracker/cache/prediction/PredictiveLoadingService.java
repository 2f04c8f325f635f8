package com.tailtracker.cache.prediction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.constant.CacheConstants;
import com.tailtracker.cache.constant.KeyDigests;
import com.tailtracker.cache.exception.CacheEngineException;
import com.tailtracker.cache.service.JsonStateStore;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.DeviceState;
import com.tailtracker.cache.spi.DeviceStateProvider;
import com.tailtracker.cache.spi.MetricsSink;
import com.tailtracker.cache.spi.PredictionDataLoader;
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
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于访问模式的预测预取服务
 *
 * 核心特性：
 * 1. 模式学习 - 按 (路由, 时段, 星期, 行为) 上下文累计频次、成功率与耗时
 * 2. 置信度评分 - 频次 40% + 时效 25% + 上下文相似度 20% + 成功率 15%
 * 3. 分级预取 - 立即 / 后台错峰 / 按需 / 后台联网时抢先加载
 * 4. 自调优 - 按整体预测成功率衰减或提升置信度，清理过期模式
 * 5. 容量上限 - 超出 maxPatterns 时淘汰最久未使用的模式
 */
@Slf4j
@Service
public class PredictiveLoadingService {

    /** 加载耗时在 (0, 5000ms) 内视为成功 */
    private static final double SUCCESS_LOAD_TIME_MS = 5000;
    /** 超过该大小的预取数据开启压缩 */
    private static final long COMPRESSION_THRESHOLD_BYTES = 4096;
    private static final long BASE_CACHE_DURATION_MS = CacheConstants.ONE_HOUR_MS;
    private static final int MAX_QUEUE_LENGTH = 100;

    private final CacheProperties.Predictor config;
    private final CacheTier memoryTier;
    private final PredictionDataLoader dataLoader;
    private final DeviceStateProvider deviceStateProvider;
    private final JsonStateStore stateStore;
    private final MetricsSink metricsSink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // ========== 模式（patternLock 保护，访问顺序即 LRU 顺序） ==========
    private final ReentrantLock patternLock = new ReentrantLock();
    private final LinkedHashMap<String, PredictivePattern> patterns;

    private volatile LoadingContext currentContext = LoadingContext.empty();
    private volatile boolean enabled;

    /** 已生成且仍在缓存期内的预测：dataType -> 过期时间 */
    private final ConcurrentHashMap<String, Long> activePredictions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<PredictionResult> preemptiveQueue = new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<List<PredictionResult>> pendingRuns = new ConcurrentLinkedDeque<>();

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong actionCounter = new AtomicLong(0);

    // ========== 统计 ==========
    private final LongAdder totalPredictions = new LongAdder();
    private final LongAdder successfulPredictions = new LongAdder();
    private final LongAdder failedPredictions = new LongAdder();
    private final LongAdder totalDataPreloaded = new LongAdder();
    private volatile double averagePredictionAccuracy;
    private volatile double cacheHitImprovement;
    private volatile double networkSavings;

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> optimizationTask;
    private ScheduledFuture<?> queueCheckTask;

    private final Counter generatedCounter;
    private final Counter loadSuccessCounter;
    private final Counter loadFailureCounter;
    private final Timer generationTimer;

    public PredictiveLoadingService(CacheProperties properties,
                                    CacheTier memoryTier,
                                    PredictionDataLoader dataLoader,
                                    DeviceStateProvider deviceStateProvider,
                                    JsonStateStore stateStore,
                                    MetricsSink metricsSink,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.config = properties.getPredictor();
        this.memoryTier = memoryTier;
        this.dataLoader = dataLoader;
        this.deviceStateProvider = deviceStateProvider;
        this.stateStore = stateStore;
        this.metricsSink = metricsSink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.enabled = config.isEnabled();

        int maxPatterns = Math.max(1, config.getMaxPatterns());
        this.patterns = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PredictivePattern> eldest) {
                boolean evict = size() > maxPatterns;
                if (evict) {
                    log.debug("Pattern evicted by capacity: id={}", eldest.getKey());
                }
                return evict;
            }
        };

        this.generatedCounter = Counter.builder("predictor.predictions.generated").register(meterRegistry);
        this.loadSuccessCounter = Counter.builder("predictor.loads").tag("result", "success").register(meterRegistry);
        this.loadFailureCounter = Counter.builder("predictor.loads").tag("result", "failure").register(meterRegistry);
        this.generationTimer = Timer.builder("predictor.generation.latency").register(meterRegistry);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "predictive-loader");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("predictor.patterns.size", this, s -> s.patternCount()).register(meterRegistry);
        Gauge.builder("predictor.queue.size", preemptiveQueue, ConcurrentLinkedDeque::size).register(meterRegistry);
        Gauge.builder("predictor.accuracy", this, s -> s.averagePredictionAccuracy).register(meterRegistry);

        loadStoredPatterns();
        loadMetrics();

        if (config.isAutoStart()) {
            startPeriodicOptimization();
        }
        log.info("PredictiveLoadingService initialized: patterns={}, maxPatterns={}, enabled={}",
            patternCount(), config.getMaxPatterns(), enabled);
    }

    public void startPeriodicOptimization() {
        if (optimizationTask != null && !optimizationTask.isDone()) {
            return;
        }
        long interval = config.getOptimizationIntervalMs();
        optimizationTask = scheduler.scheduleAtFixedRate(
            this::runOptimizationCycle, interval, interval, TimeUnit.MILLISECONDS);
        long queueInterval = config.getPreemptiveCheckIntervalMs();
        queueCheckTask = scheduler.scheduleWithFixedDelay(
            this::processQueueWhenIdle, queueInterval, queueInterval, TimeUnit.MILLISECONDS);
    }

    // ========== 上下文 ==========

    /**
     * 合并上下文，未提供的字段保持不变
     */
    public void updateContext(LoadingContext update) {
        currentContext = currentContext.merge(update).withTimestamp(clock.millis());
    }

    /**
     * 当前生效上下文：默认值 + 设备状态 + 调用方设置的字段
     */
    public LoadingContext getCurrentContext() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        DeviceState device = deviceStateProvider.current();
        LoadingContext defaults = new LoadingContext(
            "unknown",
            "anonymous",
            clock.millis(),
            device.networkType(),
            device.batteryLevel(),
            device.charging(),
            now.getHour(),
            now.getDayOfWeek().getValue() % 7,
            "1.0.0");
        return defaults.merge(currentContext);
    }

    // ========== 模式学习 ==========

    public void recordUserAction(String action, Object data, double loadTimeMs) {
        LoadingContext context = getCurrentContext();
        String patternId = patternId(context, action);
        long now = clock.millis();
        boolean success = loadTimeMs > 0 && loadTimeMs < SUCCESS_LOAD_TIME_MS;

        patternLock.lock();
        try {
            PredictivePattern pattern = patterns.get(patternId);
            if (pattern != null) {
                long frequency = pattern.getFrequency() + 1;
                pattern.setFrequency(frequency);
                pattern.setLastUsed(now);
                pattern.setSuccessRate((pattern.getSuccessRate() * (frequency - 1) + (success ? 1 : 0)) / frequency);
                if (loadTimeMs > 0) {
                    pattern.setAverageLoadTime((pattern.getAverageLoadTime() * (frequency - 1) + loadTimeMs) / frequency);
                }
            } else {
                pattern = new PredictivePattern();
                pattern.setId(patternId);
                pattern.getSequence().add(action);
                pattern.setConfidence(0.1);
                pattern.setFrequency(1);
                pattern.setContext(context);
                pattern.setSuccessRate(success ? 1 : 0);
                pattern.setAverageLoadTime(Math.max(loadTimeMs, 0));
                pattern.setLastUsed(now);
                patterns.put(patternId, pattern);
            }
            pattern.setConfidence(calculateConfidence(pattern, context, now));
        } finally {
            patternLock.unlock();
        }

        if (actionCounter.incrementAndGet() % Math.max(1, config.getPersistEveryActions()) == 0) {
            persistPatterns();
        }
        log.debug("User action recorded: action={}, route={}, loadTime={}ms", action, context.route(), loadTimeMs);
    }

    /**
     * 置信度 = 0.4·频次 + 0.25·时效 + 0.2·上下文相似度 + 0.15·成功率，截断到 [0, 1]
     * 调用方需持有 patternLock
     */
    private double calculateConfidence(PredictivePattern pattern, LoadingContext context, long now) {
        long maxFrequency = 0;
        for (PredictivePattern p : patterns.values()) {
            maxFrequency = Math.max(maxFrequency, p.getFrequency());
        }
        double frequencyScore = maxFrequency > 0 ? (double) pattern.getFrequency() / maxFrequency : 0;
        double recencyScore = recencyScore(pattern.getLastUsed(), now);
        double contextScore = pattern.getContext() != null ? pattern.getContext().similarityTo(context) : 0;
        double confidence = frequencyScore * 0.4
            + recencyScore * 0.25
            + contextScore * 0.2
            + pattern.getSuccessRate() * 0.15;
        return clamp(confidence);
    }

    static double recencyScore(long lastUsed, long now) {
        double daysSinceUsed = (double) (now - lastUsed) / CacheConstants.ONE_DAY_MS;
        return Math.exp(-daysSinceUsed / 7);
    }

    static String patternId(LoadingContext context, String action) {
        return KeyDigests.shortId(context.route(), String.valueOf(context.timeOfDay()),
            String.valueOf(context.dayOfWeek()), action);
    }

    // ========== 预测 ==========

    public List<PredictionResult> generatePredictions(String currentRoute) {
        if (!enabled) {
            return List.of();
        }
        long start = System.nanoTime();
        LoadingContext context = getCurrentContext().withRoute(currentRoute);
        long now = clock.millis();
        long retentionMs = config.getPatternRetentionDays() * CacheConstants.ONE_DAY_MS;

        List<PredictivePattern> relevant = new ArrayList<>();
        patternLock.lock();
        try {
            // 遍历 values 不影响访问顺序
            for (PredictivePattern pattern : patterns.values()) {
                boolean recent = now - pattern.getLastUsed() <= retentionMs;
                double similarity = pattern.getContext() != null ? pattern.getContext().similarityTo(context) : 0;
                if (recent && similarity > config.getMinContextSimilarity()) {
                    relevant.add(pattern.copy());
                }
            }
        } finally {
            patternLock.unlock();
        }
        relevant.sort(Comparator.comparingDouble(PredictivePattern::getConfidence).reversed());

        List<PredictionResult> predictions = new ArrayList<>();
        for (PredictivePattern pattern : relevant) {
            if (pattern.getConfidence() < config.getMinConfidence()) {
                continue;
            }
            PredictionResult prediction = createPrediction(pattern, context);
            if (prediction != null) {
                predictions.add(prediction);
            }
        }
        predictions.sort(Comparator
            .comparingInt((PredictionResult p) -> p.strategy().priority().weight()).reversed()
            .thenComparing(Comparator.comparingDouble(PredictionResult::probability).reversed()));

        int max = maxPredictions(context);
        List<PredictionResult> result = predictions.size() > max
            ? List.copyOf(predictions.subList(0, max))
            : List.copyOf(predictions);

        totalPredictions.add(result.size());
        generatedCounter.increment(result.size());
        for (PredictionResult prediction : result) {
            activePredictions.put(prediction.dataType(), now + prediction.cacheDurationMs());
        }

        long elapsed = System.nanoTime() - start;
        generationTimer.record(elapsed, TimeUnit.NANOSECONDS);
        metricsSink.recordMetric("prediction_generation", elapsed / 1_000_000.0, now, "prediction",
            Map.of("predictionsCount", result.size(), "route", String.valueOf(currentRoute)));
        return result;
    }

    /**
     * 是否存在仍在缓存期内的预测
     */
    public boolean hasActivePrediction(String dataType) {
        Long expiresAt = activePredictions.get(dataType);
        if (expiresAt == null) {
            return false;
        }
        if (expiresAt <= clock.millis()) {
            activePredictions.remove(dataType, expiresAt);
            return false;
        }
        return true;
    }

    public static String prefetchKey(String dataType) {
        return CacheConstants.PREFETCH_PREFIX + dataType;
    }

    private PredictionResult createPrediction(PredictivePattern pattern, LoadingContext context) {
        String dataType = PredictionDataTypes.dataTypeFor(pattern.primaryAction());
        if (dataType == null) {
            return null;
        }
        double probability = pattern.getConfidence() * pattern.getContext().similarityTo(context);
        LoadingStrategy strategy = determineLoadingStrategy(pattern, context, probability);
        long estimatedSize = Math.round(PredictionDataTypes.baseSizeOf(dataType)
            * Math.min(pattern.getFrequency() / 10.0, 2));
        long cacheDuration = cacheDuration(pattern, context);
        return new PredictionResult(dataType, probability, strategy, estimatedSize, cacheDuration);
    }

    static LoadingStrategy determineLoadingStrategy(PredictivePattern pattern, LoadingContext context,
                                                    double probability) {
        LoadingType type;
        CachePriority priority;
        if (probability > 0.8) {
            type = LoadingType.IMMEDIATE;
            priority = CachePriority.HIGH;
        } else if (probability > 0.6) {
            type = LoadingType.BACKGROUND;
            priority = CachePriority.MEDIUM;
        } else if (probability > 0.4) {
            type = LoadingType.ON_DEMAND;
            priority = CachePriority.LOW;
        } else {
            type = LoadingType.PREEMPTIVE;
            priority = CachePriority.LOW;
        }

        // 蜂窝网络且未充电时降一级
        if ("cellular".equals(context.networkType()) && !context.chargingOrFalse()) {
            if (type == LoadingType.IMMEDIATE) {
                type = LoadingType.BACKGROUND;
            }
            if (priority == CachePriority.HIGH) {
                priority = CachePriority.MEDIUM;
            }
        }

        if (context.batteryOrFull() < 0.2) {
            type = LoadingType.ON_DEMAND;
            priority = CachePriority.LOW;
        }

        long timeout = pattern.getAverageLoadTime() > 0 ? Math.round(pattern.getAverageLoadTime() * 1.5) : 5000;
        return new LoadingStrategy(
            type,
            priority,
            type == LoadingType.IMMEDIATE ? 1 : 3,
            priority == CachePriority.HIGH ? 3 : 1,
            timeout,
            true);
    }

    static long cacheDuration(PredictivePattern pattern, LoadingContext context) {
        double duration = BASE_CACHE_DURATION_MS;
        if (pattern.getConfidence() > 0.8) {
            duration *= 2;
        }
        if (pattern.getFrequency() > 10) {
            duration *= 1.5;
        }
        if (context.batteryOrFull() < 0.3) {
            duration *= 0.5;
        }
        return (long) Math.min(duration, CacheConstants.ONE_DAY_MS);
    }

    private int maxPredictions(LoadingContext context) {
        int max = config.getMaxPredictionsDefault();
        if ("wifi".equals(context.networkType())) {
            max = config.getMaxPredictionsWifi();
        } else if ("cellular".equals(context.networkType())) {
            max = config.getMaxPredictionsCellular();
        }
        if (context.batteryOrFull() < 0.3) {
            max = Math.min(max, config.getMaxPredictionsLowBattery());
        }
        return max;
    }

    // ========== 预取执行 ==========

    /**
     * 立即类同步加载，后台类错峰调度，抢先类入队等待空闲
     * 按需类不主动加载；执行中到达的批次排队，由当前执行者依次处理
     */
    public void executePredictiveLoading(List<PredictionResult> predictions) {
        if (!enabled || predictions.isEmpty()) {
            return;
        }
        pendingRuns.addLast(List.copyOf(predictions));
        while (!pendingRuns.isEmpty() && processing.compareAndSet(false, true)) {
            try {
                List<PredictionResult> run;
                while ((run = pendingRuns.pollFirst()) != null) {
                    dispatch(run);
                }
            } finally {
                processing.set(false);
            }
        }
    }

    private void dispatch(List<PredictionResult> predictions) {
        List<PredictionResult> background = new ArrayList<>();
        for (PredictionResult prediction : predictions) {
            switch (prediction.strategy().type()) {
                case IMMEDIATE -> loadAndCount(prediction);
                case BACKGROUND -> background.add(prediction);
                case PREEMPTIVE -> enqueuePreemptive(prediction);
                default -> {
                    // ON_DEMAND
                }
            }
        }
        for (int i = 0; i < background.size(); i++) {
            PredictionResult prediction = background.get(i);
            scheduler.schedule(() -> loadAndCount(prediction),
                i * config.getBackgroundStaggerMs(), TimeUnit.MILLISECONDS);
        }
        processQueueWhenIdle();
    }

    private void enqueuePreemptive(PredictionResult prediction) {
        preemptiveQueue.addLast(prediction);
        while (preemptiveQueue.size() > MAX_QUEUE_LENGTH) {
            preemptiveQueue.pollFirst();
        }
    }

    private void loadAndCount(PredictionResult prediction) {
        try {
            loadPredictionData(prediction);
            successfulPredictions.increment();
            loadSuccessCounter.increment();
        } catch (Exception e) {
            log.error("Failed to load prediction: dataType={}, strategy={}",
                prediction.dataType(), prediction.strategy().type(), e);
            failedPredictions.increment();
            loadFailureCounter.increment();
        }
    }

    private void loadPredictionData(PredictionResult prediction) throws Exception {
        long start = System.nanoTime();
        String key = prefetchKey(prediction.dataType());
        if (memoryTier.get(key) != null) {
            log.debug("Prediction data already cached: dataType={}", prediction.dataType());
            return;
        }

        Object data = dataLoader.load(prediction.dataType());
        if (data == null) {
            throw new CacheEngineException("No data available for " + prediction.dataType());
        }
        memoryTier.set(key, data, new CacheWriteOptions(
            Duration.ofMillis(prediction.cacheDurationMs()),
            prediction.strategy().priority(),
            prediction.estimatedSize() > COMPRESSION_THRESHOLD_BYTES,
            true));
        totalDataPreloaded.add(prediction.estimatedSize());

        double loadTime = (System.nanoTime() - start) / 1_000_000.0;
        metricsSink.recordMetric("predictive_load", loadTime, clock.millis(), "prediction", Map.of(
            "dataType", prediction.dataType(),
            "probability", prediction.probability(),
            "strategy", prediction.strategy().type().name()));
    }

    /**
     * 应用在后台且网络可用时异步清空抢先队列
     */
    void processQueueWhenIdle() {
        DeviceState device = deviceStateProvider.current();
        if (device.appInBackground() && device.connected() && !preemptiveQueue.isEmpty()
            && draining.compareAndSet(false, true)) {
            scheduler.execute(this::drainNext);
        }
    }

    private void drainNext() {
        DeviceState device = deviceStateProvider.current();
        PredictionResult next = device.connected() && enabled ? preemptiveQueue.pollFirst() : null;
        if (next == null) {
            draining.set(false);
            return;
        }
        loadAndCount(next);
        scheduler.schedule(this::drainNext, config.getPreemptivePacingMs(), TimeUnit.MILLISECONDS);
    }

    public void onAppStateChanged(boolean inBackground) {
        if (inBackground) {
            processQueueWhenIdle();
        }
    }

    public void onNetworkStateChanged(boolean connected) {
        if (connected) {
            processQueueWhenIdle();
        }
    }

    // ========== 自调优 ==========

    void runOptimizationCycle() {
        try {
            optimizePredictionAccuracy();
            cleanupOldPatterns();
            updateMetrics();
        } catch (Exception e) {
            log.error("Prediction optimization cycle failed", e);
        }
    }

    void optimizePredictionAccuracy() {
        long total = totalPredictions.sum();
        double successRate = total > 0 ? (double) successfulPredictions.sum() / total : 0;

        patternLock.lock();
        try {
            if (successRate < 0.6) {
                patterns.values().forEach(p -> p.setConfidence(clamp(p.getConfidence() * 0.9)));
            } else if (successRate > 0.8) {
                patterns.values().stream()
                    .filter(p -> p.getSuccessRate() > 0.7)
                    .forEach(p -> p.setConfidence(Math.min(p.getConfidence() * 1.1, 1.0)));
            }
        } finally {
            patternLock.unlock();
        }
        averagePredictionAccuracy = successRate;
        log.debug("Prediction accuracy tuned: successRate={}", successRate);
    }

    void cleanupOldPatterns() {
        long cutoff = clock.millis() - config.getPatternRetentionDays() * CacheConstants.ONE_DAY_MS;
        int removed = 0;
        patternLock.lock();
        try {
            Iterator<PredictivePattern> it = patterns.values().iterator();
            while (it.hasNext()) {
                PredictivePattern pattern = it.next();
                if (pattern.getLastUsed() < cutoff && pattern.getConfidence() < config.getMinConfidence()) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            patternLock.unlock();
        }
        if (removed > 0) {
            log.info("Stale prediction patterns removed: count={}", removed);
        }
        persistPatterns();
    }

    private void updateMetrics() {
        double hitRate = memoryTier.getStatistics().hitRate();
        cacheHitImprovement = hitRate;
        networkSavings = totalDataPreloaded.sum() * hitRate;
        persistMetrics();
    }

    // ========== 公共 API ==========

    public void enable() {
        enabled = true;
        log.info("Predictive loading enabled");
    }

    /**
     * 关闭预测并清空抢先队列
     */
    public void disable() {
        enabled = false;
        preemptiveQueue.clear();
        log.info("Predictive loading disabled");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public PredictorMetrics getMetrics() {
        return new PredictorMetrics(
            totalPredictions.sum(),
            successfulPredictions.sum(),
            failedPredictions.sum(),
            averagePredictionAccuracy,
            totalDataPreloaded.sum(),
            cacheHitImprovement,
            networkSavings,
            patternCount(),
            preemptiveQueue.size());
    }

    /**
     * 模式快照（按最近使用顺序，最新在后）
     */
    public List<PredictivePattern> getPatterns() {
        patternLock.lock();
        try {
            return patterns.values().stream().map(PredictivePattern::copy).toList();
        } finally {
            patternLock.unlock();
        }
    }

    public void clearAllPatterns() {
        patternLock.lock();
        try {
            patterns.clear();
        } finally {
            patternLock.unlock();
        }
        activePredictions.clear();
        persistPatterns();
        log.info("All prediction patterns cleared");
    }

    @PreDestroy
    public void shutdown() {
        if (optimizationTask != null) {
            optimizationTask.cancel(false);
        }
        if (queueCheckTask != null) {
            queueCheckTask.cancel(false);
        }
        scheduler.shutdownNow();
        persistPatterns();
        persistMetrics();
        log.info("PredictiveLoadingService shutdown");
    }

    // ========== 私有方法 ==========

    private int patternCount() {
        patternLock.lock();
        try {
            return patterns.size();
        } finally {
            patternLock.unlock();
        }
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }

    private void loadStoredPatterns() {
        stateStore.load(CacheConstants.PREDICTIVE_PATTERNS_KEY, new TypeReference<List<PredictivePattern>>() {})
            .ifPresent(stored -> {
                patternLock.lock();
                try {
                    patterns.clear();
                    stored.stream()
                        .sorted(Comparator.comparingLong(PredictivePattern::getLastUsed))
                        .forEach(p -> {
                            p.setConfidence(clamp(p.getConfidence()));
                            patterns.put(p.getId(), p);
                        });
                } finally {
                    patternLock.unlock();
                }
                log.info("Prediction patterns restored: count={}", stored.size());
            });
    }

    private void persistPatterns() {
        stateStore.save(CacheConstants.PREDICTIVE_PATTERNS_KEY, getPatterns());
    }

    private void loadMetrics() {
        stateStore.load(CacheConstants.PREDICTIVE_METRICS_KEY, PredictorMetrics.class)
            .ifPresent(stored -> {
                totalPredictions.add(stored.totalPredictions());
                successfulPredictions.add(stored.successfulPredictions());
                failedPredictions.add(stored.failedPredictions());
                totalDataPreloaded.add(stored.totalDataPreloaded());
                averagePredictionAccuracy = stored.averagePredictionAccuracy();
                cacheHitImprovement = stored.cacheHitImprovement();
                networkSavings = stored.networkSavings();
            });
    }

    private void persistMetrics() {
        stateStore.save(CacheConstants.PREDICTIVE_METRICS_KEY, getMetrics());
    }
}
