package com.tailtracker.cache.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.constant.CacheConstants;
import com.tailtracker.cache.constant.KeyDigests;
import com.tailtracker.cache.exception.QueryExecutionException;
import com.tailtracker.cache.service.JsonStateStore;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.MetricsSink;
import com.tailtracker.cache.spi.QueryExecutor;
import com.tailtracker.cache.spi.QueryResult;
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
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 查询优化顾问
 *
 * 核心职责：
 * 1. 查询执行 - 结果缓存、OR 链改写、执行指标
 * 2. 静态分析 - 固定顺序的规则表打分
 * 3. 索引建议 - 按模式频次加权聚合
 * 4. 批量执行 - 满批立即下发，否则防抖后下发，各成员独立完成
 * 5. 周期优化 - 慢查询统计、过期指标清理、持久化
 */
@Slf4j
@Service
public class DatabaseOptimizationService {

    /** 参与索引聚合的最低模式频次（不含） */
    private static final long INDEX_MIN_FREQUENCY = 5;
    /** 模式清理时保留的最低频次 */
    private static final long PATTERN_KEEP_FREQUENCY = 5;
    /** 周期分析中"高频"的下限（不含） */
    private static final long FREQUENT_PATTERN_THRESHOLD = 10;
    private static final double POOR_SCORE_THRESHOLD = 5;
    private static final double SLOW_PATTERN_PENALTY = 4;
    private static final int COMPRESSION_ROW_THRESHOLD = 10;
    private static final int TOP_SLOW_QUERIES = 10;
    private static final int SQL_PREVIEW_LENGTH = 100;

    private final CacheTier cacheTier;
    private final QueryExecutor queryExecutor;
    private final JsonStateStore stateStore;
    private final MetricsSink metricsSink;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private volatile CacheProperties.Query config;

    // ========== 状态（stateLock 保护） ==========
    private final ReentrantLock stateLock = new ReentrantLock();
    private final LinkedHashMap<String, List<QueryMetrics>> queryMetrics;
    private final LinkedHashMap<String, QueryPattern> queryPatterns;
    /** 已写入缓存层的查询结果 Key，按访问顺序淘汰 */
    private final LinkedHashMap<String, Boolean> cachedResultKeys;
    private List<DatabaseIndex> suggestedIndexes = List.of();

    // ========== 批量执行（batchLock 保护） ==========
    private final ReentrantLock batchLock = new ReentrantLock();
    private final List<BatchItem> pendingBatch = new ArrayList<>();
    private ScheduledFuture<?> batchFlushTask;

    // ========== 调度 ==========
    private final ScheduledExecutorService scheduler;
    private final ExecutorService batchExecutor;
    private ScheduledFuture<?> optimizationTask;
    private final AtomicLong executionCounter = new AtomicLong(0);

    // ========== 指标 ==========
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter errorCounter;
    private final Timer executionTimer;

    public DatabaseOptimizationService(CacheProperties properties,
                                       CacheTier cacheTier,
                                       QueryExecutor queryExecutor,
                                       JsonStateStore stateStore,
                                       MetricsSink metricsSink,
                                       ObjectMapper objectMapper,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        this.config = properties.getQuery().copy();
        this.cacheTier = cacheTier;
        this.queryExecutor = queryExecutor;
        this.stateStore = stateStore;
        this.metricsSink = metricsSink;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.queryMetrics = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<QueryMetrics>> eldest) {
                return size() > Math.max(1, config.getMaxPatterns());
            }
        };
        this.queryPatterns = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, QueryPattern> eldest) {
                boolean evict = size() > Math.max(1, config.getMaxPatterns());
                if (evict) {
                    log.debug("Query pattern evicted by capacity: pattern={}", eldest.getKey());
                }
                return evict;
            }
        };
        this.cachedResultKeys = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                boolean evict = size() > Math.max(1, config.getMaxCacheSize());
                if (evict) {
                    cacheTier.remove(eldest.getKey());
                }
                return evict;
            }
        };

        this.cacheHitCounter = Counter.builder("query.executions").tag("cache", "hit").register(meterRegistry);
        this.cacheMissCounter = Counter.builder("query.executions").tag("cache", "miss").register(meterRegistry);
        this.errorCounter = Counter.builder("query.errors").register(meterRegistry);
        this.executionTimer = Timer.builder("query.execution.latency").register(meterRegistry);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "query-optimizer");
            t.setDaemon(true);
            return t;
        });
        this.batchExecutor = Executors.newFixedThreadPool(
            Math.max(1, Math.min(config.getBatchSize(), 8)),
            r -> {
                Thread t = new Thread(r, "query-batch-worker");
                t.setDaemon(true);
                return t;
            }
        );
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("query.patterns.size", this, s -> s.patternCount())
            .register(meterRegistry);

        loadStoredData();

        if (config.isAutoStart()) {
            startPeriodicOptimization();
        }
        log.info("DatabaseOptimizationService initialized: caching={}, batching={}, rewriting={}",
            config.isEnableCaching(), config.isEnableBatching(), config.isEnableRewriting());
    }

    public void startPeriodicOptimization() {
        long interval = config.getOptimizationIntervalMs();
        stateLock.lock();
        try {
            if (optimizationTask != null && !optimizationTask.isDone()) {
                return;
            }
            optimizationTask = scheduler.scheduleAtFixedRate(
                this::runOptimizationCycle, interval, interval, TimeUnit.MILLISECONDS);
        } finally {
            stateLock.unlock();
        }
        log.info("Query optimization scheduled: interval={}ms", interval);
    }

    // ========== 查询执行 ==========

    public QueryResult executeQuery(String sql, List<Object> params) {
        return executeQuery(sql, params, QueryOptions.defaults());
    }

    /**
     * 执行查询
     *
     * @throws QueryExecutionException 执行失败，指标已记录
     */
    public QueryResult executeQuery(String sql, List<Object> params, QueryOptions options) {
        long start = System.nanoTime();
        List<Object> parameters = params == null ? List.of() : params;
        QueryOptions opts = options == null ? QueryOptions.defaults() : options;
        CacheProperties.Query cfg = config;
        String queryId = generateQueryId(sql, parameters);
        boolean useCache = opts.useCache() && cfg.isEnableCaching();

        if (useCache) {
            QueryResult cached = getCachedResult(queryId);
            if (cached != null) {
                QueryResult limited = cached.limit(opts.maxResults());
                cacheHitCounter.increment();
                recordQueryMetrics(new QueryMetrics(queryId, sql, elapsedMs(start),
                    limited.resultCount(), true, clock.millis(), parameters, null));
                log.debug("Query served from cache: queryId={}", queryId);
                return limited;
            }
        }

        String executedSql = sql;
        try {
            if (opts.enableOptimization() && cfg.isEnableRewriting()) {
                executedSql = optimizeQuery(sql);
            }
            QueryResult result = queryExecutor.execute(executedSql, parameters);
            if (result == null) {
                result = QueryResult.ofRows(List.of());
            }

            // 缓存完整结果，截断只作用于本次返回
            if (useCache && shouldCacheQuery(sql, result, cfg)) {
                long ttl = opts.cacheTtlMs() != null ? opts.cacheTtlMs() : cfg.getCacheTtlMs();
                cacheQueryResult(queryId, result, ttl);
            }
            result = result.limit(opts.maxResults());

            cacheMissCounter.increment();
            double elapsed = elapsedMs(start);
            executionTimer.record(Duration.ofNanos(System.nanoTime() - start));
            recordQueryMetrics(new QueryMetrics(queryId, executedSql, elapsed,
                result.resultCount(), false, clock.millis(), parameters, null));
            return result;
        } catch (RuntimeException e) {
            errorCounter.increment();
            recordQueryMetrics(new QueryMetrics(queryId, sql, elapsedMs(start),
                0, false, clock.millis(), parameters, messageOf(e)));
            log.error("Query execution failed: queryId={}", queryId, e);
            throw new QueryExecutionException(queryId, "Query execution failed: " + messageOf(e), e);
        }
    }

    /**
     * 按规则表顺序应用自动改写
     */
    String optimizeQuery(String sql) {
        String optimized = sql;
        for (QueryOptimizationRule rule : QueryRules.DEFAULT_RULES) {
            if (rule.hasAutoFix() && rule.matches(optimized)) {
                String rewritten = rule.autoFix().apply(optimized);
                if (!rewritten.equals(optimized)) {
                    log.debug("Applied optimization rule: {}", rule.name());
                    optimized = rewritten;
                }
            }
        }
        return optimized;
    }

    // ========== 静态分析 ==========

    public QueryAnalysis analyzeQuery(String sql) {
        return QueryRules.analyze(sql);
    }

    public List<String> generateIndexSuggestions(String pattern) {
        return IndexAdvisor.suggest(pattern);
    }

    public List<QueryOptimizationRule> getOptimizationRules() {
        return QueryRules.DEFAULT_RULES;
    }

    // ========== 批量执行 ==========

    /**
     * 加入批次：满批立即下发，否则在防抖时间后下发
     * 返回的 future 与同批次其他查询的结果互不影响
     */
    public CompletableFuture<QueryResult> batchQuery(String sql, List<Object> params) {
        CacheProperties.Query cfg = config;
        if (!cfg.isEnableBatching()) {
            return submit(sql, params);
        }

        BatchItem item = new BatchItem(sql, params, new CompletableFuture<>());
        boolean flushNow = false;
        batchLock.lock();
        try {
            pendingBatch.add(item);
            if (pendingBatch.size() >= cfg.getBatchSize()) {
                flushNow = true;
            } else if (batchFlushTask == null) {
                batchFlushTask = scheduler.schedule(this::executeBatch, cfg.getBatchDebounceMs(), TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            pendingBatch.remove(item);
            item.future().completeExceptionally(e);
        } finally {
            batchLock.unlock();
        }

        if (flushNow) {
            executeBatch();
        }
        return item.future();
    }

    void executeBatch() {
        List<BatchItem> batch;
        batchLock.lock();
        try {
            if (batchFlushTask != null) {
                batchFlushTask.cancel(false);
                batchFlushTask = null;
            }
            batch = new ArrayList<>(pendingBatch);
            pendingBatch.clear();
        } finally {
            batchLock.unlock();
        }

        if (batch.isEmpty()) {
            return;
        }
        log.debug("Executing query batch: size={}", batch.size());
        for (BatchItem item : batch) {
            submit(item.sql(), item.params()).whenComplete((result, error) -> {
                if (error != null) {
                    item.future().completeExceptionally(unwrap(error));
                } else {
                    item.future().complete(result);
                }
            });
        }
    }

    // ========== 统计与配置 ==========

    public QueryAnalytics getQueryAnalytics() {
        CacheProperties.Query cfg = config;
        List<QueryMetrics> all;
        List<QueryPattern> patterns;
        stateLock.lock();
        try {
            all = queryMetrics.values().stream().flatMap(List::stream).toList();
            patterns = queryPatterns.values().stream().map(QueryPattern::copy).toList();
        } finally {
            stateLock.unlock();
        }

        int total = all.size();
        int slow = (int) all.stream().filter(m -> m.executionTime() > cfg.getSlowQueryThresholdMs()).count();
        long hits = all.stream().filter(QueryMetrics::cacheHit).count();
        double avgTime = total > 0
            ? all.stream().mapToDouble(QueryMetrics::executionTime).sum() / total
            : 0;

        List<QueryAnalytics.SlowQuery> topSlow = patterns.stream()
            .filter(p -> p.getAverageExecutionTime() > cfg.getSlowQueryThresholdMs())
            .sorted(Comparator.comparingDouble(QueryPattern::getAverageExecutionTime).reversed())
            .limit(TOP_SLOW_QUERIES)
            .map(p -> new QueryAnalytics.SlowQuery(p.getPattern(), p.getAverageExecutionTime(), p.getFrequency()))
            .toList();

        double avgScore = patterns.isEmpty()
            ? 10
            : patterns.stream().mapToDouble(QueryPattern::getOptimizationScore).average().orElse(10);

        return new QueryAnalytics(total, slow, avgTime, total > 0 ? (double) hits / total : 0, topSlow, avgScore);
    }

    /**
     * 平均耗时超过慢查询阈值的模式数量
     */
    public int getSlowPatternCount() {
        long threshold = config.getSlowQueryThresholdMs();
        stateLock.lock();
        try {
            return (int) queryPatterns.values().stream()
                .filter(p -> p.getAverageExecutionTime() > threshold)
                .count();
        } finally {
            stateLock.unlock();
        }
    }

    public List<DatabaseIndex> getIndexRecommendations() {
        stateLock.lock();
        try {
            return List.copyOf(suggestedIndexes);
        } finally {
            stateLock.unlock();
        }
    }

    public List<QueryPattern> getQueryPatterns() {
        stateLock.lock();
        try {
            return queryPatterns.values().stream().map(QueryPattern::copy).toList();
        } finally {
            stateLock.unlock();
        }
    }

    public List<QueryMetrics> getQueryHistory(String queryId) {
        stateLock.lock();
        try {
            List<QueryMetrics> history = queryMetrics.get(queryId);
            return history == null ? List.of() : List.copyOf(history);
        } finally {
            stateLock.unlock();
        }
    }

    public CacheProperties.Query getConfiguration() {
        return config.copy();
    }

    /**
     * 在当前配置的副本上应用修改后整体替换，并持久化
     */
    public void updateConfiguration(Consumer<CacheProperties.Query> changes) {
        CacheProperties.Query updated = config.copy();
        changes.accept(updated);
        config = updated;
        persistConfiguration();
        log.info("Query optimization configuration updated: {}", updated);
    }

    /**
     * 清空查询结果缓存，返回清理的缓存层条目数
     */
    public int clearQueryCache() {
        List<String> keys;
        stateLock.lock();
        try {
            keys = new ArrayList<>(cachedResultKeys.keySet());
            cachedResultKeys.clear();
        } finally {
            stateLock.unlock();
        }
        for (String key : keys) {
            try {
                cacheTier.remove(key);
            } catch (RuntimeException e) {
                log.warn("Failed to remove cached query result: key={}", key, e);
            }
        }
        int persisted = stateStore.removeByPrefix(CacheConstants.QUERY_RESULT_PREFIX);
        log.info("Query cache cleared: tierEntries={}, persistedEntries={}", keys.size(), persisted);
        return keys.size();
    }

    // ========== 周期优化 ==========

    void runOptimizationCycle() {
        runStep("analyzePatterns", this::analyzeQueryPatterns);
        runStep("indexRecommendations", this::generateIndexRecommendations);
        runStep("cleanup", this::cleanupOldMetrics);
        runStep("persist", this::persistOptimizationData);
    }

    void generateIndexRecommendations() {
        stateLock.lock();
        try {
            suggestedIndexes = IndexAdvisor.aggregate(
                queryPatterns.values(), INDEX_MIN_FREQUENCY, CacheConstants.MAX_INDEX_SUGGESTIONS);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 清理 24 小时前的执行记录，以及 24 小时未执行且低频的模式
     */
    void cleanupOldMetrics() {
        long cutoff = clock.millis() - CacheConstants.ONE_DAY_MS;
        int removedPatterns = 0;
        stateLock.lock();
        try {
            var metricsIt = queryMetrics.entrySet().iterator();
            while (metricsIt.hasNext()) {
                var entry = metricsIt.next();
                List<QueryMetrics> kept = entry.getValue().stream()
                    .filter(m -> m.timestamp() > cutoff)
                    .collect(Collectors.toCollection(ArrayList::new));
                if (kept.isEmpty()) {
                    metricsIt.remove();
                } else {
                    entry.setValue(kept);
                }
            }
            var patternIt = queryPatterns.values().iterator();
            while (patternIt.hasNext()) {
                QueryPattern pattern = patternIt.next();
                if (pattern.getLastExecuted() < cutoff && pattern.getFrequency() < PATTERN_KEEP_FREQUENCY) {
                    patternIt.remove();
                    removedPatterns++;
                }
            }
        } finally {
            stateLock.unlock();
        }
        if (removedPatterns > 0) {
            log.info("Stale query patterns removed: count={}", removedPatterns);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (optimizationTask != null) {
            optimizationTask.cancel(false);
        }
        executeBatch();
        scheduler.shutdownNow();
        batchExecutor.shutdown();
        try {
            if (!batchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                batchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            batchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        persistOptimizationData();
        persistConfiguration();
        log.info("DatabaseOptimizationService shutdown");
    }

    // ========== 私有方法 ==========

    private CompletableFuture<QueryResult> submit(String sql, List<Object> params) {
        try {
            return CompletableFuture.supplyAsync(() -> executeQuery(sql, params), batchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String generateQueryId(String sql, List<Object> parameters) {
        String paramJson = "";
        if (!parameters.isEmpty()) {
            try {
                paramJson = objectMapper.writeValueAsString(parameters);
            } catch (JsonProcessingException e) {
                paramJson = parameters.toString();
            }
        }
        return KeyDigests.shortId(QueryNormalizer.normalize(sql), paramJson);
    }

    private QueryResult getCachedResult(String queryId) {
        String key = CacheConstants.QUERY_RESULT_PREFIX + queryId;
        try {
            Object cached = cacheTier.get(key);
            if (cached instanceof QueryResult result) {
                stateLock.lock();
                try {
                    cachedResultKeys.get(key);
                } finally {
                    stateLock.unlock();
                }
                return result;
            }
            return null;
        } catch (RuntimeException e) {
            log.error("Failed to get cached query result: queryId={}", queryId, e);
            return null;
        }
    }

    private void cacheQueryResult(String queryId, QueryResult result, long ttlMs) {
        String key = CacheConstants.QUERY_RESULT_PREFIX + queryId;
        try {
            CacheWriteOptions options = new CacheWriteOptions(
                Duration.ofMillis(ttlMs), CachePriority.MEDIUM,
                result.rows().size() > COMPRESSION_ROW_THRESHOLD, true);
            if (cacheTier.set(key, result, options)) {
                stateLock.lock();
                try {
                    cachedResultKeys.put(key, Boolean.TRUE);
                } finally {
                    stateLock.unlock();
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to cache query result: queryId={}", queryId, e);
        }
    }

    private static boolean shouldCacheQuery(String sql, QueryResult result, CacheProperties.Query cfg) {
        if (QueryNormalizer.isWriteStatement(sql) || result.write()) {
            return false;
        }
        if (result.rows().size() > cfg.getMaxResultSetSize()) {
            return false;
        }
        return !QueryNormalizer.hasVolatileTimeFunction(sql);
    }

    private void recordQueryMetrics(QueryMetrics metrics) {
        CacheProperties.Query cfg = config;
        String pattern = QueryNormalizer.normalize(metrics.sql());

        stateLock.lock();
        try {
            List<QueryMetrics> history = queryMetrics.computeIfAbsent(metrics.queryId(), id -> new ArrayList<>());
            history.add(metrics);
            if (history.size() > CacheConstants.MAX_EXECUTIONS_PER_QUERY) {
                history.subList(0, history.size() - CacheConstants.MAX_EXECUTIONS_PER_QUERY).clear();
            }

            QueryPattern queryPattern = queryPatterns.get(pattern);
            if (queryPattern == null) {
                queryPattern = QueryPattern.create(pattern, QueryNormalizer.isCacheable(pattern));
            }
            queryPattern.recordExecution(metrics.executionTime(), metrics.timestamp());
            queryPattern.setOptimizationScore(calculateOptimizationScore(queryPattern, cfg.getSlowQueryThresholdMs()));
            queryPattern.setIndexSuggestions(new ArrayList<>(IndexAdvisor.suggest(pattern)));
            queryPatterns.put(pattern, queryPattern);
        } finally {
            stateLock.unlock();
        }

        analyzeQueryPerformance(metrics, cfg);

        int persistEvery = Math.max(1, cfg.getPersistEveryExecutions());
        if (executionCounter.incrementAndGet() % persistEvery == 0) {
            persistMetrics();
        }
    }

    static double calculateOptimizationScore(QueryPattern pattern, long slowQueryThresholdMs) {
        double score = 10;
        if (pattern.getAverageExecutionTime() > slowQueryThresholdMs) {
            score -= SLOW_PATTERN_PENALTY;
        }
        for (QueryOptimizationRule rule : QueryRules.DEFAULT_RULES) {
            if (rule.matches(pattern.getPattern())) {
                score -= rule.impact() * 0.1;
            }
        }
        return clampScore(score);
    }

    private void analyzeQueryPerformance(QueryMetrics metrics, CacheProperties.Query cfg) {
        if (metrics.executionTime() > cfg.getSlowQueryThresholdMs()) {
            log.warn("Slow query detected: queryId={}, time={}ms", metrics.queryId(), metrics.executionTime());
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("queryId", metrics.queryId());
            metadata.put("resultCount", metrics.resultCount());
            metadata.put("sql", preview(metrics.sql()));
            metricsSink.recordMetric("slow_database_query", metrics.executionTime(), metrics.timestamp(), "api", metadata);
        }
        if (metrics.resultCount() > cfg.getMaxResultSetSize()) {
            log.warn("Large result set: queryId={}, rows={}", metrics.queryId(), metrics.resultCount());
            metricsSink.recordMetric("large_database_result", metrics.resultCount(), metrics.timestamp(), "api",
                Map.of("queryId", metrics.queryId()));
        }
    }

    private void analyzeQueryPatterns() {
        long threshold = config.getSlowQueryThresholdMs();
        long slowFrequent;
        long poorlyOptimized;
        stateLock.lock();
        try {
            slowFrequent = queryPatterns.values().stream()
                .filter(p -> p.getFrequency() > FREQUENT_PATTERN_THRESHOLD && p.getAverageExecutionTime() > threshold)
                .count();
            poorlyOptimized = queryPatterns.values().stream()
                .filter(p -> p.getOptimizationScore() < POOR_SCORE_THRESHOLD)
                .count();
        } finally {
            stateLock.unlock();
        }
        if (slowFrequent > 0) {
            log.warn("Found {} frequently executed slow queries", slowFrequent);
        }
        if (poorlyOptimized > 0) {
            log.warn("Found {} poorly optimized queries", poorlyOptimized);
        }
    }

    private void loadStoredData() {
        stateStore.load(CacheConstants.DB_PATTERNS_KEY, new TypeReference<List<QueryPattern>>() {})
            .ifPresent(stored -> withLock(() -> {
                queryPatterns.clear();
                stored.forEach(p -> queryPatterns.put(p.getPattern(), p));
            }));
        stateStore.load(CacheConstants.DB_INDEXES_KEY, new TypeReference<List<DatabaseIndex>>() {})
            .ifPresent(stored -> withLock(() -> suggestedIndexes = List.copyOf(stored)));
        stateStore.load(CacheConstants.DB_METRICS_KEY, new TypeReference<Map<String, List<QueryMetrics>>>() {})
            .ifPresent(stored -> withLock(() -> {
                queryMetrics.clear();
                stored.forEach((id, history) -> queryMetrics.put(id, new ArrayList<>(history)));
            }));
        stateStore.load(CacheConstants.DB_CONFIG_KEY, CacheProperties.Query.class)
            .ifPresent(stored -> config = stored);
    }

    private void persistMetrics() {
        Map<String, List<QueryMetrics>> snapshot = new LinkedHashMap<>();
        stateLock.lock();
        try {
            queryMetrics.forEach((id, history) -> {
                int from = Math.max(0, history.size() - CacheConstants.PERSISTED_EXECUTIONS_PER_QUERY);
                snapshot.put(id, List.copyOf(history.subList(from, history.size())));
            });
        } finally {
            stateLock.unlock();
        }
        stateStore.save(CacheConstants.DB_METRICS_KEY, snapshot);
    }

    private void persistOptimizationData() {
        List<QueryPattern> patterns;
        List<DatabaseIndex> indexes;
        stateLock.lock();
        try {
            patterns = queryPatterns.values().stream().map(QueryPattern::copy).toList();
            indexes = suggestedIndexes;
        } finally {
            stateLock.unlock();
        }
        stateStore.save(CacheConstants.DB_PATTERNS_KEY, patterns);
        stateStore.save(CacheConstants.DB_INDEXES_KEY, indexes);
        persistMetrics();
    }

    private void persistConfiguration() {
        stateStore.save(CacheConstants.DB_CONFIG_KEY, config);
    }

    private int patternCount() {
        stateLock.lock();
        try {
            return queryPatterns.size();
        } finally {
            stateLock.unlock();
        }
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (Exception e) {
            log.error("Query optimization step failed: {}", name, e);
        }
    }

    private void withLock(Runnable action) {
        stateLock.lock();
        try {
            action.run();
        } finally {
            stateLock.unlock();
        }
    }

    private static double clampScore(double score) {
        return Math.max(0, Math.min(10, score));
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        return sql.length() > SQL_PREVIEW_LENGTH ? sql.substring(0, SQL_PREVIEW_LENGTH) : sql;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record BatchItem(String sql, List<Object> params, CompletableFuture<QueryResult> future) {
    }
}
