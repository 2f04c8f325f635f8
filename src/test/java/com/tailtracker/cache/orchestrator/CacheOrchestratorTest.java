package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.config.JacksonConfig;
import com.tailtracker.cache.exception.QueryExecutionException;
import com.tailtracker.cache.prediction.LoadingContext;
import com.tailtracker.cache.prediction.LoadingStrategy;
import com.tailtracker.cache.prediction.LoadingType;
import com.tailtracker.cache.prediction.PredictionResult;
import com.tailtracker.cache.prediction.PredictiveLoadingService;
import com.tailtracker.cache.prediction.PredictorMetrics;
import com.tailtracker.cache.query.DatabaseOptimizationService;
import com.tailtracker.cache.query.QueryAnalytics;
import com.tailtracker.cache.service.CaffeineCacheTier;
import com.tailtracker.cache.service.PayloadSizeEstimator;
import com.tailtracker.cache.spi.AssetFetcher;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.ImagePipeline;
import com.tailtracker.cache.spi.ImageStats;
import com.tailtracker.cache.spi.MemoryPoolManager;
import com.tailtracker.cache.spi.MemoryPoolStats;
import com.tailtracker.cache.spi.QueryResult;
import com.tailtracker.cache.support.FakeTicker;
import com.tailtracker.cache.support.MutableClock;
import com.tailtracker.cache.telemetry.CacheAnalyticsService;
import com.tailtracker.cache.telemetry.CacheEventType;
import com.tailtracker.cache.telemetry.CacheMetrics;
import com.tailtracker.cache.telemetry.CacheSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 缓存编排门面单元测试
 */
@ExtendWith(MockitoExtension.class)
class CacheOrchestratorTest {

    @Mock
    private CacheAnalyticsService analytics;

    @Mock
    private PredictiveLoadingService predictor;

    @Mock
    private DatabaseOptimizationService queryAdvisor;

    @Mock
    private AssetFetcher assetFetcher;

    @Mock
    private ImagePipeline imagePipeline;

    @Mock
    private MemoryPoolManager memoryPoolManager;

    private FakeTicker ticker;
    private CaffeineCacheTier memoryTier;
    private CacheProperties properties;
    private CacheOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new CacheProperties();
        properties.getOrchestrator().setAutoStart(false);
        ticker = new FakeTicker();
        memoryTier = new CaffeineCacheTier(properties.getMemoryTier(),
            new PayloadSizeEstimator(JacksonConfig.createObjectMapper()), ticker);

        orchestrator = new CacheOrchestrator(
            properties,
            memoryTier,
            analytics,
            predictor,
            queryAdvisor,
            assetFetcher,
            imagePipeline,
            memoryPoolManager,
            new SimpleMeterRegistry(),
            new MutableClock(1_700_000_000_000L));
        orchestrator.initialize();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    // ========== 读取 ==========

    @Test
    @DisplayName("回源结果按 TTL 缓存，过期后再次回源")
    void testFallbackCachedUntilTtl() {
        AtomicInteger fallbackCalls = new AtomicInteger();
        GetOptions<String> options = GetOptions.<String>withFallback(() -> {
            fallbackCalls.incrementAndGet();
            return "v1";
        }).ttl(1000);

        CacheResult<String> first = orchestrator.get("k1", options);
        assertEquals("v1", first.value());
        assertFalse(first.fromCache());
        assertEquals(CacheSource.NETWORK, first.source());

        CacheResult<String> second = orchestrator.get("k1", options);
        assertEquals("v1", second.value());
        assertTrue(second.fromCache());
        assertEquals(CacheSource.MEMORY, second.source());
        assertEquals(1, fallbackCalls.get());

        ticker.advance(Duration.ofMillis(1001));
        CacheResult<String> third = orchestrator.get("k1", options);
        assertFalse(third.fromCache());
        assertEquals(2, fallbackCalls.get());
    }

    @Test
    @DisplayName("全部未命中且无回源返回空结果")
    void testMissWithoutFallback() {
        CacheResult<String> result = orchestrator.get("missing");

        assertFalse(result.isPresent());
        assertFalse(result.fromCache());
        verify(analytics).recordEvent(eq(CacheEventType.MISS), eq("missing"), anyDouble(), isNull(),
            eq(CacheSource.NETWORK), isNull());
    }

    @Test
    @DisplayName("回源抛异常时返回空结果并记录错误")
    void testFallbackFailure() {
        GetOptions<String> options = GetOptions.withFallback(() -> {
            throw new IllegalStateException("upstream down");
        });

        CacheResult<String> result = assertDoesNotThrow(() -> orchestrator.get("k3", options));

        assertFalse(result.isPresent());
        verify(analytics).recordEvent(eq(CacheEventType.ERROR), eq("k3"), anyDouble(), isNull(),
            eq(CacheSource.NETWORK), anyMap());
    }

    @Test
    @DisplayName("校验不通过的缓存值被删除并记为驱逐")
    void testValidationRejectsCachedValue() {
        orchestrator.set("k2", "stale", SetOptions.defaults().skippingPrediction());
        GetOptions<String> options = GetOptions.<String>defaults().validate(v -> !"stale".equals(v));

        CacheResult<String> result = orchestrator.get("k2", options);

        assertFalse(result.isPresent());
        assertNull(memoryTier.get("k2"));
        verify(analytics).recordEvent(CacheEventType.EVICTION, "k2", 0, CacheSource.MEMORY);
    }

    @Test
    @DisplayName("缓存值类型不符时视为未命中并回源")
    void testTypeMismatchFallsBack() {
        orchestrator.set("k3", 42, SetOptions.defaults().skippingPrediction());
        GetOptions<String> options = GetOptions.<String>withFallback(() -> "fresh").expecting(String.class);

        CacheResult<String> result = orchestrator.get("k3", options);

        assertEquals("fresh", result.value());
        assertFalse(result.fromCache());
        assertEquals("fresh", memoryTier.get("k3"));
    }

    @Test
    @DisplayName("未声明类型时校验函数遇到其他类型的值视为未命中")
    void testUntypedValidationOnWrongType() {
        orchestrator.set("k4", 42, SetOptions.defaults().skippingPrediction());
        GetOptions<String> options = GetOptions.<String>defaults().validate(String::isEmpty);

        CacheResult<String> result = orchestrator.get("k4", options);

        assertFalse(result.isPresent());
        assertNull(memoryTier.get("k4"));
    }

    @Test
    @DisplayName("取消后不再探测任何层，也不写回")
    void testCancelledGet() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger fallbackCalls = new AtomicInteger();
        GetOptions<String> options = GetOptions.<String>withFallback(() -> {
            fallbackCalls.incrementAndGet();
            return "v";
        }).cancellation(signal);

        CacheResult<String> result = orchestrator.get("asset:logo.svg", options);

        assertFalse(result.isPresent());
        assertEquals(0, fallbackCalls.get());
        assertNull(memoryTier.get("asset:logo.svg"));
        verify(predictor, never()).hasActivePrediction(anyString());
        verify(assetFetcher, never()).fetchAsset(anyString());
    }

    @Test
    @DisplayName("MEMORY 级别只查内存层")
    void testMemoryLevelOnly() {
        GetOptions<String> options = GetOptions.<String>defaults()
            .strategy(CacheStrategy.auto().withLevel(CacheLevel.MEMORY));

        CacheResult<String> result = orchestrator.get("asset:logo.svg", options);

        assertFalse(result.isPresent());
        verify(assetFetcher, never()).fetchAsset(anyString());
    }

    @Test
    @DisplayName("预测预取层命中")
    void testPredictiveTierHit() {
        when(predictor.hasActivePrediction("pet_profile_data")).thenReturn(true);
        memoryTier.set(PredictiveLoadingService.prefetchKey("pet_profile_data"), "profile",
            CacheWriteOptions.defaults());

        CacheResult<String> result = orchestrator.get("pet_profile_data");

        assertEquals("profile", result.value());
        assertTrue(result.fromCache());
    }

    @Test
    @DisplayName("资源层命中后写入内存层")
    void testAssetTierHit() {
        when(assetFetcher.fetchAsset("asset:logo.svg")).thenReturn("<svg/>");

        CacheResult<String> first = orchestrator.get("asset:logo.svg");
        CacheResult<String> second = orchestrator.get("asset:logo.svg");

        assertEquals("<svg/>", first.value());
        assertEquals(CacheSource.CDN, first.source());
        assertTrue(first.fromCache());
        assertEquals(CacheSource.MEMORY, second.source());
        verify(assetFetcher, times(1)).fetchAsset("asset:logo.svg");
    }

    @Test
    @DisplayName("查询 Key 交给查询顾问执行")
    void testQueryTierHit() {
        QueryResult rows = QueryResult.ofRows(List.of(Map.of("name", "Rex")));
        when(queryAdvisor.executeQuery("SELECT name FROM pets", List.of())).thenReturn(rows);

        CacheResult<QueryResult> result = orchestrator.get("query:SELECT name FROM pets");

        assertEquals(rows, result.value());
        assertEquals(CacheSource.NETWORK, result.source());
    }

    @Test
    @DisplayName("查询层失败时继续回源")
    void testQueryTierFailureFallsBack() {
        when(queryAdvisor.executeQuery(anyString(), anyList()))
            .thenThrow(new QueryExecutionException("q1", "Query execution failed: timeout", null));
        QueryResult fallbackRows = QueryResult.ofRows(List.of());

        CacheResult<QueryResult> result = orchestrator.get("select * from pets",
            GetOptions.withFallback(() -> fallbackRows));

        assertSame(fallbackRows, result.value());
        assertFalse(result.fromCache());
    }

    // ========== 写入 ==========

    @Test
    @DisplayName("写入按 Key 形态分发并记录用户行为")
    void testSetDispatch() {
        byte[] avatar = new byte[]{1, 2, 3};

        assertTrue(orchestrator.set("image:avatar-1", avatar));
        assertTrue(orchestrator.set("https://cdn.example.com/app.js", "code"));
        assertTrue(orchestrator.set("pet:1", Map.of("name", "Rex")));

        verify(imagePipeline).analyzeImage("image:avatar-1", avatar);
        verify(assetFetcher).registerAsset("https://cdn.example.com/app.js", "code");
        verify(assetFetcher, never()).registerAsset(eq("image:avatar-1"), any());
        verify(predictor, times(3)).recordUserAction(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("空 Key 或空值写入返回 false")
    void testSetRejectsNull() {
        assertFalse(orchestrator.set(null, "v"));
        assertFalse(orchestrator.set("k", null));
        verifyNoInteractions(predictor);
    }

    @Test
    @DisplayName("关闭预测时不记录用户行为")
    void testSetWithoutPrediction() {
        orchestrator.set("pet:1", "Rex", SetOptions.of(CacheStrategy.auto().withoutPrediction()));

        assertEquals("Rex", memoryTier.get("pet:1"));
        verify(predictor, never()).recordUserAction(anyString(), any(), anyDouble());
    }

    // ========== 预取与导航 ==========

    @Test
    @DisplayName("路由预取执行预测并记录预取事件")
    void testPrefetchForRoute() {
        PredictionResult prediction = new PredictionResult("pet_profile_data", 0.9,
            new LoadingStrategy(LoadingType.IMMEDIATE, CachePriority.HIGH, 1, 3, 5000, true), 2048, 3_600_000);
        when(predictor.generatePredictions("/pets")).thenReturn(List.of(prediction));

        List<PredictionResult> predictions = orchestrator.prefetchForRoute("/pets");

        assertEquals(List.of(prediction), predictions);
        verify(predictor).executePredictiveLoading(List.of(prediction));
        verify(analytics).recordEvent(eq(CacheEventType.PREFETCH), eq("pet_profile_data"), eq(0.0), eq(2048L),
            eq(CacheSource.MEMORY), anyMap());
    }

    @Test
    @DisplayName("导航记录为来源路由下的 view 行为")
    void testTrackNavigation() {
        orchestrator.trackNavigation("/home", "pet_profile", 120);

        InOrder inOrder = inOrder(predictor);
        inOrder.verify(predictor).updateContext(LoadingContext.ofRoute("/home"));
        inOrder.verify(predictor).recordUserAction("view_pet_profile", null, 120);
        inOrder.verify(predictor).updateContext(LoadingContext.ofRoute("pet_profile"));
    }

    // ========== 调优与健康检查 ==========

    @Test
    @DisplayName("驱逐率高时扩容并整理碎片化内存池")
    void testOptimizePerformance() {
        CacheMetrics before = new CacheMetrics();
        before.setEvictionRate(0.5);
        before.setCompressionRatio(0.5);
        when(analytics.refreshMetrics()).thenReturn(before);
        when(analytics.getAlertThresholds()).thenReturn(new CacheProperties.AlertThresholds());
        when(memoryPoolManager.getPools()).thenReturn(List.of(
            new MemoryPoolStats("images", 1000, 500, 0.5),
            new MemoryPoolStats("data", 1000, 500, 0.1)));
        when(memoryPoolManager.compact("images")).thenReturn(200L);

        OptimizationOutcome outcome = orchestrator.optimizePerformance();

        long configured = properties.getMemoryTier().getMaxSizeBytes();
        assertEquals((long) (configured * 1.5), memoryTier.getSettings().maxSizeBytes());
        verify(memoryPoolManager, never()).compact("data");
        assertTrue(outcome.actions().stream().anyMatch(a -> a.startsWith("Compacted memory pool images")));
        assertTrue(outcome.actions().stream().anyMatch(a -> a.startsWith("Increased memory tier size")));
        assertEquals(4, outcome.improvements().size());
    }

    @Test
    @DisplayName("退化评分")
    void testDegradationScore() {
        CacheMetrics base = metrics(0.9, 100, 1000);
        CacheMetrics degraded = metrics(0.6, 1100, 1500);

        assertEquals(0.3, CacheOrchestrator.degradationScore(base, degraded), 1e-9);
        assertEquals(0.0, CacheOrchestrator.degradationScore(degraded, base), 1e-9);
    }

    @Test
    @DisplayName("首次健康检查只建立基线，退化超阈值时自动调优")
    void testHealthCheckTriggersOptimization() {
        CacheMetrics base = metrics(0.9, 100, 1000);
        CacheMetrics degraded = metrics(0.6, 1100, 1500);
        when(analytics.getCurrentMetrics()).thenReturn(base, degraded);
        when(analytics.refreshMetrics()).thenReturn(degraded);
        when(analytics.getAlertThresholds()).thenReturn(new CacheProperties.AlertThresholds());

        orchestrator.runHealthCheck();
        verify(analytics, never()).refreshMetrics();

        orchestrator.runHealthCheck();
        assertEquals(0.3, orchestrator.getLastDegradation(), 1e-9);
        verify(analytics, times(2)).refreshMetrics();
    }

    @Test
    @DisplayName("性能报告加权评分")
    void testPerformanceReport() {
        CacheMetrics current = new CacheMetrics();
        current.setHitRatio(0.9);
        current.setMemoryUtilization(0.2);
        when(analytics.getCurrentMetrics()).thenReturn(current);
        when(queryAdvisor.getQueryAnalytics()).thenReturn(new QueryAnalytics(0, 0, 0, 0, List.of(), 8.0));
        when(imagePipeline.getOptimizationStats()).thenReturn(ImageStats.empty());
        when(predictor.getMetrics()).thenReturn(new PredictorMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0));

        PerformanceReport report = orchestrator.getPerformanceReport();

        assertEquals(89.0, report.overallScore(), 1e-9);
        assertEquals("B", report.grade());
        assertEquals("good", report.status());
        assertEquals(100.0, report.componentScores().get("images"), 1e-9);
    }

    @Test
    @DisplayName("等级与状态阈值")
    void testGradeAndStatus() {
        assertEquals("A", CacheOrchestrator.gradeOf(90));
        assertEquals("B", CacheOrchestrator.gradeOf(89.9));
        assertEquals("C", CacheOrchestrator.gradeOf(70));
        assertEquals("D", CacheOrchestrator.gradeOf(60));
        assertEquals("F", CacheOrchestrator.gradeOf(59.9));
        assertEquals("excellent", CacheOrchestrator.statusOf(95));
        assertEquals("good", CacheOrchestrator.statusOf(75));
        assertEquals("fair", CacheOrchestrator.statusOf(60));
        assertEquals("poor", CacheOrchestrator.statusOf(10));
    }

    @Test
    @DisplayName("Key 形态识别")
    void testKeyClassification() {
        assertTrue(CacheOrchestrator.isImageKey("image:1"));
        assertTrue(CacheOrchestrator.isImageKey("https://cdn.example.com/rex.JPG?w=200"));
        assertTrue(CacheOrchestrator.isAssetKey("asset:fonts"));
        assertTrue(CacheOrchestrator.isAssetKey("/static/app.css"));
        assertFalse(CacheOrchestrator.isAssetKey("pet:1"));
        assertEquals("SELECT 1", CacheOrchestrator.sqlOf("query: SELECT 1"));
        assertEquals("select id from pets", CacheOrchestrator.sqlOf("select id from pets"));
        assertNull(CacheOrchestrator.sqlOf("pet:1"));
    }

    // ========== 私有方法 ==========

    private static CacheMetrics metrics(double hitRatio, double responseTime, long memoryUsage) {
        CacheMetrics m = new CacheMetrics();
        m.setHitRatio(hitRatio);
        m.setTotalResponseTime(responseTime);
        m.setMemoryUsage(memoryUsage);
        return m;
    }
}
