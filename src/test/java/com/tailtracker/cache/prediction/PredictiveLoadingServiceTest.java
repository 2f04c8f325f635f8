package com.tailtracker.cache.prediction;

import com.tailtracker.cache.config.CacheProperties;
import com.tailtracker.cache.config.JacksonConfig;
import com.tailtracker.cache.service.InMemoryKeyValueStore;
import com.tailtracker.cache.service.JsonStateStore;
import com.tailtracker.cache.spi.CachePriority;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.CacheWriteOptions;
import com.tailtracker.cache.spi.DeviceState;
import com.tailtracker.cache.spi.MetricsSink;
import com.tailtracker.cache.spi.PredictionDataLoader;
import com.tailtracker.cache.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 预测加载服务单元测试
 */
@ExtendWith(MockitoExtension.class)
class PredictiveLoadingServiceTest {

    private static final DeviceState WIFI = new DeviceState("wifi", true, 1.0, false, false);

    @Mock
    private CacheTier memoryTier;

    @Mock
    private PredictionDataLoader dataLoader;

    @Mock
    private MetricsSink metricsSink;

    private CacheProperties properties;
    private MutableClock clock;
    private DeviceState deviceState;
    private PredictiveLoadingService predictiveService;

    @BeforeEach
    void setUp() {
        properties = new CacheProperties();
        properties.getPredictor().setAutoStart(false);
        clock = new MutableClock(1_700_000_000_000L);
        deviceState = WIFI;
        predictiveService = createService();
    }

    @AfterEach
    void tearDown() {
        predictiveService.shutdown();
    }

    @Test
    @DisplayName("重复行为累加频次，置信度在 [0, 1] 内")
    void testRecordUserAction() {
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));

        predictiveService.recordUserAction("view_pet_profile", null, 120);
        predictiveService.recordUserAction("view_pet_profile", null, 80);

        List<PredictivePattern> patterns = predictiveService.getPatterns();
        assertEquals(1, patterns.size());
        PredictivePattern pattern = patterns.get(0);
        assertEquals(2, pattern.getFrequency());
        assertEquals(100, pattern.getAverageLoadTime(), 1e-9);
        assertEquals(1.0, pattern.getSuccessRate(), 1e-9);
        assertTrue(pattern.getConfidence() >= 0 && pattern.getConfidence() <= 1);
    }

    @Test
    @DisplayName("超时的加载计为失败")
    void testSlowLoadCountsAsFailure() {
        predictiveService.recordUserAction("view_photos", null, 6000);

        assertEquals(0.0, predictiveService.getPatterns().get(0).getSuccessRate(), 1e-9);
    }

    @Test
    @DisplayName("高置信度模式生成立即加载预测")
    void testGeneratePredictions() {
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        List<PredictionResult> predictions = predictiveService.generatePredictions("/pets");

        assertEquals(1, predictions.size());
        PredictionResult prediction = predictions.get(0);
        assertEquals("pet_profile_data", prediction.dataType());
        assertEquals(LoadingType.IMMEDIATE, prediction.strategy().type());
        assertEquals(CachePriority.HIGH, prediction.strategy().priority());
        assertTrue(prediction.probability() <= 1.0);
        assertTrue(predictiveService.hasActivePrediction("pet_profile_data"));

        clock.advance(Duration.ofMillis(prediction.cacheDurationMs() + 1));
        assertFalse(predictiveService.hasActivePrediction("pet_profile_data"));
    }

    @Test
    @DisplayName("未登记的行为不生成预测")
    void testUnknownActionProducesNoPrediction() {
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("open_settings", null, 100);

        assertTrue(predictiveService.generatePredictions("/pets").isEmpty());
    }

    @Test
    @DisplayName("超过保留期的模式不参与预测")
    void testExpiredPatternsIgnored() {
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        clock.advance(Duration.ofDays(31));

        assertTrue(predictiveService.generatePredictions("/pets").isEmpty());
    }

    @Test
    @DisplayName("关闭后不生成预测")
    void testDisabled() {
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        predictiveService.disable();

        assertFalse(predictiveService.isEnabled());
        assertTrue(predictiveService.generatePredictions("/pets").isEmpty());
    }

    @Test
    @DisplayName("蜂窝网络未充电时降级为后台加载")
    void testCellularDowngrade() {
        PredictivePattern pattern = new PredictivePattern();
        LoadingContext cellular = LoadingContext.empty().withNetwork("cellular").withBattery(0.8, false);

        LoadingStrategy strategy = PredictiveLoadingService.determineLoadingStrategy(pattern, cellular, 0.9);

        assertEquals(LoadingType.BACKGROUND, strategy.type());
        assertEquals(CachePriority.MEDIUM, strategy.priority());
        assertEquals(5000, strategy.timeoutMs());

        LoadingStrategy charging = PredictiveLoadingService.determineLoadingStrategy(
            pattern, cellular.withBattery(0.8, true), 0.9);
        assertEquals(LoadingType.IMMEDIATE, charging.type());
    }

    @Test
    @DisplayName("低电量只按需加载")
    void testLowBatteryOnDemand() {
        PredictivePattern pattern = new PredictivePattern();
        pattern.setAverageLoadTime(200);
        LoadingContext lowBattery = LoadingContext.empty().withNetwork("wifi").withBattery(0.1, false);

        LoadingStrategy strategy = PredictiveLoadingService.determineLoadingStrategy(pattern, lowBattery, 0.95);

        assertEquals(LoadingType.ON_DEMAND, strategy.type());
        assertEquals(CachePriority.LOW, strategy.priority());
        assertEquals(300, strategy.timeoutMs());
    }

    @Test
    @DisplayName("缓存时长按置信度、频次、电量调整")
    void testCacheDuration() {
        PredictivePattern pattern = new PredictivePattern();
        pattern.setConfidence(0.9);
        pattern.setFrequency(11);

        long full = PredictiveLoadingService.cacheDuration(pattern, LoadingContext.empty());
        long lowBattery = PredictiveLoadingService.cacheDuration(pattern,
            LoadingContext.empty().withBattery(0.2, false));

        assertEquals(3 * 60 * 60 * 1000L, full);
        assertEquals(full / 2, lowBattery);
    }

    @Test
    @DisplayName("模式数量超过上限时淘汰最久未使用的")
    void testPatternCapacity() {
        predictiveService.shutdown();
        properties.getPredictor().setMaxPatterns(2);
        predictiveService = createService();

        predictiveService.recordUserAction("view_pet_profile", null, 100);
        predictiveService.recordUserAction("view_photos", null, 100);
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        predictiveService.recordUserAction("view_reminders", null, 100);

        List<PredictivePattern> patterns = predictiveService.getPatterns();
        assertEquals(2, patterns.size());
        assertEquals(List.of("view_pet_profile", "view_reminders"),
            patterns.stream().map(PredictivePattern::primaryAction).toList());
    }

    @Test
    @DisplayName("立即加载写入内存层并计入成功")
    void testExecuteImmediateLoading() throws Exception {
        Map<String, Object> profile = Map.of("name", "Rex");
        when(dataLoader.load("pet_profile_data")).thenReturn(profile);
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        predictiveService.executePredictiveLoading(predictiveService.generatePredictions("/pets"));

        verify(memoryTier).set(eq(PredictiveLoadingService.prefetchKey("pet_profile_data")), eq(profile),
            any(CacheWriteOptions.class));
        PredictorMetrics metrics = predictiveService.getMetrics();
        assertEquals(1, metrics.totalPredictions());
        assertEquals(1, metrics.successfulPredictions());
    }

    @Test
    @DisplayName("加载失败计入失败预测")
    void testLoaderFailure() throws Exception {
        when(dataLoader.load(anyString())).thenThrow(new IllegalStateException("backend down"));
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        predictiveService.executePredictiveLoading(predictiveService.generatePredictions("/pets"));

        assertEquals(1, predictiveService.getMetrics().failedPredictions());
        verify(memoryTier, never()).set(anyString(), any(), any(CacheWriteOptions.class));
    }

    @Test
    @DisplayName("整体成功率低于 0.6 时所有模式置信度乘 0.9")
    void testAccuracyDecay() {
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        double before = predictiveService.getPatterns().get(0).getConfidence();

        predictiveService.optimizePredictionAccuracy();

        assertEquals(before * 0.9, predictiveService.getPatterns().get(0).getConfidence(), 1e-9);
        assertEquals(0.0, predictiveService.getMetrics().averagePredictionAccuracy(), 1e-9);
    }

    @Test
    @DisplayName("整体成功率高于 0.8 时只提升高成功率模式，上限 1.0")
    void testAccuracyBoost() throws Exception {
        when(dataLoader.load("pet_profile_data")).thenReturn(Map.of("name", "Rex"));
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        predictiveService.recordUserAction("open_settings", null, 100);
        predictiveService.recordUserAction("open_help", null, 6000);
        predictiveService.executePredictiveLoading(predictiveService.generatePredictions("/pets"));
        Map<String, Double> before = confidenceByAction();

        predictiveService.optimizePredictionAccuracy();

        Map<String, Double> after = confidenceByAction();
        assertEquals(Math.min(before.get("view_pet_profile") * 1.1, 1.0), after.get("view_pet_profile"), 1e-9);
        assertEquals(before.get("open_settings") * 1.1, after.get("open_settings"), 1e-9);
        assertEquals(before.get("open_help"), after.get("open_help"), 1e-9);
        assertTrue(after.get("view_pet_profile") <= 1.0);
        assertEquals(1.0, predictiveService.getMetrics().averagePredictionAccuracy(), 1e-9);
    }

    @Test
    @DisplayName("清理 30 天未用且置信度低于 0.3 的模式")
    void testCleanupOldPatterns() {
        predictiveService.recordUserAction("view_pet_profile", null, 100);
        for (int i = 0; i < 12; i++) {
            predictiveService.optimizePredictionAccuracy();
        }
        assertTrue(predictiveService.getPatterns().get(0).getConfidence() < 0.3);
        predictiveService.recordUserAction("view_photos", null, 100);

        clock.advance(Duration.ofDays(31));
        predictiveService.cleanupOldPatterns();

        assertEquals(List.of("view_photos"),
            predictiveService.getPatterns().stream().map(PredictivePattern::primaryAction).toList());
    }

    @Test
    @DisplayName("预测数量按网络和电量限制")
    void testPredictionCountLimits() {
        List<String> actions = List.of("view_pet_profile", "view_health_records", "view_photos",
            "view_family", "view_reminders", "view_lost_pets");

        assertEquals(6, predictionsFor(actions, new DeviceState("wifi", true, 1.0, false, false)));
        assertEquals(3, predictionsFor(actions, new DeviceState("cellular", true, 1.0, false, false)));
        assertEquals(2, predictionsFor(actions, new DeviceState("wifi", true, 0.25, false, false)));

        properties.getPredictor().setMaxPredictionsWifi(4);
        assertEquals(4, predictionsFor(actions, new DeviceState("wifi", true, 1.0, false, false)));
    }

    @Test
    @DisplayName("后台加载按 1 秒错峰执行")
    void testBackgroundLoadsAreStaggered() throws Exception {
        when(dataLoader.load(anyString())).thenReturn(Map.of("id", 1));

        predictiveService.executePredictiveLoading(List.of(
            prediction("pet_profile_data", LoadingType.BACKGROUND),
            prediction("photo_gallery_data", LoadingType.BACKGROUND)));

        verify(dataLoader, timeout(500)).load("pet_profile_data");
        verify(dataLoader, after(300).never()).load("photo_gallery_data");
        verify(dataLoader, timeout(3000)).load("photo_gallery_data");
    }

    @Test
    @DisplayName("抢先队列只在后台且联网时消化")
    void testPreemptiveQueueDrainsOnlyInBackground() throws Exception {
        when(dataLoader.load(anyString())).thenReturn(Map.of("id", 1));

        predictiveService.executePredictiveLoading(List.of(prediction("care_reminders_data", LoadingType.PREEMPTIVE)));
        assertEquals(1, predictiveService.getMetrics().queueLength());

        deviceState = new DeviceState("wifi", false, 1.0, false, true);
        predictiveService.onAppStateChanged(true);
        verify(dataLoader, after(200).never()).load(anyString());
        assertEquals(1, predictiveService.getMetrics().queueLength());

        deviceState = new DeviceState("wifi", true, 1.0, false, true);
        predictiveService.onNetworkStateChanged(true);

        verify(dataLoader, timeout(2000)).load("care_reminders_data");
        assertEquals(0, predictiveService.getMetrics().queueLength());
    }

    @Test
    @DisplayName("执行中到达的预测排队执行，不被丢弃")
    void testConcurrentLoadingIsQueued() throws Exception {
        PredictionResult nested = prediction("photo_gallery_data", LoadingType.IMMEDIATE);
        when(dataLoader.load("pet_profile_data")).thenAnswer(invocation -> {
            predictiveService.executePredictiveLoading(List.of(nested));
            return Map.of("name", "Rex");
        });
        when(dataLoader.load("photo_gallery_data")).thenReturn(Map.of("photos", 3));

        predictiveService.executePredictiveLoading(List.of(prediction("pet_profile_data", LoadingType.IMMEDIATE)));

        verify(dataLoader).load("photo_gallery_data");
        assertEquals(2, predictiveService.getMetrics().successfulPredictions());
    }

    @Test
    @DisplayName("清空模式")
    void testClearAllPatterns() {
        predictiveService.recordUserAction("view_pet_profile", null, 100);

        predictiveService.clearAllPatterns();

        assertTrue(predictiveService.getPatterns().isEmpty());
    }

    // ========== 私有方法 ==========

    private Map<String, Double> confidenceByAction() {
        return predictiveService.getPatterns().stream()
            .collect(Collectors.toMap(PredictivePattern::primaryAction, PredictivePattern::getConfidence));
    }

    private int predictionsFor(List<String> actions, DeviceState device) {
        predictiveService.clearAllPatterns();
        deviceState = device;
        predictiveService.updateContext(LoadingContext.ofRoute("/pets"));
        for (String action : actions) {
            predictiveService.recordUserAction(action, null, 100);
        }
        return predictiveService.generatePredictions("/pets").size();
    }

    private static PredictionResult prediction(String dataType, LoadingType type) {
        CachePriority priority = type == LoadingType.IMMEDIATE ? CachePriority.HIGH : CachePriority.LOW;
        return new PredictionResult(dataType, 0.5,
            new LoadingStrategy(type, priority, 1, 1, 5000, true), 1024, 60_000);
    }

    private PredictiveLoadingService createService() {
        PredictiveLoadingService service = new PredictiveLoadingService(
            properties,
            memoryTier,
            dataLoader,
            () -> deviceState,
            new JsonStateStore(new InMemoryKeyValueStore(), JacksonConfig.createObjectMapper()),
            metricsSink,
            new SimpleMeterRegistry(),
            clock);
        service.initialize();
        return service;
    }
}
