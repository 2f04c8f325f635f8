package com.tailtracker.cache.orchestrator;

import com.tailtracker.cache.prediction.PredictiveLoadingService;
import com.tailtracker.cache.prediction.PredictorMetrics;
import com.tailtracker.cache.spi.AssetFetcher;
import com.tailtracker.cache.spi.AssetMetrics;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.ImagePipeline;
import com.tailtracker.cache.spi.ImageStats;
import com.tailtracker.cache.spi.MemoryPoolManager;
import com.tailtracker.cache.spi.MemoryPoolStats;
import com.tailtracker.cache.spi.TierStatistics;
import com.tailtracker.cache.telemetry.TelemetrySnapshot;
import com.tailtracker.cache.telemetry.TelemetrySnapshotSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 从各缓存层拉取统计供遥测服务汇总
 * 单个来源失败时以空统计代替
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TierSnapshotCollector implements TelemetrySnapshotSource {

    private final CacheTier memoryTier;
    private final AssetFetcher assetFetcher;
    private final ImagePipeline imagePipeline;
    private final MemoryPoolManager memoryPoolManager;
    private final PredictiveLoadingService predictor;

    @Override
    public TelemetrySnapshot collect() {
        TierStatistics tierStats = TierStatistics.empty();
        AssetMetrics assetMetrics = AssetMetrics.empty();
        ImageStats imageStats = ImageStats.empty();
        long totalPredictions = 0;
        long successfulPredictions = 0;
        double fragmentation = 0;

        try {
            tierStats = memoryTier.getStatistics();
        } catch (Exception e) {
            log.error("Failed to collect memory tier statistics", e);
        }
        try {
            assetMetrics = assetFetcher.getMetrics();
        } catch (Exception e) {
            log.error("Failed to collect asset metrics", e);
        }
        try {
            imageStats = imagePipeline.getOptimizationStats();
        } catch (Exception e) {
            log.error("Failed to collect image statistics", e);
        }
        try {
            PredictorMetrics predictorMetrics = predictor.getMetrics();
            totalPredictions = predictorMetrics.totalPredictions();
            successfulPredictions = predictorMetrics.successfulPredictions();
        } catch (Exception e) {
            log.error("Failed to collect predictor metrics", e);
        }
        try {
            fragmentation = memoryPoolManager.getPools().stream()
                .mapToDouble(MemoryPoolStats::fragmentationLevel)
                .max()
                .orElse(0);
        } catch (Exception e) {
            log.error("Failed to collect memory pool statistics", e);
        }

        return new TelemetrySnapshot(tierStats, assetMetrics, imageStats,
            totalPredictions, successfulPredictions, fragmentation);
    }
}
