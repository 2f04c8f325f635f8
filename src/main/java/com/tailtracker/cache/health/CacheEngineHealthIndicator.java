package com.tailtracker.cache.health;

import com.tailtracker.cache.orchestrator.CacheOrchestrator;
import com.tailtracker.cache.orchestrator.PerformanceReport;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.TierStatistics;
import com.tailtracker.cache.telemetry.AlertSeverity;
import com.tailtracker.cache.telemetry.CacheAnalyticsService;
import com.tailtracker.cache.telemetry.PerformanceAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 缓存引擎健康检查
 * 存在未确认的 CRITICAL 告警时为 DOWN
 */
@Slf4j
@Component("cacheEngineHealthIndicator")
@RequiredArgsConstructor
public class CacheEngineHealthIndicator implements HealthIndicator {

    private final CacheOrchestrator orchestrator;
    private final CacheAnalyticsService analytics;
    private final CacheTier memoryTier;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        // 1. 性能报告
        try {
            PerformanceReport report = orchestrator.getPerformanceReport();
            details.put("grade", report.grade());
            details.put("status", report.status());
            details.put("score", Math.round(report.overallScore()));
            details.put("degradation", orchestrator.getLastDegradation());
        } catch (Exception e) {
            log.error("Performance report health check failed", e);
            details.put("report_error", e.getMessage());
            healthy = false;
        }

        // 2. 内存缓存层
        try {
            TierStatistics stats = memoryTier.getStatistics();
            details.put("memory_tier_usage", stats.usagePercentage());
            details.put("memory_tier_hit_rate", stats.hitRate());
        } catch (Exception e) {
            log.error("Memory tier health check failed", e);
            details.put("memory_tier", "DOWN");
            details.put("memory_tier_error", e.getMessage());
            healthy = false;
        }

        // 3. 告警
        try {
            List<PerformanceAlert> alerts = analytics.getActiveAlerts();
            long critical = alerts.stream().filter(a -> a.getSeverity() == AlertSeverity.CRITICAL).count();
            details.put("active_alerts", alerts.size());
            details.put("critical_alerts", critical);
            if (critical > 0) {
                healthy = false;
            }
        } catch (Exception e) {
            log.error("Alert health check failed", e);
            details.put("alerts_error", e.getMessage());
            healthy = false;
        }

        if (healthy) {
            return Health.up().withDetails(details).build();
        } else {
            return Health.down().withDetails(details).build();
        }
    }
}
