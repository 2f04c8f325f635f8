package com.tailtracker.cache.health;

import com.tailtracker.cache.orchestrator.CacheOrchestrator;
import com.tailtracker.cache.orchestrator.PerformanceReport;
import com.tailtracker.cache.spi.CacheTier;
import com.tailtracker.cache.spi.TierStatistics;
import com.tailtracker.cache.telemetry.AlertSeverity;
import com.tailtracker.cache.telemetry.AlertType;
import com.tailtracker.cache.telemetry.CacheAnalyticsService;
import com.tailtracker.cache.telemetry.CacheMetrics;
import com.tailtracker.cache.telemetry.PerformanceAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 缓存引擎健康检查测试
 */
@ExtendWith(MockitoExtension.class)
class CacheEngineHealthIndicatorTest {

    @Mock
    private CacheOrchestrator orchestrator;

    @Mock
    private CacheAnalyticsService analytics;

    @Mock
    private CacheTier memoryTier;

    @InjectMocks
    private CacheEngineHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        PerformanceReport report = new PerformanceReport(92.4, "A", "excellent", Map.of(),
            new CacheMetrics(), List.of(), 0L);
        when(orchestrator.getPerformanceReport()).thenReturn(report);
        lenient().when(memoryTier.getStatistics()).thenReturn(new TierStatistics(9, 1, 0.9, 1024, 0, 0, 12.5, 1.0));
    }

    @Test
    @DisplayName("无严重告警时为 UP")
    void testHealthUp() {
        when(analytics.getActiveAlerts()).thenReturn(List.of());

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("A", health.getDetails().get("grade"));
        assertEquals(92L, health.getDetails().get("score"));
        assertEquals(0.9, health.getDetails().get("memory_tier_hit_rate"));
    }

    @Test
    @DisplayName("存在 CRITICAL 告警时为 DOWN")
    void testCriticalAlertDown() {
        PerformanceAlert alert = new PerformanceAlert("alert_1", AlertType.MEMORY_PRESSURE, AlertSeverity.CRITICAL,
            "Memory utilization is 97.0%, exceeding threshold", Map.of(), 0L, false, new ArrayList<>());
        when(analytics.getActiveAlerts()).thenReturn(List.of(alert));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(1L, health.getDetails().get("critical_alerts"));
    }

    @Test
    @DisplayName("内存层异常时为 DOWN")
    void testTierFailureDown() {
        when(memoryTier.getStatistics()).thenThrow(new IllegalStateException("tier closed"));
        when(analytics.getActiveAlerts()).thenReturn(List.of());

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DOWN", health.getDetails().get("memory_tier"));
    }
}
