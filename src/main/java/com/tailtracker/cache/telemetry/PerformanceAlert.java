package com.tailtracker.cache.telemetry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 性能告警
 * 同一类型同时最多存在一条未确认告警
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceAlert {

    private String id;
    private AlertType type;
    private AlertSeverity severity;
    private String message;
    private Map<String, Double> metrics;
    private long timestamp;
    private boolean acknowledged;
    private List<String> actions;

    public PerformanceAlert copy() {
        return new PerformanceAlert(id, type, severity, message,
            metrics != null ? Map.copyOf(metrics) : Map.of(), timestamp, acknowledged,
            actions != null ? new ArrayList<>(actions) : new ArrayList<>());
    }
}
