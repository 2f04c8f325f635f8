package com.tailtracker.cache.telemetry;

/**
 * 性能告警类型
 */
public enum AlertType {
    HIGH_MISS_RATE("high_miss_rate"),
    MEMORY_PRESSURE("memory_pressure"),
    PERFORMANCE_DEGRADATION("performance_degradation"),
    HIGH_EVICTION_RATE("high_eviction_rate"),
    HIGH_ERROR_RATE("high_error_rate"),
    NETWORK_ISSUES("network_issues");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
