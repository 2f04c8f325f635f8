package com.tailtracker.cache.telemetry;

/**
 * 监控采集时的统计来源
 */
@FunctionalInterface
public interface TelemetrySnapshotSource {

    TelemetrySnapshot collect();
}
