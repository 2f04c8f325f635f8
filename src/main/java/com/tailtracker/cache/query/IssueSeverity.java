package com.tailtracker.cache.query;

public enum IssueSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
