package com.tailtracker.cache.spi;

/**
 * 内存池快照
 *
 * @param fragmentationLevel 碎片率（0-1）
 */
public record MemoryPoolStats(String id, long size, long used, double fragmentationLevel) {

    public double utilization() {
        return size > 0 ? (double) used / size : 0;
    }
}
