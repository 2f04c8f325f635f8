package com.tailtracker.cache.spi;

/**
 * 缓存条目 / 加载任务优先级
 */
public enum CachePriority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    CachePriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
