package com.tailtracker.cache.orchestrator;

/**
 * 读取时探测的层级范围
 */
public enum CacheLevel {
    /** 内存 → 预测预取 → 资源 → 查询，依次探测 */
    AUTO,
    /** 只读内存层 */
    MEMORY
}
