package com.tailtracker.cache.prediction;

/**
 * 预取加载方式
 */
public enum LoadingType {
    /** 同步立即加载 */
    IMMEDIATE,
    /** 后台错峰加载 */
    BACKGROUND,
    /** 等待实际请求时加载 */
    ON_DEMAND,
    /** 应用进入后台且联网时加载 */
    PREEMPTIVE
}
