package com.tailtracker.cache.spi;

import java.util.List;

/**
 * 内存池管理
 */
public interface MemoryPoolManager {

    List<MemoryPoolStats> getPools();

    /**
     * 压缩整理指定内存池，返回回收字节数
     */
    long compact(String poolId);

    /**
     * 全局垃圾回收，返回回收字节数
     */
    long collectGarbage();
}
