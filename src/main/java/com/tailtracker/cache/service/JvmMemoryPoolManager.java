package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.MemoryPoolManager;
import com.tailtracker.cache.spi.MemoryPoolStats;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 JVM 堆内存池的内存管理
 * 碎片率按已提交但未使用的比例估算
 */
@Slf4j
public class JvmMemoryPoolManager implements MemoryPoolManager {

    @Override
    public List<MemoryPoolStats> getPools() {
        List<MemoryPoolStats> pools = new ArrayList<>();
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getType() != MemoryType.HEAP || !pool.isValid()) {
                continue;
            }
            MemoryUsage usage = pool.getUsage();
            long committed = usage.getCommitted();
            double fragmentation = committed > 0 ? 1.0 - (double) usage.getUsed() / committed : 0;
            pools.add(new MemoryPoolStats(pool.getName(), committed, usage.getUsed(), Math.max(0, fragmentation)));
        }
        return pools;
    }

    @Override
    public long compact(String poolId) {
        long before = poolUsed(poolId);
        System.gc();
        long reclaimed = Math.max(0, before - poolUsed(poolId));
        log.info("Memory pool compacted: pool={}, reclaimed={}B", poolId, reclaimed);
        return reclaimed;
    }

    @Override
    public long collectGarbage() {
        Runtime runtime = Runtime.getRuntime();
        long before = runtime.totalMemory() - runtime.freeMemory();
        System.gc();
        long after = runtime.totalMemory() - runtime.freeMemory();
        return Math.max(0, before - after);
    }

    private long poolUsed(String poolId) {
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            if (pool.getName().equals(poolId)) {
                return pool.getUsage().getUsed();
            }
        }
        return 0;
    }
}
