package com.tailtracker.cache.orchestrator;

/**
 * 读取取消标记，取消后不再探测后续层，也不写缓存
 */
public final class CancellationSignal {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
