package com.tailtracker.cache.orchestrator;

/**
 * 写入选项
 *
 * @param skipPrediction 为 true 时不记录用户行为
 */
public record SetOptions(CacheStrategy strategy, boolean skipPrediction) {

    public SetOptions {
        if (strategy == null) {
            strategy = CacheStrategy.auto();
        }
    }

    public static SetOptions defaults() {
        return new SetOptions(CacheStrategy.auto(), false);
    }

    public static SetOptions of(CacheStrategy strategy) {
        return new SetOptions(strategy, !strategy.enablePrediction());
    }

    public SetOptions skippingPrediction() {
        return new SetOptions(strategy, true);
    }
}
