package com.tailtracker.cache.spi;

/**
 * 物理缓存层可调参数
 */
public record TierSettings(long maxSizeBytes, boolean compressionEnabled) {

    public TierSettings withMaxSizeBytes(long newMaxSizeBytes) {
        return new TierSettings(newMaxSizeBytes, compressionEnabled);
    }

    public TierSettings withCompressionEnabled(boolean enabled) {
        return new TierSettings(maxSizeBytes, enabled);
    }
}
