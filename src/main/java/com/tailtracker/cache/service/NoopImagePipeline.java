package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.ImagePipeline;
import com.tailtracker.cache.spi.ImageStats;

/**
 * 未接入图片管线时的空实现，只记住压缩质量
 */
public class NoopImagePipeline implements ImagePipeline {

    private volatile int compressionQuality = 80;

    @Override
    public void analyzeImage(String key, Object source) {
    }

    @Override
    public ImageStats getOptimizationStats() {
        return ImageStats.empty();
    }

    @Override
    public int getCompressionQuality() {
        return compressionQuality;
    }

    @Override
    public void setCompressionQuality(int quality) {
        this.compressionQuality = Math.max(1, Math.min(100, quality));
    }
}
