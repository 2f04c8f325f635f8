package com.tailtracker.cache.spi;

/**
 * 图片处理管线
 */
public interface ImagePipeline {

    void analyzeImage(String key, Object source);

    ImageStats getOptimizationStats();

    int getCompressionQuality();

    void setCompressionQuality(int quality);
}
