package com.tailtracker.cache.spi;

/**
 * 图片压缩统计，averageCompressionRatio = 压缩后 / 原始大小
 */
public record ImageStats(long totalOriginalSize, long totalOptimizedSize, double averageCompressionRatio) {

    public static ImageStats empty() {
        return new ImageStats(0, 0, 1.0);
    }
}
