package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.AssetFetcher;
import com.tailtracker.cache.spi.AssetMetrics;

/**
 * 未接入 CDN 时的空实现
 */
public class NoopAssetFetcher implements AssetFetcher {

    @Override
    public Object fetchAsset(String key) {
        return null;
    }

    @Override
    public void registerAsset(String key, Object descriptor) {
    }

    @Override
    public AssetMetrics getMetrics() {
        return AssetMetrics.empty();
    }
}
