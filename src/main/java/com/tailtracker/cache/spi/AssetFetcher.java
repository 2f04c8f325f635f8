package com.tailtracker.cache.spi;

/**
 * CDN 资源拉取
 */
public interface AssetFetcher {

    /**
     * 拉取资源，不可用时返回 null
     */
    Object fetchAsset(String key);

    void registerAsset(String key, Object descriptor);

    AssetMetrics getMetrics();
}
