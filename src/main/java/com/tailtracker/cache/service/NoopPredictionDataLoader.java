package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.PredictionDataLoader;

/**
 * 未注册数据加载器时的空实现，返回 null 计为失败预测
 */
public class NoopPredictionDataLoader implements PredictionDataLoader {

    @Override
    public Object load(String dataType) {
        return null;
    }
}
