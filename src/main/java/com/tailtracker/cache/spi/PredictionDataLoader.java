package com.tailtracker.cache.spi;

/**
 * 按数据类型加载预测预取数据
 */
public interface PredictionDataLoader {

    /**
     * @return 加载到的数据，没有可加载内容时返回 null
     * @throws Exception 加载失败，计入失败预测
     */
    Object load(String dataType) throws Exception;
}
