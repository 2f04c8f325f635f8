package com.tailtracker.cache.spi;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 持久化键值存储
 * 各组件以 JSON 字符串形式保存指标、事件、告警、趋势、模式与配置
 *
 * <p>实现在读写失败时抛出 {@link com.tailtracker.cache.exception.PersistenceException}。
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);

    Map<String, String> multiGet(Collection<String> keys);

    void multiRemove(Collection<String> keys);

    Set<String> getAllKeys();
}
