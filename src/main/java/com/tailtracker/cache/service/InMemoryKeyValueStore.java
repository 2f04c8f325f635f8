package com.tailtracker.cache.service;

import com.tailtracker.cache.spi.KeyValueStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内键值存储，宿主应用未提供持久化实现时使用
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, String> store = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public void set(String key, String value) {
        store.put(key, value);
    }

    @Override
    public void remove(String key) {
        store.remove(key);
    }

    @Override
    public Map<String, String> multiGet(Collection<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : keys) {
            String value = store.get(key);
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }

    @Override
    public void multiRemove(Collection<String> keys) {
        keys.forEach(store::remove);
    }

    @Override
    public Set<String> getAllKeys() {
        return Set.copyOf(store.keySet());
    }
}
