package com.tailtracker.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailtracker.cache.exception.PersistenceException;
import com.tailtracker.cache.spi.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * JSON 快照读写
 * 持久化失败只记录日志，不影响调用方
 */
@Slf4j
@Component
public class JsonStateStore {

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;

    public JsonStateStore(KeyValueStore keyValueStore, ObjectMapper objectMapper) {
        this.keyValueStore = keyValueStore;
        this.objectMapper = objectMapper;
    }

    public <T> Optional<T> load(String key, Class<T> type) {
        try {
            Optional<String> json = keyValueStore.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException | PersistenceException e) {
            log.error("Failed to load persisted state: key={}", key, e);
            return Optional.empty();
        }
    }

    public <T> Optional<T> load(String key, TypeReference<T> type) {
        try {
            Optional<String> json = keyValueStore.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException | PersistenceException e) {
            log.error("Failed to load persisted state: key={}", key, e);
            return Optional.empty();
        }
    }

    /**
     * @return 是否写入成功
     */
    public boolean save(String key, Object value) {
        try {
            keyValueStore.set(key, objectMapper.writeValueAsString(value));
            return true;
        } catch (JsonProcessingException | PersistenceException e) {
            log.error("Failed to persist state: key={}", key, e);
            return false;
        }
    }

    /**
     * 删除指定前缀的全部 Key，返回删除数量
     */
    public int removeByPrefix(String prefix) {
        try {
            List<String> keys = keyValueStore.getAllKeys().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();
            if (!keys.isEmpty()) {
                keyValueStore.multiRemove(keys);
            }
            return keys.size();
        } catch (PersistenceException e) {
            log.error("Failed to remove persisted state by prefix: prefix={}", prefix, e);
            return 0;
        }
    }

    public void remove(String key) {
        try {
            keyValueStore.remove(key);
        } catch (PersistenceException e) {
            log.error("Failed to remove persisted state: key={}", key, e);
        }
    }
}
