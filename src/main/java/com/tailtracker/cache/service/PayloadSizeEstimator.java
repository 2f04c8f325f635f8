package com.tailtracker.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 估算缓存数据的字节大小（按 JSON 序列化长度）
 */
@Slf4j
@Component
public class PayloadSizeEstimator {

    /** 无法序列化时的保守估计 */
    static final long UNKNOWN_SIZE = 1024;

    private final ObjectMapper objectMapper;

    public PayloadSizeEstimator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public long estimate(Object data) {
        if (data == null) {
            return 0;
        }
        if (data instanceof byte[] bytes) {
            return bytes.length;
        }
        if (data instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        try {
            return objectMapper.writeValueAsBytes(data).length;
        } catch (JsonProcessingException e) {
            log.debug("Payload size estimation fallback: type={}", data.getClass().getName());
            return UNKNOWN_SIZE;
        }
    }
}
