package com.tailtracker.cache.exception;

/**
 * 缓存引擎异常基类
 */
public class CacheEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CacheEngineException(String message) {
        super(message);
    }

    public CacheEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
