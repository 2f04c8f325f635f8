package com.tailtracker.cache.exception;

/**
 * 持久化存储读写失败（调用方记录日志后吞掉，不影响主流程）
 */
public class PersistenceException extends CacheEngineException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
