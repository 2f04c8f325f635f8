package com.tailtracker.cache.exception;

/**
 * 查询执行失败
 * 指标记录完成后抛给 executeQuery / batchQuery 的调用方
 */
public class QueryExecutionException extends CacheEngineException {

    private static final long serialVersionUID = 1L;

    private final String queryId;

    public QueryExecutionException(String queryId, String message, Throwable cause) {
        super(message, cause);
        this.queryId = queryId;
    }

    public QueryExecutionException(String message) {
        super(message);
        this.queryId = null;
    }

    public String getQueryId() {
        return queryId;
    }
}
