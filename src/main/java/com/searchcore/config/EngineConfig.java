package com.searchcore.config;

import com.searchcore.query.TimeoutPolicy;

/**
 * 引擎运行时配置
 *
 * 显式传入倒排索引、文档表与查询执行器，覆盖Constants默认值
 */
public class EngineConfig {
    private int indexBlockSize = Constants.INDEX_BLOCK_SIZE;
    private int docTableInitialCapacity = Constants.DEFAULT_DOC_TABLE_INITIAL_CAPACITY;
    private int maxDocTableSize = Constants.DEFAULT_DOC_TABLE_MAX_SIZE;
    private long queryTimeoutMs = Constants.DEFAULT_QUERY_TIMEOUT_MS;
    private TimeoutPolicy timeoutPolicy = TimeoutPolicy.RETURN;
    private int maxResultsToUnsortedMode = Constants.DEFAULT_MAX_RESULTS_TO_UNSORTED_MODE;

    public int getIndexBlockSize() {
        return indexBlockSize;
    }

    public void setIndexBlockSize(int indexBlockSize) {
        if (indexBlockSize <= 0) {
            throw new IllegalArgumentException("倒排块大小必须为正数: " + indexBlockSize);
        }
        this.indexBlockSize = indexBlockSize;
    }

    public int getDocTableInitialCapacity() {
        return docTableInitialCapacity;
    }

    public void setDocTableInitialCapacity(int docTableInitialCapacity) {
        this.docTableInitialCapacity = docTableInitialCapacity;
    }

    public int getMaxDocTableSize() {
        return maxDocTableSize;
    }

    public void setMaxDocTableSize(int maxDocTableSize) {
        if (maxDocTableSize <= 0 || maxDocTableSize > Constants.MAX_DOC_TABLE_SIZE) {
            throw new IllegalArgumentException("文档表最大容量超出范围: " + maxDocTableSize);
        }
        this.maxDocTableSize = maxDocTableSize;
    }

    public long getQueryTimeoutMs() {
        return queryTimeoutMs;
    }

    public void setQueryTimeoutMs(long queryTimeoutMs) {
        this.queryTimeoutMs = queryTimeoutMs;
    }

    public TimeoutPolicy getTimeoutPolicy() {
        return timeoutPolicy;
    }

    public void setTimeoutPolicy(TimeoutPolicy timeoutPolicy) {
        this.timeoutPolicy = timeoutPolicy;
    }

    public int getMaxResultsToUnsortedMode() {
        return maxResultsToUnsortedMode;
    }

    public void setMaxResultsToUnsortedMode(int maxResultsToUnsortedMode) {
        this.maxResultsToUnsortedMode = maxResultsToUnsortedMode;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
