package com.searchcore.query;

import com.searchcore.index.IndexReader;
import com.searchcore.index.IndexResult;

/**
 * 把倒排读取器包装为查询树叶子节点。
 */
public final class ReadIterator implements IndexIterator {
    private final IndexReader reader;

    public ReadIterator(IndexReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("读取器不能为null");
        }
        this.reader = reader;
    }

    @Override
    public ReadStatus read() {
        return reader.read();
    }

    @Override
    public ReadStatus skipTo(long docId) {
        return reader.skipTo(docId);
    }

    @Override
    public IndexResult current() {
        return reader.current();
    }

    @Override
    public long lastDocId() {
        return reader.lastDocId();
    }

    @Override
    public boolean hasNext() {
        return reader.hasNext();
    }

    @Override
    public void abort() {
        reader.abort();
    }

    @Override
    public void rewind() {
        reader.rewind();
    }

    @Override
    public long estimatedCount() {
        return reader.estimatedCount();
    }

    public IndexReader reader() {
        return reader;
    }

    @Override
    public void close() {
        reader.close();
    }
}
