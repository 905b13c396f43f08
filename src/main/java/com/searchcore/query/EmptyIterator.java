package com.searchcore.query;

import com.searchcore.index.IndexResult;

/**
 * 永远 EOF 的迭代器，代替没有索引的子表达式。
 */
public final class EmptyIterator implements IndexIterator {
    private final IndexResult result = IndexResult.virtual(0);

    @Override
    public ReadStatus read() {
        return ReadStatus.EOF;
    }

    @Override
    public ReadStatus skipTo(long docId) {
        return ReadStatus.EOF;
    }

    @Override
    public IndexResult current() {
        return result;
    }

    @Override
    public long lastDocId() {
        return 0;
    }

    @Override
    public boolean hasNext() {
        return false;
    }

    @Override
    public void abort() {
    }

    @Override
    public void rewind() {
    }

    @Override
    public long estimatedCount() {
        return 0;
    }

    @Override
    public void close() {
    }
}
