package com.searchcore.query;

import com.searchcore.config.Constants;
import com.searchcore.index.IndexResult;

/**
 * 可选节点，产出 [1, maxDocId] 中的每个docId。
 * 子节点命中时结果带上子结果的词频、字段掩码、位置与查询词，否则词频为 0。
 */
public final class OptionalIterator implements IndexIterator {
    private final ChildCursor cursor;
    private final long maxDocId;
    private final IndexResult result;
    private long lastDocId;
    private boolean atEnd;

    public OptionalIterator(IndexIterator child, long maxDocId, double weight) {
        this.cursor = new ChildCursor(child);
        this.maxDocId = maxDocId;
        this.result = IndexResult.virtual(weight);
    }

    @Override
    public ReadStatus read() {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        if (lastDocId + 1 > maxDocId) {
            atEnd = true;
            return ReadStatus.EOF;
        }
        position(lastDocId + 1);
        return ReadStatus.OK;
    }

    @Override
    public ReadStatus skipTo(long docId) {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        if (docId > maxDocId) {
            atEnd = true;
            return ReadStatus.EOF;
        }
        position(docId);
        return ReadStatus.OK;
    }

    private void position(long docId) {
        lastDocId = docId;
        result.setDocId(docId);
        if (cursor.contains(docId)) {
            IndexResult matched = cursor.child().current();
            result.setFreq(matched.freq());
            result.setFieldMask(matched.fieldMask());
            result.offsets().reset(matched.offsets());
            result.setTerm(matched.term());
        } else {
            result.setFreq(0);
            result.setFieldMask(Constants.FIELD_MASK_ALL);
            result.offsets().clear();
            result.setTerm(null);
        }
    }

    @Override
    public IndexResult current() {
        return result;
    }

    @Override
    public long lastDocId() {
        return lastDocId;
    }

    @Override
    public boolean hasNext() {
        return !atEnd;
    }

    @Override
    public void abort() {
        atEnd = true;
        cursor.child().abort();
    }

    @Override
    public void rewind() {
        cursor.rewind();
        lastDocId = 0;
        result.setDocId(0);
        atEnd = false;
    }

    @Override
    public long estimatedCount() {
        return maxDocId;
    }

    @Override
    public void close() {
        cursor.child().close();
    }
}
