package com.searchcore.query;

import com.searchcore.index.IndexResult;

/**
 * 补集节点，产出 [1, maxDocId] 中子节点不包含的docId。
 */
public final class NotIterator implements IndexIterator {
    private final ChildCursor cursor;
    private final long maxDocId;
    private final IndexResult result;
    private long lastDocId;
    private boolean atEnd;

    public NotIterator(IndexIterator child, long maxDocId, double weight) {
        this.cursor = new ChildCursor(child);
        this.maxDocId = maxDocId;
        this.result = IndexResult.virtual(weight);
    }

    @Override
    public ReadStatus read() {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        long next = lastDocId + 1;
        while (next <= maxDocId && cursor.contains(next)) {
            next++;
        }
        if (next > maxDocId) {
            atEnd = true;
            return ReadStatus.EOF;
        }
        position(next);
        return ReadStatus.OK;
    }

    /**
     * 子节点包含目标时返回 NOT_FOUND，此时 lastDocId 停在目标上。
     */
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
        return cursor.contains(docId) ? ReadStatus.NOT_FOUND : ReadStatus.OK;
    }

    private void position(long docId) {
        lastDocId = docId;
        result.setDocId(docId);
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

    public long maxDocId() {
        return maxDocId;
    }

    @Override
    public void close() {
        cursor.child().close();
    }
}
