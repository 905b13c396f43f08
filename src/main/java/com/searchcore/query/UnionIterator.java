package com.searchcore.query;

import com.searchcore.index.IndexResult;

import java.util.List;

/**
 * 并集节点
 *
 * 每次产出所有存活子节点中最小的docId，聚合结果挂上所有位于该docId的子结果。
 * quickExit 模式只挂第一个命中的子结果，适合只关心是否命中的场景。
 * 子节点中 docId 为 0 的条目被跳过。
 */
public final class UnionIterator implements IndexIterator {
    private final IndexIterator[] children;
    private final long[] childIds;
    private final boolean[] exhausted;
    private final boolean quickExit;
    private final IndexResult result;
    private long lastDocId;
    private boolean atEnd;

    public UnionIterator(List<? extends IndexIterator> children, boolean quickExit, double weight) {
        if (children == null) {
            throw new IllegalArgumentException("子迭代器列表不能为null");
        }
        this.children = children.toArray(new IndexIterator[0]);
        this.childIds = new long[this.children.length];
        this.exhausted = new boolean[this.children.length];
        this.quickExit = quickExit;
        this.result = IndexResult.union(this.children.length, weight);
        this.atEnd = this.children.length == 0;
    }

    @Override
    public ReadStatus read() {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        long minId = Long.MAX_VALUE;
        for (int i = 0; i < children.length; i++) {
            if (exhausted[i]) {
                continue;
            }
            // 落后于上次产出的子节点先推进
            while (childIds[i] <= lastDocId) {
                if (children[i].read() == ReadStatus.EOF) {
                    exhausted[i] = true;
                    break;
                }
                childIds[i] = children[i].lastDocId();
            }
            if (!exhausted[i] && childIds[i] < minId) {
                minId = childIds[i];
            }
        }
        return collect(minId);
    }

    @Override
    public ReadStatus skipTo(long docId) {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        long minId = Long.MAX_VALUE;
        for (int i = 0; i < children.length; i++) {
            if (exhausted[i]) {
                continue;
            }
            if (childIds[i] < docId) {
                ReadStatus status = children[i].skipTo(docId);
                if (status == ReadStatus.NOT_FOUND && children[i].lastDocId() <= docId) {
                    // 子节点在目标处不命中，取其下一个结果
                    status = children[i].read();
                }
                if (status == ReadStatus.EOF) {
                    exhausted[i] = true;
                    continue;
                }
                childIds[i] = children[i].lastDocId();
            }
            if (childIds[i] < minId) {
                minId = childIds[i];
            }
        }
        ReadStatus status = collect(minId);
        if (status == ReadStatus.EOF) {
            return status;
        }
        return lastDocId == docId ? ReadStatus.OK : ReadStatus.NOT_FOUND;
    }

    private ReadStatus collect(long minId) {
        if (minId == Long.MAX_VALUE) {
            atEnd = true;
            return ReadStatus.EOF;
        }
        result.resetAggregate();
        for (int i = 0; i < children.length; i++) {
            if (!exhausted[i] && childIds[i] == minId) {
                result.addChild(children[i].current());
                if (quickExit) {
                    break;
                }
            }
        }
        lastDocId = minId;
        return ReadStatus.OK;
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
        for (IndexIterator child : children) {
            child.abort();
        }
    }

    @Override
    public void rewind() {
        for (int i = 0; i < children.length; i++) {
            children[i].rewind();
            childIds[i] = 0;
            exhausted[i] = false;
        }
        result.resetAggregate();
        result.setFreq(0);
        lastDocId = 0;
        atEnd = children.length == 0;
    }

    /**
     * 各子节点估计之和。
     */
    @Override
    public long estimatedCount() {
        long total = 0;
        for (IndexIterator child : children) {
            total += child.estimatedCount();
        }
        return total;
    }

    public int numChildren() {
        return children.length;
    }

    @Override
    public void close() {
        for (IndexIterator child : children) {
            child.close();
        }
    }
}
