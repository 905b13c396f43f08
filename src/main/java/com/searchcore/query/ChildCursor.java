package com.searchcore.query;

/**
 * 跟踪子迭代器的位置，回答“子节点是否包含某个docId”，供 Not 与 Optional 节点使用。
 * 查询的docId必须单调不减。
 */
final class ChildCursor {
    private final IndexIterator child;
    private long position;
    private boolean hit;
    private boolean exhausted;

    ChildCursor(IndexIterator child) {
        if (child == null) {
            throw new IllegalArgumentException("子迭代器不能为null");
        }
        this.child = child;
    }

    IndexIterator child() {
        return child;
    }

    boolean contains(long docId) {
        if (exhausted) {
            return false;
        }
        if (position < docId) {
            ReadStatus status = child.skipTo(docId);
            if (status == ReadStatus.EOF) {
                exhausted = true;
                return false;
            }
            if (status == ReadStatus.NOT_FOUND && child.lastDocId() <= docId) {
                // 子节点在目标处给出了不命中
                position = docId;
                hit = false;
                return false;
            }
            position = child.lastDocId();
            hit = true;
        }
        return hit && position == docId;
    }

    void rewind() {
        child.rewind();
        position = 0;
        hit = false;
        exhausted = false;
    }
}
