package com.searchcore.query;

import com.searchcore.index.IndexResult;

import java.util.List;

/**
 * 交集节点
 *
 * 维护一个候选docId，把落后的子节点 skipTo 到候选：
 * - 子节点越过候选时，以子节点位置作为新候选重来
 * - 子节点在候选处返回不命中（Not 节点的排除）时，候选加一
 * - 全部子节点落在候选上时，再检查字段掩码与邻近度，通过则产出
 *
 * 任一子节点 EOF 即整体 EOF。候选从 docId 1 开始，子节点中 docId 为 0 的条目不参与求交。
 */
public final class IntersectIterator implements IndexIterator {
    private static final long FIRST_DOC_ID = 1;

    private final IndexIterator[] children;
    private final long[] childIds;
    private final long fieldMask;
    private final int maxSlop;
    private final boolean inOrder;
    private final IndexResult result;
    private long nextTarget = FIRST_DOC_ID;
    private long lastDocId;
    private boolean atEnd;

    /**
     * @param children 子迭代器
     * @param fieldMask 聚合字段掩码必须与之有交集
     * @param maxSlop 允许的最大间隔，小于 0 表示不检查邻近度
     * @param inOrder 是否要求子节点的词按顺序出现
     * @param weight 结果权重
     */
    public IntersectIterator(List<? extends IndexIterator> children, long fieldMask, int maxSlop,
                             boolean inOrder, double weight) {
        if (children == null) {
            throw new IllegalArgumentException("子迭代器列表不能为null");
        }
        this.children = children.toArray(new IndexIterator[0]);
        this.childIds = new long[this.children.length];
        this.fieldMask = fieldMask;
        this.maxSlop = maxSlop;
        this.inOrder = inOrder;
        this.result = IndexResult.intersection(this.children.length, weight);
        this.atEnd = this.children.length == 0;
    }

    @Override
    public ReadStatus read() {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        return advanceFrom(nextTarget);
    }

    @Override
    public ReadStatus skipTo(long docId) {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        ReadStatus status = advanceFrom(Math.max(docId, nextTarget));
        if (status == ReadStatus.EOF) {
            return status;
        }
        return lastDocId == docId ? ReadStatus.OK : ReadStatus.NOT_FOUND;
    }

    /**
     * 找到第一个不小于 target 的交集结果。
     */
    private ReadStatus advanceFrom(long target) {
        while (true) {
            int matched = 0;
            for (int i = 0; i < children.length; i++) {
                if (childIds[i] < target) {
                    ReadStatus status = children[i].skipTo(target);
                    if (status == ReadStatus.EOF) {
                        atEnd = true;
                        return ReadStatus.EOF;
                    }
                    if (status == ReadStatus.NOT_FOUND && children[i].lastDocId() <= target) {
                        // 子节点排除了候选
                        break;
                    }
                    childIds[i] = children[i].lastDocId();
                }
                if (childIds[i] > target) {
                    break;
                }
                matched++;
            }

            if (matched < children.length) {
                long overshoot = childIds[matched];
                target = overshoot > target ? overshoot : target + 1;
                continue;
            }

            result.resetAggregate();
            for (IndexIterator child : children) {
                result.addChild(child.current());
            }
            nextTarget = target + 1;
            if ((result.fieldMask() & fieldMask) != 0
                    && (maxSlop < 0 || result.isWithinRange(maxSlop, inOrder))) {
                lastDocId = target;
                return ReadStatus.OK;
            }
            target++;
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
        for (IndexIterator child : children) {
            child.abort();
        }
    }

    @Override
    public void rewind() {
        for (int i = 0; i < children.length; i++) {
            children[i].rewind();
            childIds[i] = 0;
        }
        result.resetAggregate();
        result.setFreq(0);
        nextTarget = FIRST_DOC_ID;
        lastDocId = 0;
        atEnd = children.length == 0;
    }

    /**
     * 子节点估计的最小值。
     */
    @Override
    public long estimatedCount() {
        long min = Long.MAX_VALUE;
        for (IndexIterator child : children) {
            min = Math.min(min, child.estimatedCount());
        }
        return children.length == 0 ? 0 : min;
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
