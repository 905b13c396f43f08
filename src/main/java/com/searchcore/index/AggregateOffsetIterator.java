package com.searchcore.index;

import java.util.List;

/**
 * 聚合结果的位置归并迭代器
 *
 * 对每个子结果的位置流做惰性 k 路归并，每次取当前最小值并推进对应子流。
 */
final class AggregateOffsetIterator implements OffsetIterator {
    private final OffsetIterator[] iterators;
    private final int[] heads;
    private final IndexResult[] terms;
    private IndexResult currentTerm;

    AggregateOffsetIterator(List<IndexResult> children) {
        int size = children.size();
        this.iterators = new OffsetIterator[size];
        this.heads = new int[size];
        this.terms = new IndexResult[size];
        for (int i = 0; i < size; i++) {
            iterators[i] = children.get(i).iterateOffsets();
            heads[i] = iterators[i].next();
            terms[i] = iterators[i].currentTerm();
        }
    }

    @Override
    public int next() {
        int minIndex = -1;
        int minValue = EOF;
        for (int i = 0; i < heads.length; i++) {
            if (heads[i] < minValue) {
                minIndex = i;
                minValue = heads[i];
            }
        }
        if (minIndex == -1) {
            return EOF;
        }
        currentTerm = terms[minIndex];
        heads[minIndex] = iterators[minIndex].next();
        terms[minIndex] = iterators[minIndex].currentTerm();
        return minValue;
    }

    @Override
    public IndexResult currentTerm() {
        return currentTerm;
    }
}
