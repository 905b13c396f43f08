package com.searchcore.index;

import com.searchcore.storage.BufferReader;

/**
 * 遍历单个词项结果的位置向量。
 */
final class VectorOffsetIterator implements OffsetIterator {
    private final BufferReader reader;
    private final IndexResult term;
    private int lastValue;

    VectorOffsetIterator(OffsetVector vector, IndexResult term) {
        this.reader = new BufferReader(vector.data(), vector.start(), vector.start() + vector.length());
        this.term = term;
    }

    @Override
    public int next() {
        if (reader.atEnd()) {
            return EOF;
        }
        lastValue += (int) reader.readVarint();
        return lastValue;
    }

    @Override
    public IndexResult currentTerm() {
        return term;
    }
}
