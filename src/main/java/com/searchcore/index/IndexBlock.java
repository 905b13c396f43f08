package com.searchcore.index;

import com.searchcore.storage.BufferReader;
import com.searchcore.storage.BufferWriter;
import com.searchcore.storage.GrowableBuffer;

/**
 * 倒排块：一段连续条目的编码字节及其首尾docId。
 * 块内第一个条目的差值为 0，之后每个条目相对前一个条目编码差值。
 */
public final class IndexBlock {
    private long firstId;
    private long lastId;
    private int numEntries;
    private final GrowableBuffer buffer;
    private final BufferWriter writer;

    IndexBlock(long firstId, int initialCapacity) {
        this.firstId = firstId;
        this.lastId = firstId;
        this.buffer = new GrowableBuffer(initialCapacity);
        this.writer = new BufferWriter(buffer);
    }

    public long firstId() {
        return firstId;
    }

    public long lastId() {
        return lastId;
    }

    public int numEntries() {
        return numEntries;
    }

    /**
     * 已编码的字节数。
     */
    public int byteLength() {
        return buffer.offset();
    }

    public int capacity() {
        return buffer.capacity();
    }

    BufferWriter writer() {
        return writer;
    }

    /**
     * 当前已写内容的读取快照。
     */
    BufferReader newReader() {
        return new BufferReader(buffer);
    }

    /**
     * 空块写入第一个条目前，把首尾docId对齐到该条目。
     */
    void rebase(long docId) {
        firstId = docId;
        lastId = docId;
    }

    void appended(long docId) {
        lastId = docId;
        numEntries++;
    }

    void release() {
        buffer.release();
    }
}
