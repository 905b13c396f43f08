package com.searchcore.storage;

/**
 * 缓冲区读取器
 *
 * 读游标不会越过构造时刻的写游标；越界读取属于调用方契约错误，抛出 IndexOutOfBoundsException。
 */
public final class BufferReader {
    private final byte[] data;
    private final int start;
    private final int limit;
    private int position;

    /**
     * 读取缓冲区 [0, offset) 的快照。
     */
    public BufferReader(GrowableBuffer buffer) {
        this(buffer.array(), 0, buffer.offset());
    }

    /**
     * 读取字节数组 [start, limit) 区间。
     */
    public BufferReader(byte[] data, int start, int limit) {
        if (data == null) {
            throw new IllegalArgumentException("数据不能为null");
        }
        if (start < 0 || limit < start || limit > data.length) {
            throw new IndexOutOfBoundsException("读取区间非法: [" + start + ", " + limit + "), length=" + data.length);
        }
        this.data = data;
        this.start = start;
        this.limit = limit;
        this.position = start;
    }

    /**
     * 相对起点的已读字节数。
     */
    public int offset() {
        return position - start;
    }

    /**
     * 底层数组中的绝对读位置。
     */
    public int position() {
        return position;
    }

    public byte[] data() {
        return data;
    }

    public boolean atEnd() {
        return position >= limit;
    }

    public int remaining() {
        return limit - position;
    }

    public int readByte() {
        if (position >= limit) {
            throw new IndexOutOfBoundsException("读取越过缓冲区末尾: position=" + position + ", limit=" + limit);
        }
        return data[position++] & 0xFF;
    }

    /**
     * 读取 length 字节到目标数组。
     *
     * @return 读取的字节数
     */
    public int read(byte[] target, int targetStart, int length) {
        checkAvailable(length);
        System.arraycopy(data, position, target, targetStart, length);
        position += length;
        return length;
    }

    public void skip(int length) {
        checkAvailable(length);
        position += length;
    }

    /**
     * 回到起点重新读取。
     */
    public void rewind() {
        position = start;
    }

    public long readVarint() {
        return VarIntCodec.readVarInt(this);
    }

    public long readVarintFieldMask() {
        return VarIntCodec.readVarLong(this);
    }

    private void checkAvailable(int length) {
        if (length < 0 || position + length > limit) {
            throw new IndexOutOfBoundsException("读取越过缓冲区末尾: position=" + position
                    + ", length=" + length + ", limit=" + limit);
        }
    }
}
