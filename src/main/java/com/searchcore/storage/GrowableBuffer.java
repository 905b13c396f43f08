package com.searchcore.storage;

import java.util.Arrays;

/**
 * 可增长字节缓冲区
 *
 * 写游标即逻辑长度（offset），容量不足时按 cap += min(1 + cap / 5, 1MB) 逐步扩容，
 * 已写入的数据在扩容时保持不变。读取通过 {@link BufferReader} 完成，写入通过 {@link BufferWriter} 完成。
 */
public final class GrowableBuffer {
    private static final int MAX_GROWTH_STEP = 1024 * 1024;
    private static final byte[] RELEASED = new byte[0];

    private byte[] data;
    private int offset;
    private boolean released;

    /**
     * 以指定初始容量创建缓冲区。
     *
     * @param initialCapacity 初始容量（字节）
     */
    public GrowableBuffer(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("缓冲区初始容量不能为负数: " + initialCapacity);
        }
        this.data = new byte[initialCapacity];
    }

    /**
     * 当前容量。
     */
    public int capacity() {
        ensureLive();
        return data.length;
    }

    /**
     * 当前逻辑长度，即写游标位置。
     */
    public int offset() {
        ensureLive();
        return offset;
    }

    /**
     * 把容量收缩到指定长度；newLength 为 0 时收缩到当前逻辑长度。
     *
     * @param newLength 新容量
     * @return 收缩后的容量
     */
    public int truncate(int newLength) {
        ensureLive();
        if (newLength < 0) {
            throw new IllegalArgumentException("截断长度不能为负数: " + newLength);
        }
        int target = newLength == 0 ? offset : newLength;
        data = Arrays.copyOf(data, target);
        offset = Math.min(offset, target);
        return target;
    }

    /**
     * 释放底层数组，之后任何访问都会失败。
     */
    public void release() {
        data = RELEASED;
        offset = 0;
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * 拷贝出 [0, offset) 范围内的数据。
     */
    public byte[] toByteArray() {
        ensureLive();
        return Arrays.copyOf(data, offset);
    }

    byte[] array() {
        ensureLive();
        return data;
    }

    void setOffset(int newOffset) {
        ensureLive();
        if (newOffset < 0 || newOffset > data.length) {
            throw new IndexOutOfBoundsException("写游标越界: " + newOffset + ", capacity=" + data.length);
        }
        offset = newOffset;
    }

    /**
     * 确保还能从写游标处追加 extraLength 字节。
     */
    void reserve(int extraLength) {
        ensureLive();
        if (offset + extraLength <= data.length) {
            return;
        }
        int capacity = data.length;
        do {
            capacity += Math.min(1 + capacity / 5, MAX_GROWTH_STEP);
        } while (offset + extraLength > capacity);
        data = Arrays.copyOf(data, capacity);
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("GrowableBuffer 已释放");
        }
    }
}
