package com.searchcore.index;

import com.searchcore.storage.BufferReader;
import com.searchcore.storage.BufferWriter;
import com.searchcore.storage.VarintVectorWriter;

import java.util.Arrays;

/**
 * 词位置向量，以相邻差值 + VarInt 编码的字节视图
 *
 * 解码出的结果直接指向倒排块内存，不做拷贝；需要脱离块内存时使用 {@link #copy()}。
 */
public final class OffsetVector {
    private static final byte[] EMPTY = new byte[0];

    private byte[] data = EMPTY;
    private int start;
    private int length;

    public OffsetVector() {
    }

    private OffsetVector(byte[] data, int start, int length) {
        this.data = data;
        this.start = start;
        this.length = length;
    }

    /**
     * 把升序位置编码为位置向量。
     *
     * @param positions 单调不减的位置序列
     * @return 新的位置向量
     */
    public static OffsetVector of(int... positions) {
        VarintVectorWriter writer = new VarintVectorWriter(positions.length);
        writer.writeAll(positions);
        return wrap(writer.toByteArray());
    }

    /**
     * 包装已编码的字节，不做拷贝。
     */
    public static OffsetVector wrap(byte[] encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("位置向量字节不能为null");
        }
        return new OffsetVector(encoded, 0, encoded.length);
    }

    public static OffsetVector empty() {
        return new OffsetVector();
    }

    /**
     * 指向新的字节区间。
     */
    public void reset(byte[] data, int start, int length) {
        this.data = data;
        this.start = start;
        this.length = length;
    }

    /**
     * 与另一个向量共享同一段字节。
     */
    public void reset(OffsetVector other) {
        reset(other.data, other.start, other.length);
    }

    public void clear() {
        reset(EMPTY, 0, 0);
    }

    public byte[] data() {
        return data;
    }

    public int start() {
        return start;
    }

    /**
     * 编码后的字节长度。
     */
    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * 把编码字节原样写出。
     *
     * @return 写入的字节数
     */
    public int writeTo(BufferWriter writer) {
        return writer.write(data, start, length);
    }

    /**
     * 拷贝出独立持有字节的向量。
     */
    public OffsetVector copy() {
        return wrap(Arrays.copyOfRange(data, start, start + length));
    }

    /**
     * 解码全部位置。
     */
    public int[] toArray() {
        BufferReader reader = new BufferReader(data, start, start + length);
        int[] positions = new int[length];
        int count = 0;
        int lastValue = 0;
        while (!reader.atEnd()) {
            lastValue += (int) reader.readVarint();
            positions[count++] = lastValue;
        }
        return Arrays.copyOf(positions, count);
    }

    /**
     * 遍历位置，currentTerm 返回 owner。
     */
    public OffsetIterator iterator(IndexResult owner) {
        if (length == 0) {
            return OffsetIterator.empty();
        }
        return new VectorOffsetIterator(this, owner);
    }

    @Override
    public String toString() {
        return "OffsetVector" + Arrays.toString(toArray());
    }
}
