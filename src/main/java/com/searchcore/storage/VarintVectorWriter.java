package com.searchcore.storage;

/**
 * 位置向量写入器
 *
 * 把单调不减的位置序列按相邻差值 + VarInt 追加到缓冲区。
 * 示例：[3, 10, 12] -> [3, 7, 2]
 */
public final class VarintVectorWriter {
    private final GrowableBuffer buffer;
    private final BufferWriter writer;
    private long lastValue;
    private int count;

    public VarintVectorWriter(int initialCapacity) {
        this.buffer = new GrowableBuffer(initialCapacity);
        this.writer = new BufferWriter(buffer);
    }

    /**
     * 追加一个位置。
     *
     * @param value 位置，必须不小于上一个位置
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果序列出现递减
     */
    public int write(long value) {
        if (value < lastValue) {
            throw new IllegalArgumentException(
                    "输入必须是非负单调递增序列，在位置 " + count + " 处违反: " + value + " < " + lastValue);
        }
        int size = writer.writeVarint(value - lastValue);
        lastValue = value;
        count++;
        return size;
    }

    /**
     * 依次追加多个位置。
     */
    public void writeAll(int... values) {
        for (int value : values) {
            write(value);
        }
    }

    /**
     * 已写入的位置个数。
     */
    public int count() {
        return count;
    }

    /**
     * 已写入的字节数。
     */
    public int byteLength() {
        return buffer.offset();
    }

    /**
     * 收缩多余容量。
     *
     * @return 收缩后的容量
     */
    public int truncate() {
        return buffer.truncate(0);
    }

    /**
     * 清空内容以便复用。
     */
    public void reset() {
        writer.seek(0);
        lastValue = 0;
        count = 0;
    }

    /**
     * 拷贝出已编码的字节。
     */
    public byte[] toByteArray() {
        return buffer.toByteArray();
    }
}
