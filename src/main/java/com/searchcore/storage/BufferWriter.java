package com.searchcore.storage;

/**
 * 缓冲区写入器，从缓冲区写游标处追加数据。
 */
public final class BufferWriter {
    private final GrowableBuffer buffer;

    public BufferWriter(GrowableBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("缓冲区不能为null");
        }
        this.buffer = buffer;
    }

    public GrowableBuffer buffer() {
        return buffer;
    }

    /**
     * 当前写游标位置。
     */
    public int offset() {
        return buffer.offset();
    }

    /**
     * 移动写游标，之后的写入会覆盖该位置之后的数据。
     */
    public void seek(int position) {
        buffer.setOffset(position);
    }

    /**
     * 写入原始字节。
     *
     * @return 写入的字节数
     */
    public int write(byte[] source, int start, int length) {
        buffer.reserve(length);
        System.arraycopy(source, start, buffer.array(), buffer.offset(), length);
        buffer.setOffset(buffer.offset() + length);
        return length;
    }

    public int write(byte[] source) {
        return write(source, 0, source.length);
    }

    public int writeByte(int value) {
        buffer.reserve(1);
        int position = buffer.offset();
        buffer.array()[position] = (byte) value;
        buffer.setOffset(position + 1);
        return 1;
    }

    /**
     * 覆盖已写入区域中指定位置的单个字节，用于回填头部字节。
     */
    public void writeByteAt(int position, int value) {
        if (position < 0 || position >= buffer.offset()) {
            throw new IndexOutOfBoundsException("回填位置越界: " + position + ", offset=" + buffer.offset());
        }
        buffer.array()[position] = (byte) value;
    }

    /**
     * 写入32位无符号VarInt。
     *
     * @return 写入的字节数
     */
    public int writeVarint(long value) {
        return VarIntCodec.writeVarInt(value, this);
    }

    /**
     * 写入宽字段掩码（64位无符号）的VarInt形式。
     *
     * @return 写入的字节数
     */
    public int writeVarintFieldMask(long fieldMask) {
        return VarIntCodec.writeVarLong(fieldMask, this);
    }
}
