package com.searchcore.index;

import com.searchcore.storage.BufferReader;
import com.searchcore.storage.BufferWriter;

/**
 * 数值条目编解码器
 *
 * 头字节布局：
 * - bit 0-2：docId 差值字节数减一
 * - bit 3-4：值类型（TINY / FLOAT / POS_INT / NEG_INT）
 * - bit 5-7：类型相关位
 *
 * 头字节后依次是 1~8 字节小端差值与值本体。0~7 的整数直接放进头字节，
 * 其余整数只写有效字节，能用 float 近似（误差小于 0.01）的小数写 4 字节，否则写 8 字节 double。
 */
public final class NumericCodec {
    static final int TYPE_TINY = 0;
    static final int TYPE_FLOAT = 1;
    static final int TYPE_POS_INT = 2;
    static final int TYPE_NEG_INT = 3;

    private static final int FLOAT_INFINITE_BIT = 0x20;
    private static final int FLOAT_NEGATIVE_BIT = 0x40;
    private static final int FLOAT_DOUBLE_BIT = 0x80;
    private static final double FLOAT_TOLERANCE = 0.01;
    private static final double INTEGRAL_LIMIT = 0x1p63;

    private NumericCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 写入一个数值条目。
     *
     * @param writer 写入器
     * @param delta 与块内上一条目的docId差值
     * @param value 数值
     * @return 写入的字节数
     */
    public static int encode(BufferWriter writer, long delta, double value) {
        int headerPos = writer.offset();
        writer.writeByte(0);
        int size = 1;

        int deltaBytes = writeLittleEndian(writer, delta);
        size += deltaBytes;
        int header = deltaBytes - 1;

        double abs = Math.abs(value);
        boolean negative = value < 0;
        if (Double.isInfinite(value)) {
            header |= TYPE_FLOAT << 3 | FLOAT_INFINITE_BIT;
            if (negative) {
                header |= FLOAT_NEGATIVE_BIT;
            }
        } else if (value == Math.rint(value) && value >= 0 && value <= 7) {
            header |= TYPE_TINY << 3 | ((int) value) << 5;
        } else if (abs < INTEGRAL_LIMIT && abs == Math.rint(abs)) {
            int valueBytes = writeLittleEndian(writer, (long) abs);
            size += valueBytes;
            header |= (negative ? TYPE_NEG_INT : TYPE_POS_INT) << 3 | (valueBytes - 1) << 5;
        } else if (Math.abs(abs - (float) abs) < FLOAT_TOLERANCE) {
            int bits = Float.floatToIntBits((float) abs);
            for (int i = 0; i < 4; i++) {
                writer.writeByte(bits >>> (i * 8));
            }
            size += 4;
            header |= TYPE_FLOAT << 3;
            if (negative) {
                header |= FLOAT_NEGATIVE_BIT;
            }
        } else {
            long bits = Double.doubleToLongBits(abs);
            for (int i = 0; i < 8; i++) {
                writer.writeByte((int) (bits >>> (i * 8)));
            }
            size += 8;
            header |= TYPE_FLOAT << 3 | FLOAT_DOUBLE_BIT;
            if (negative) {
                header |= FLOAT_NEGATIVE_BIT;
            }
        }

        writer.writeByteAt(headerPos, header);
        return size;
    }

    /**
     * 读取一个数值条目，数值写入 record。
     *
     * @return docId 差值
     */
    public static long decode(BufferReader reader, IndexResult record) {
        int header = reader.readByte();
        long delta = readLittleEndian(reader, (header & 0x07) + 1);
        int type = (header >>> 3) & 0x03;

        double value;
        switch (type) {
            case TYPE_TINY -> value = header >>> 5;
            case TYPE_FLOAT -> {
                if ((header & FLOAT_INFINITE_BIT) != 0) {
                    value = Double.POSITIVE_INFINITY;
                } else if ((header & FLOAT_DOUBLE_BIT) != 0) {
                    value = Double.longBitsToDouble(readLittleEndian(reader, 8));
                } else {
                    value = Float.intBitsToFloat((int) readLittleEndian(reader, 4));
                }
                if ((header & FLOAT_NEGATIVE_BIT) != 0) {
                    value = -value;
                }
            }
            case TYPE_POS_INT -> value = readLittleEndian(reader, (header >>> 5) + 1);
            default -> value = -(double) readLittleEndian(reader, (header >>> 5) + 1);
        }
        record.setValue(value);
        return delta;
    }

    private static int writeLittleEndian(BufferWriter writer, long value) {
        int n = 0;
        do {
            writer.writeByte((int) (value & 0xFF));
            value >>>= 8;
            n++;
        } while (value != 0);
        return n;
    }

    private static long readLittleEndian(BufferReader reader, int length) {
        long value = 0;
        for (int i = 0; i < length; i++) {
            value |= (long) reader.readByte() << (i * 8);
        }
        return value;
    }
}
