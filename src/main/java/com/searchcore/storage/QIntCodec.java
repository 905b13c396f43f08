package com.searchcore.storage;

/**
 * QInt 分组整数编解码器
 *
 * 一次编码 1~4 个32位无符号整数：首字节每 2 位记录对应整数的字节数减一，
 * 随后按顺序写入每个整数的最小小端字节序列（1~4 字节）。
 * 解码时只需读取一个头字节即可确定整组长度，比逐个 VarInt 更适合热路径。
 */
public final class QIntCodec {

    private QIntCodec() {
        // 工具类，禁止实例化
    }

    public static int encode1(BufferWriter writer, int a) {
        int headerPos = writer.offset();
        writer.writeByte(0);
        int header = 0;
        int size = 1;
        int n = writeUnsigned(writer, a);
        header |= (n - 1);
        size += n;
        writer.writeByteAt(headerPos, header);
        return size;
    }

    public static int encode2(BufferWriter writer, int a, int b) {
        int headerPos = writer.offset();
        writer.writeByte(0);
        int header = 0;
        int size = 1;
        int n = writeUnsigned(writer, a);
        header |= (n - 1);
        size += n;
        n = writeUnsigned(writer, b);
        header |= (n - 1) << 2;
        size += n;
        writer.writeByteAt(headerPos, header);
        return size;
    }

    public static int encode3(BufferWriter writer, int a, int b, int c) {
        int headerPos = writer.offset();
        writer.writeByte(0);
        int header = 0;
        int size = 1;
        int n = writeUnsigned(writer, a);
        header |= (n - 1);
        size += n;
        n = writeUnsigned(writer, b);
        header |= (n - 1) << 2;
        size += n;
        n = writeUnsigned(writer, c);
        header |= (n - 1) << 4;
        size += n;
        writer.writeByteAt(headerPos, header);
        return size;
    }

    public static int encode4(BufferWriter writer, int a, int b, int c, int d) {
        int headerPos = writer.offset();
        writer.writeByte(0);
        int header = 0;
        int size = 1;
        int n = writeUnsigned(writer, a);
        header |= (n - 1);
        size += n;
        n = writeUnsigned(writer, b);
        header |= (n - 1) << 2;
        size += n;
        n = writeUnsigned(writer, c);
        header |= (n - 1) << 4;
        size += n;
        n = writeUnsigned(writer, d);
        header |= (n - 1) << 6;
        size += n;
        writer.writeByteAt(headerPos, header);
        return size;
    }

    /**
     * 解码一组整数。
     *
     * @param reader 读取器
     * @param out 输出数组，前 count 个元素被覆盖，值按32位无符号存放在 int 中
     * @param count 整数个数，1~4
     * @return 消耗的字节数
     */
    public static int decode(BufferReader reader, int[] out, int count) {
        if (count < 1 || count > 4) {
            throw new IllegalArgumentException("QInt一组只能包含1~4个整数: " + count);
        }
        int header = reader.readByte();
        int size = 1;
        for (int i = 0; i < count; i++) {
            int length = ((header >>> (i * 2)) & 0x03) + 1;
            int value = 0;
            for (int j = 0; j < length; j++) {
                value |= reader.readByte() << (j * 8);
            }
            out[i] = value;
            size += length;
        }
        return size;
    }

    private static int writeUnsigned(BufferWriter writer, int value) {
        int n = 0;
        do {
            writer.writeByte(value & 0xFF);
            value >>>= 8;
            n++;
        } while (value != 0);
        return n;
    }
}
