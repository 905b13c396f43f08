package com.searchcore.storage;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，低位组在前，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * VarInt 承载32位无符号值（docId差值、频次、位置差值），
 * VarLong 承载宽字段掩码，按64位无符号处理。
 */
public final class VarIntCodec {

    private static final long MAX_UINT32 = 0xFFFFFFFFL;

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将32位无符号值编码为VarInt并写入缓冲区
     *
     * @param value 要编码的值，范围 [0, 2^32)
     * @param writer 缓冲区写入器
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果value超出32位无符号范围
     */
    public static int writeVarInt(long value, BufferWriter writer) {
        if (value < 0 || value > MAX_UINT32) {
            throw new IllegalArgumentException("VarInt超出32位无符号范围: " + value);
        }
        return writeVarLong(value, writer);
    }

    /**
     * 从缓冲区读取VarInt
     *
     * @param reader 缓冲区读取器
     * @return 解码后的32位无符号值
     * @throws IllegalStateException 如果VarInt超过32位范围
     */
    public static long readVarInt(BufferReader reader) {
        long result = 0;
        int shift = 0;

        while (shift < 35) {
            int b = reader.readByte();
            result |= (long) (b & 0x7F) << shift;

            // 最高位为0表示这是最后一个字节
            if ((b & 0x80) == 0) {
                return result & MAX_UINT32;
            }

            shift += 7;
        }

        throw new IllegalStateException("VarInt超过32位范围");
    }

    /**
     * 将64位无符号值编码为VarLong并写入缓冲区
     *
     * 负数按无符号解释，-1 即全部64位置位
     *
     * @param value 要编码的值
     * @param writer 缓冲区写入器
     * @return 写入的字节数
     */
    public static int writeVarLong(long value, BufferWriter writer) {
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            // 还有后续字节：当前字节最高位置1
            writer.writeByte((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
            size++;
        }
        writer.writeByte((int) (value & 0x7F));
        return size;
    }

    /**
     * 从缓冲区读取VarLong
     *
     * @param reader 缓冲区读取器
     * @return 解码后的64位无符号值
     * @throws IllegalStateException 如果VarLong超过64位范围
     */
    public static long readVarLong(BufferReader reader) {
        long result = 0;
        int shift = 0;

        while (shift < 64) {
            int b = reader.readByte();
            result |= (long) (b & 0x7F) << shift;

            if ((b & 0x80) == 0) {
                return result;
            }

            shift += 7;
        }

        throw new IllegalStateException("VarLong超过64位范围");
    }

    /**
     * 计算32位无符号值编码为VarInt所需的字节数
     *
     * @param value 要编码的值，范围 [0, 2^32)
     * @return 所需字节数
     * @throws IllegalArgumentException 如果value超出32位无符号范围
     */
    public static int varIntSize(long value) {
        if (value < 0 || value > MAX_UINT32) {
            throw new IllegalArgumentException("VarInt超出32位无符号范围: " + value);
        }
        return varLongSize(value);
    }

    /**
     * 计算64位无符号值编码为VarLong所需的字节数
     *
     * @param value 要编码的值，按无符号解释
     * @return 所需字节数
     */
    public static int varLongSize(long value) {
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
