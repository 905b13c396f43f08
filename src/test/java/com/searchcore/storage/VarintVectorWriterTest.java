package com.searchcore.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VarintVectorWriterTest {

    @Test
    @DisplayName("按差值写入位置序列")
    void testDeltaEncoding() {
        VarintVectorWriter writer = new VarintVectorWriter(2);
        writer.writeAll(3, 10, 12);

        assertEquals(3, writer.count());
        assertArrayEquals(new byte[]{3, 7, 2}, writer.toByteArray());
    }

    @Test
    @DisplayName("大间隔使用多字节VarInt")
    void testWideDelta() {
        VarintVectorWriter writer = new VarintVectorWriter(0);

        assertEquals(1, writer.write(1));
        assertEquals(2, writer.write(1 + 300));
        assertEquals(3, writer.byteLength());
    }

    @Test
    @DisplayName("递减序列被拒绝")
    void testDecreasingRejected() {
        VarintVectorWriter writer = new VarintVectorWriter(4);
        writer.write(5);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> writer.write(4));
        assertTrue(e.getMessage().contains("单调递增"));
        assertEquals(1, writer.count(), "失败的写入不计数");
    }

    @Test
    @DisplayName("重置后从零开始")
    void testResetAndTruncate() {
        VarintVectorWriter writer = new VarintVectorWriter(64);
        writer.writeAll(1, 2, 3);
        assertEquals(3, writer.truncate());

        writer.reset();
        assertEquals(0, writer.count());
        assertEquals(0, writer.byteLength());
        writer.write(1);
        assertArrayEquals(new byte[]{1}, writer.toByteArray());
    }
}
