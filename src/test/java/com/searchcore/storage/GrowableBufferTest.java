package com.searchcore.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class GrowableBufferTest {

    @Test
    @DisplayName("写入超出容量时按 1/5 步长扩容")
    void testGrowthPolicy() {
        GrowableBuffer buffer = new GrowableBuffer(2);
        assertEquals(2, buffer.capacity());

        BufferWriter writer = new BufferWriter(buffer);
        byte[] hello = "hello world\0".getBytes(StandardCharsets.US_ASCII);
        assertEquals(12, writer.write(hello));
        assertEquals(12, buffer.offset());
        assertEquals(14, buffer.capacity());

        assertEquals(3, writer.writeVarint(1337654));
        assertEquals(15, buffer.offset());
        assertEquals(17, buffer.capacity());

        assertEquals(15, buffer.truncate(0));
        assertEquals(15, buffer.capacity());

        BufferReader reader = new BufferReader(buffer);
        byte[] read = new byte[12];
        assertEquals(12, reader.read(read, 0, 12));
        assertArrayEquals(hello, read);
        assertEquals(1337654, reader.readVarint());
        assertTrue(reader.atEnd());
    }

    @Test
    void testReadPastEndThrows() {
        GrowableBuffer buffer = new GrowableBuffer(4);
        new BufferWriter(buffer).writeByte(7);

        BufferReader reader = new BufferReader(buffer);
        assertEquals(7, reader.readByte());
        assertThrows(IndexOutOfBoundsException.class, reader::readByte);
        assertThrows(IndexOutOfBoundsException.class, () -> reader.skip(1));
    }

    @Test
    void testSeekOverwritesAndKeepsEarlierBytes() {
        GrowableBuffer buffer = new GrowableBuffer(0);
        BufferWriter writer = new BufferWriter(buffer);
        writer.write(new byte[]{1, 2, 3, 4});
        writer.seek(2);
        writer.writeByte(9);

        assertArrayEquals(new byte[]{1, 2, 9}, buffer.toByteArray());
        writer.writeByteAt(0, 5);
        assertArrayEquals(new byte[]{5, 2, 9}, buffer.toByteArray());
        assertThrows(IndexOutOfBoundsException.class, () -> writer.writeByteAt(3, 0));
    }

    @Test
    void testTruncateToExplicitLength() {
        GrowableBuffer buffer = new GrowableBuffer(32);
        BufferWriter writer = new BufferWriter(buffer);
        writer.write(new byte[]{1, 2, 3, 4, 5});

        assertEquals(3, buffer.truncate(3));
        assertEquals(3, buffer.capacity());
        assertEquals(3, buffer.offset());
    }

    @Test
    void testReleasedBufferRejectsAccess() {
        GrowableBuffer buffer = new GrowableBuffer(8);
        buffer.release();

        assertTrue(buffer.isReleased());
        assertThrows(IllegalStateException.class, buffer::capacity);
        assertThrows(IllegalStateException.class, () -> new BufferWriter(buffer).writeByte(1));
    }
}
