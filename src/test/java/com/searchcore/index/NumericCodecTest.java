package com.searchcore.index;

import com.searchcore.query.ReadStatus;
import com.searchcore.storage.BufferReader;
import com.searchcore.storage.BufferWriter;
import com.searchcore.storage.GrowableBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class NumericCodecTest {

    // ==================== 编码长度测试 ====================

    @ParameterizedTest
    @CsvSource({
            "0, 2",
            "1, 2",
            "7, 2",
            "63, 3",
            "-1, 3",
            "-63, 3",
            "64, 3",
            "-64, 3",
            "255, 3",
            "-255, 3",
            "65535, 4",
            "-65535, 4",
            "16777215, 5",
            "-16777215, 5",
            "4294967295, 6",
            "-4294967295, 6",
            "4294967297, 7",
            "549755813888, 7",
            "1503342028.957225, 10",
            "42.4345, 6",
            "0.5, 6",
            "4503599627370495, 9"
    })
    @DisplayName("数值条目的编码字节数")
    void testEncodedSize(double value, int expectedSize) {
        GrowableBuffer buffer = new GrowableBuffer(0);
        assertEquals(expectedSize, NumericCodec.encode(new BufferWriter(buffer), 0, value));
        assertEquals(expectedSize, buffer.offset());
    }

    @Test
    @DisplayName("极值与无穷的编码字节数")
    void testSpecialValues() {
        assertEquals(10, encodedSize(Double.MAX_VALUE));
        assertEquals(2, encodedSize(Double.POSITIVE_INFINITY));
        assertEquals(2, encodedSize(Double.NEGATIVE_INFINITY));
        assertEquals(6, encodedSize((float) 0.5));

        assertEquals(Double.MAX_VALUE, roundTrip(Double.MAX_VALUE));
        assertEquals(Double.POSITIVE_INFINITY, roundTrip(Double.POSITIVE_INFINITY));
        assertEquals(Double.NEGATIVE_INFINITY, roundTrip(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("差值按最少字节写入")
    void testDeltaWidth() {
        GrowableBuffer buffer = new GrowableBuffer(0);
        BufferWriter writer = new BufferWriter(buffer);

        assertEquals(1 + 4, NumericCodec.encode(writer, 0xFFFFFFFFL, 3));
        IndexResult record = IndexResult.numeric(1.0);
        assertEquals(0xFFFFFFFFL, NumericCodec.decode(new BufferReader(buffer), record));
        assertEquals(3, record.value());
    }

    private static int encodedSize(double value) {
        return NumericCodec.encode(new BufferWriter(new GrowableBuffer(0)), 0, value);
    }

    private static double roundTrip(double value) {
        GrowableBuffer buffer = new GrowableBuffer(0);
        NumericCodec.encode(new BufferWriter(buffer), 0, value);
        IndexResult record = IndexResult.numeric(1.0);
        NumericCodec.decode(new BufferReader(buffer), record);
        return record.value();
    }

    // ==================== 往返测试 ====================

    @Test
    @DisplayName("整数值经索引往返保持精确")
    void testIntegerRoundTripThroughIndex() {
        try (InvertedIndex index = new InvertedIndex(EnumSet.of(IndexFlag.STORE_NUMERIC))) {
            for (int i = 1; i <= 75; i++) {
                index.writeNumericEntry(i, i);
            }
            NumericIndexReader reader = new NumericIndexReader(index, null);
            int count = 0;
            while (reader.read() == ReadStatus.OK) {
                count++;
                assertEquals(count, reader.current().docId());
                assertEquals(count, reader.current().value());
                assertEquals(1, reader.current().freq());
            }
            assertEquals(75, count);
        }
    }

    @Test
    @DisplayName("混合数值往返误差小于0.01")
    void testMixedRoundTrip() {
        double[] values = {0, 1, -1, 3.5, -3.5, 42.4345, 1503342028.957225, -0.001, 1e18, -1e18,
                255, 65536, 0.25, 123456.789};
        try (InvertedIndex index = new InvertedIndex(EnumSet.of(IndexFlag.STORE_NUMERIC))) {
            for (int i = 0; i < values.length; i++) {
                index.writeNumericEntry(i + 1, values[i]);
            }
            NumericIndexReader reader = new NumericIndexReader(index, null);
            for (double value : values) {
                assertEquals(ReadStatus.OK, reader.read());
                assertEquals(value, reader.current().value(), 0.01);
            }
            assertEquals(ReadStatus.EOF, reader.read());
        }
    }
}
