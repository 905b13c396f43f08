package com.searchcore.index;

import com.searchcore.config.Constants;
import com.searchcore.query.ReadStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PostingCodecTest {

    private static final int ENTRIES = 200;

    // ==================== 编码选择测试 ====================

    @Test
    @DisplayName("索引标志决定编码方式")
    void testForFlags() {
        assertEquals(PostingCodec.FULL, PostingCodec.forFlags(IndexFlag.defaults()));
        assertEquals(PostingCodec.FULL_WIDE, PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FREQS,
                IndexFlag.STORE_FIELD_FLAGS, IndexFlag.STORE_TERM_OFFSETS, IndexFlag.WIDE_SCHEMA)));
        assertEquals(PostingCodec.FREQS_FIELDS,
                PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.STORE_FIELD_FLAGS)));
        assertEquals(PostingCodec.FREQS_ONLY, PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FREQS)));
        assertEquals(PostingCodec.FIELDS_ONLY_WIDE,
                PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FIELD_FLAGS, IndexFlag.WIDE_SCHEMA)));
        assertEquals(PostingCodec.OFFSETS_ONLY, PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_TERM_OFFSETS)));
        assertEquals(PostingCodec.FREQS_OFFSETS,
                PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.STORE_TERM_OFFSETS)));
        assertEquals(PostingCodec.DOC_IDS_ONLY, PostingCodec.forFlags(EnumSet.noneOf(IndexFlag.class)));
        assertEquals(PostingCodec.NUMERIC, PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_NUMERIC)));
    }

    @Test
    @DisplayName("没有字段掩码时宽模式标志不起作用")
    void testWideIgnoredWithoutFields() {
        assertEquals(PostingCodec.FREQS_ONLY,
                PostingCodec.forFlags(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.WIDE_SCHEMA)));
        assertEquals(PostingCodec.DOC_IDS_ONLY, PostingCodec.forFlags(EnumSet.of(IndexFlag.WIDE_SCHEMA)));
    }

    // ==================== 编码长度测试 ====================

    @Test
    @DisplayName("各编码方式的单条目字节数")
    void testEntrySizes() {
        OffsetVector offsets = OffsetVector.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertEquals(10, offsets.length());

        assertEquals(15, firstEntrySize(IndexFlag.defaults(), 1, offsets));
        assertEquals(4, firstEntrySize(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.STORE_FIELD_FLAGS), 1, offsets));
        assertEquals(21, firstEntrySize(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.STORE_FIELD_FLAGS,
                IndexFlag.STORE_TERM_OFFSETS, IndexFlag.WIDE_SCHEMA), 0xFFFFFFFFFFFFL, offsets));
        assertEquals(3, firstEntrySize(EnumSet.of(IndexFlag.STORE_FREQS), 1, offsets));
        assertEquals(10, firstEntrySize(EnumSet.of(IndexFlag.STORE_FREQS, IndexFlag.STORE_FIELD_FLAGS,
                IndexFlag.WIDE_SCHEMA), 0xFFFFFFFFFFFFL, offsets));
        assertEquals(1, firstEntrySize(EnumSet.noneOf(IndexFlag.class), 1, offsets));
    }

    private static int firstEntrySize(Set<IndexFlag> flags, long fieldMask, OffsetVector offsets) {
        try (InvertedIndex index = new InvertedIndex(flags)) {
            return index.writeEntry(new PostingEntry(1, fieldMask, 1, offsets));
        }
    }

    // ==================== 往返测试 ====================

    @Test
    @DisplayName("所有标志组合的写入与读取往返")
    void testRoundTripAllFlagCombinations() {
        IndexFlag[] optional = {IndexFlag.STORE_FREQS, IndexFlag.STORE_FIELD_FLAGS,
                IndexFlag.STORE_TERM_OFFSETS, IndexFlag.WIDE_SCHEMA};
        for (int bits = 0; bits < (1 << optional.length); bits++) {
            Set<IndexFlag> flags = EnumSet.noneOf(IndexFlag.class);
            for (int i = 0; i < optional.length; i++) {
                if ((bits & (1 << i)) != 0) {
                    flags.add(optional[i]);
                }
            }
            assertRoundTrip(flags);
        }
    }

    private static void assertRoundTrip(Set<IndexFlag> flags) {
        boolean freqs = flags.contains(IndexFlag.STORE_FREQS);
        boolean fields = flags.contains(IndexFlag.STORE_FIELD_FLAGS);
        boolean offsets = flags.contains(IndexFlag.STORE_TERM_OFFSETS);
        boolean wide = fields && flags.contains(IndexFlag.WIDE_SCHEMA);

        try (InvertedIndex index = new InvertedIndex(flags)) {
            for (int i = 0; i < ENTRIES; i++) {
                long mask = wide ? (1L << 40) | (i + 1) : i + 1;
                index.writeEntry(new PostingEntry(i, mask, i, OffsetVector.of(i, i + 1)));
            }
            assertEquals(2, index.blockCount(), "200个条目应分成2块: " + flags);
            assertEquals(ENTRIES, index.numDocs());
            assertEquals(ENTRIES - 1, index.lastId());

            TermIndexReader reader = new TermIndexReader(index, Constants.FIELD_MASK_ALL, null, 1.0);
            List<Long> ids = new ArrayList<>();
            int i = 0;
            while (reader.read() == ReadStatus.OK) {
                IndexResult result = reader.current();
                ids.add(result.docId());
                assertEquals(i, result.docId(), "docId不一致: " + flags);
                assertEquals(freqs ? i : 1, result.freq(), "词频不一致: " + flags);
                long expectedMask = !fields ? Constants.FIELD_MASK_ALL : (wide ? (1L << 40) | (i + 1) : i + 1);
                assertEquals(expectedMask, result.fieldMask(), "字段掩码不一致: " + flags);
                if (offsets) {
                    assertArrayEquals(new int[]{i, i + 1}, result.offsets().toArray(), "位置不一致: " + flags);
                } else {
                    assertTrue(result.offsets().isEmpty(), "不应带有位置: " + flags);
                }
                i++;
            }
            assertEquals(ENTRIES, ids.size(), "读取条目数不一致: " + flags);
        }
    }
}
