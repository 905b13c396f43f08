package com.searchcore.index;

/**
 * 待写入倒排索引的单个条目。
 *
 * @param docId 文档ID，不能为负数
 * @param fieldMask 命中字段掩码
 * @param frequency 词频，按32位无符号保存
 * @param offsets 词位置向量
 */
public record PostingEntry(long docId, long fieldMask, int frequency, OffsetVector offsets) {
    public PostingEntry {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (offsets == null) {
            offsets = OffsetVector.empty();
        }
    }

    /**
     * 不带位置信息的条目。
     */
    public static PostingEntry of(long docId, long fieldMask, int frequency) {
        return new PostingEntry(docId, fieldMask, frequency, OffsetVector.empty());
    }
}
