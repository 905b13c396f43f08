package com.searchcore.index;

/**
 * 词项倒排读取器，只产出字段掩码与给定掩码有交集的条目。
 */
public final class TermIndexReader extends IndexReader {
    private final long fieldMask;

    /**
     * @param index 倒排索引
     * @param fieldMask 允许的字段掩码
     * @param term 附着到每个结果上的查询词，可为null
     * @param weight 结果权重
     */
    public TermIndexReader(InvertedIndex index, long fieldMask, QueryTerm term, double weight) {
        super(checkTermIndex(index), new DecoderContext(fieldMask, null), IndexResult.term(term, weight));
        this.fieldMask = fieldMask;
    }

    public long fieldMask() {
        return fieldMask;
    }

    private static InvertedIndex checkTermIndex(InvertedIndex index) {
        if (index != null && index.codec() == PostingCodec.NUMERIC) {
            throw new IllegalArgumentException("词项读取器不能读取数值索引");
        }
        return index;
    }
}
