package com.searchcore.index;

import com.searchcore.config.Constants;

/**
 * 数值倒排读取器，忽略字段掩码，按可选的数值范围过滤。
 */
public final class NumericIndexReader extends IndexReader {
    public NumericIndexReader(InvertedIndex index, NumericFilter filter) {
        this(index, filter, 1.0);
    }

    /**
     * @param index 数值倒排索引
     * @param filter 数值范围，null 表示不过滤
     * @param weight 结果权重
     */
    public NumericIndexReader(InvertedIndex index, NumericFilter filter, double weight) {
        super(checkNumericIndex(index), new DecoderContext(Constants.FIELD_MASK_ALL, filter), IndexResult.numeric(weight));
    }

    private static InvertedIndex checkNumericIndex(InvertedIndex index) {
        if (index != null && index.codec() != PostingCodec.NUMERIC) {
            throw new IllegalArgumentException("数值读取器只能读取数值索引");
        }
        return index;
    }
}
