package com.searchcore.index;

import java.util.EnumSet;
import java.util.Set;

/**
 * 倒排索引存储标志，决定条目中保存哪些信息以及使用哪种编码。
 */
public enum IndexFlag {
    /** 保存词频 */
    STORE_FREQS,
    /** 保存字段掩码 */
    STORE_FIELD_FLAGS,
    /** 保存词位置 */
    STORE_TERM_OFFSETS,
    /** 字段掩码按64位宽模式保存 */
    WIDE_SCHEMA,
    /** 数值索引 */
    STORE_NUMERIC;

    /**
     * 默认标志：词频、字段掩码、词位置。
     */
    public static Set<IndexFlag> defaults() {
        return EnumSet.of(STORE_FREQS, STORE_FIELD_FLAGS, STORE_TERM_OFFSETS);
    }
}
