package com.searchcore.index;

/**
 * 解码过滤条件与复用的临时数组。
 */
final class DecoderContext {
    final long fieldMask;
    final NumericFilter numericFilter;
    final int[] scratch = new int[4];

    DecoderContext(long fieldMask, NumericFilter numericFilter) {
        this.fieldMask = fieldMask;
        this.numericFilter = numericFilter;
    }
}
