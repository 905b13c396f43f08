package com.searchcore.sorting;

/**
 * 排序向量中的一个值，空槽位用 null 表示。
 */
public sealed interface SortableValue permits SortableValue.Num, SortableValue.Str {

    SortableType type();

    record Num(double value) implements SortableValue {
        @Override
        public SortableType type() {
            return SortableType.NUMBER;
        }
    }

    /** 已归一化的字符串 */
    record Str(String value) implements SortableValue {
        public Str {
            if (value == null) {
                throw new IllegalArgumentException("排序字符串不能为null");
            }
        }

        @Override
        public SortableType type() {
            return SortableType.STRING;
        }
    }
}
