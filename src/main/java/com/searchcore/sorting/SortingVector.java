package com.searchcore.sorting;

import com.searchcore.query.ErrorCode;
import com.searchcore.query.QueryError;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 文档的排序值向量，槽位与 {@link SortingTable} 一一对应。
 * 字符串以大小写折叠 + NFD 分解后的形式保存。
 */
public final class SortingVector {
    private final SortableValue[] values;

    public SortingVector(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("排序向量长度不能为负数: " + length);
        }
        this.values = new SortableValue[length];
    }

    /**
     * 写入一个值。
     *
     * @param index 槽位下标
     * @param value 字符串或数值；type 为 NULL 时忽略
     * @param type 值类型，NULL 表示清空槽位
     */
    public void put(int index, Object value, SortableType type) {
        checkIndex(index);
        switch (type) {
            case STRING -> {
                if (!(value instanceof CharSequence text)) {
                    throw new IllegalArgumentException("STRING 槽位需要字符串值: " + value);
                }
                values[index] = new SortableValue.Str(normalize(text.toString()));
            }
            case NUMBER -> {
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("NUMBER 槽位需要数值: " + value);
                }
                values[index] = new SortableValue.Num(number.doubleValue());
            }
            case NULL -> values[index] = null;
        }
    }

    public void putString(int index, String value) {
        put(index, value, SortableType.STRING);
    }

    public void putNumber(int index, double value) {
        put(index, value, SortableType.NUMBER);
    }

    /**
     * 读取槽位值，空槽位返回null。
     */
    public SortableValue get(int index) {
        checkIndex(index);
        return values[index];
    }

    public int length() {
        return values.length;
    }

    /**
     * 按单个排序键比较两个向量
     *
     * 空值排在任何值之前；数值比较返回 -1/0/1；字符串按归一化后的值比较。
     * 类型不一致时在 error 中记录 TYPE_MISMATCH 并返回 0。降序时结果取反。
     *
     * @param error 错误输出参数，可为null
     */
    public static int cmp(SortingVector a, SortingVector b, SortingKey key, QueryError error) {
        SortableValue left = a.get(key.index());
        SortableValue right = b.get(key.index());
        int rc;
        if (left == null || right == null) {
            rc = left != null ? 1 : (right != null ? -1 : 0);
        } else if (left instanceof SortableValue.Num leftNum && right instanceof SortableValue.Num rightNum) {
            rc = Double.compare(leftNum.value(), rightNum.value());
            rc = Integer.signum(rc);
        } else if (left instanceof SortableValue.Str leftStr && right instanceof SortableValue.Str rightStr) {
            rc = leftStr.value().compareTo(rightStr.value());
        } else {
            if (error != null) {
                error.setError(ErrorCode.TYPE_MISMATCH,
                        "排序槽位 " + key.index() + " 类型不一致: " + left.type() + " vs " + right.type());
            }
            return 0;
        }
        return key.ascending() ? rc : -rc;
    }

    /**
     * 按多个排序键依次比较，返回第一个非零结果。
     */
    public static int cmp(SortingVector a, SortingVector b, List<SortingKey> keys, QueryError error) {
        for (SortingKey key : keys) {
            int rc = cmp(a, b, key, error);
            if (rc != 0) {
                return rc;
            }
        }
        return 0;
    }

    /**
     * 大小写折叠后做 NFD 分解，例如 "Maße" -> "masse"。
     */
    public static String normalize(String value) {
        String folded = value.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
        return Normalizer.normalize(folded, Normalizer.Form.NFD);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("排序槽位越界: " + index + ", length=" + values.length);
        }
    }

    @Override
    public String toString() {
        return "SortingVector" + Arrays.toString(values);
    }
}
