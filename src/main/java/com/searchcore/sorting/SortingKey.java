package com.searchcore.sorting;

/**
 * 排序键。
 *
 * @param index 排序表中的槽位下标
 * @param ascending 是否升序
 */
public record SortingKey(int index, boolean ascending) {
    public SortingKey {
        if (index < 0) {
            throw new IllegalArgumentException("排序槽位下标不能为负数: " + index);
        }
    }
}
