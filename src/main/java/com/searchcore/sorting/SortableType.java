package com.searchcore.sorting;

/**
 * 排序字段类型。
 */
public enum SortableType {
    NUMBER,
    STRING,
    /** 清空槽位 */
    NULL
}
