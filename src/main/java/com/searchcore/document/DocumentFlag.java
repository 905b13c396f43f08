package com.searchcore.document;

/**
 * 文档元数据标志。
 */
public enum DocumentFlag {
    /** 已删除，等待回收 */
    DELETED,
    /** 带有载荷 */
    HAS_PAYLOAD,
    /** 带有排序向量 */
    HAS_SORT_VECTOR
}
