package com.searchcore.query;

import com.searchcore.document.DocumentKey;
import com.searchcore.sorting.SortingVector;

/**
 * 单条命中。
 *
 * @param docId 内部文档ID
 * @param key 外部文档键
 * @param score 得分
 * @param sortVector 文档排序向量，可为null
 */
public record SearchHit(
        long docId,
        DocumentKey key,
        double score,
        SortingVector sortVector
) {
}
