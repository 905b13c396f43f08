package com.searchcore.query;

import java.util.List;

/**
 * 查询结果。
 *
 * @param hits 分页后的命中
 * @param totalMatched 有效命中总数（不含已删除文档）
 * @param elapsedMs 耗时（毫秒）
 * @param timedOut 是否因超时提前结束
 * @param error 错误信息，无错误时 hasError() 为 false
 */
public record SearchResult(
        List<SearchHit> hits,
        long totalMatched,
        long elapsedMs,
        boolean timedOut,
        QueryError error
) {
}
