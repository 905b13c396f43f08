package com.searchcore.query;

/**
 * 查询超时后的处理策略。
 */
public enum TimeoutPolicy {
    /** 中止迭代并返回已收集的部分结果 */
    RETURN,
    /** 中止迭代并返回携带 TIMED_OUT 错误的空结果 */
    FAIL
}
