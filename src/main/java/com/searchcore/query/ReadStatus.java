package com.searchcore.query;

/**
 * 读取或跳转的结果状态。
 */
public enum ReadStatus {
    /** 产出了结果；skipTo 时表示恰好命中目标 */
    OK,
    /** skipTo 越过了目标，当前结果是第一个大于目标的文档 */
    NOT_FOUND,
    /** 没有更多结果 */
    EOF
}
