package com.searchcore.query;

/**
 * 结构化错误码。
 */
public enum ErrorCode {
    OK("成功"),
    GENERIC("通用错误"),
    TYPE_MISMATCH("排序值类型不匹配"),
    LIMIT("超出容量上限"),
    TIMED_OUT("查询超时");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
