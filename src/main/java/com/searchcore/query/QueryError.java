package com.searchcore.query;

/**
 * 查询错误输出参数
 *
 * 容量、类型不匹配与超时等可恢复错误不抛异常，而是记录在这里由调用方检查。
 * 只保留第一次设置的错误。
 */
public class QueryError {
    private ErrorCode code = ErrorCode.OK;
    private String message;

    public QueryError() {
    }

    public QueryError(ErrorCode code, String message) {
        setError(code, message);
    }

    /**
     * 记录错误；已有错误时忽略。
     *
     * @param code 错误码
     * @param message 可读的错误描述，为null时使用错误码描述
     */
    public void setError(ErrorCode code, String message) {
        if (code == null || code == ErrorCode.OK) {
            throw new IllegalArgumentException("错误码不能为空或OK");
        }
        if (hasError()) {
            return;
        }
        this.code = code;
        this.message = message == null ? code.getDescription() : message;
    }

    public boolean hasError() {
        return code != ErrorCode.OK;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public void clear() {
        code = ErrorCode.OK;
        message = null;
    }

    @Override
    public String toString() {
        return hasError() ? code + ": " + message : "OK";
    }
}
