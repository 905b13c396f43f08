package com.searchcore.config;

/**
 * 全局常量定义
 *
 * 包含倒排块参数、编码宽度、文档表容量、排序表上限与查询超时参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 倒排块参数 ====================
    /** 每个倒排块最多容纳的条目数，超过后开新块 */
    public static final int INDEX_BLOCK_SIZE = 100;
    /** 块内 delta 的最大可编码值（32位无符号） */
    public static final long MAX_BLOCK_DELTA = 0xFFFFFFFFL;
    /** 新建倒排块缓冲区的初始容量（字节） */
    public static final int INDEX_BLOCK_INITIAL_CAPACITY = 6;

    // ==================== 字段掩码 ====================
    /** 匹配全部字段的掩码 */
    public static final long FIELD_MASK_ALL = -1L;
    /** 宽模式下字段掩码的有效位数 */
    public static final int WIDE_SCHEMA_FIELD_BITS = 48;

    // ==================== 文档表参数 ====================
    /** 文档表默认初始容量 */
    public static final int DEFAULT_DOC_TABLE_INITIAL_CAPACITY = 1000;
    /** 文档表默认最大槽位数 */
    public static final int DEFAULT_DOC_TABLE_MAX_SIZE = 1_000_000;
    /** 文档表允许配置的最大槽位数 */
    public static final int MAX_DOC_TABLE_SIZE = 100_000_000;

    // ==================== 排序参数 ====================
    /** 排序表最多可声明的字段数 */
    public static final int SORTABLES_MAX = 255;

    // ==================== 查询参数 ====================
    /** 默认查询超时（毫秒），0 表示不限制 */
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 500;
    /** 每读取多少条结果检查一次超时 */
    public static final int TIMEOUT_CHECK_INTERVAL = 100;
    /** 无排序键时允许返回的最大结果数 */
    public static final int DEFAULT_MAX_RESULTS_TO_UNSORTED_MODE = 1000;
}
