package com.searchcore.index;

/**
 * 索引结果类型。TERM、NUMERIC、VIRTUAL 为叶子，UNION、INTERSECTION 为聚合。
 */
public enum ResultType {
    TERM,
    NUMERIC,
    VIRTUAL,
    UNION,
    INTERSECTION;

    /**
     * 该类型在 typeMask 中对应的位。
     */
    public int bit() {
        return 1 << ordinal();
    }

    public boolean isAggregate() {
        return this == UNION || this == INTERSECTION;
    }
}
