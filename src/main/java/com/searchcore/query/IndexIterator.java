package com.searchcore.query;

import com.searchcore.index.IndexResult;

/**
 * 查询迭代器，按docId升序产出结果
 *
 * 每个节点持有一个可复用的结果对象，{@link #current()} 返回的引用在下一次推进后失效。
 * 一旦返回 EOF，除 {@link #rewind()} 外不会再产出结果。
 *
 * docId 0 不是有效文档（文档表从 1 开始分配）。{@link ReadIterator} 会原样产出索引中的 0，
 * 组合节点（并集、交集、Not、Optional）只产出 docId >= 1 的结果。
 */
public interface IndexIterator extends AutoCloseable {

    /**
     * 推进到下一个结果。
     *
     * @return OK 或 EOF
     */
    ReadStatus read();

    /**
     * 推进到第一个 docId 不小于目标的结果。
     *
     * @param docId 目标docId
     * @return 恰好命中为 OK，越过目标为 NOT_FOUND，没有更多结果为 EOF
     */
    ReadStatus skipTo(long docId);

    /**
     * 当前结果。
     */
    IndexResult current();

    /**
     * 最近一次产出或定位到的docId。
     */
    long lastDocId();

    boolean hasNext();

    /**
     * 协作式取消，之后的读取返回 EOF。
     */
    void abort();

    /**
     * 回到起点重新迭代。
     */
    void rewind();

    /**
     * 结果数量的上界估计。
     */
    long estimatedCount();

    /**
     * 释放迭代器及其子节点。
     */
    @Override
    void close();
}
