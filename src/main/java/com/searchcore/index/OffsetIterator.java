package com.searchcore.index;

/**
 * 词位置迭代器，按升序产出位置，结束后持续返回 {@link #EOF}。
 */
public interface OffsetIterator {
    /** 结束标记，大于任何合法位置 */
    int EOF = Integer.MAX_VALUE;

    /**
     * 返回下一个位置，没有更多位置时返回 {@link #EOF}。
     */
    int next();

    /**
     * 最近一次 {@link #next()} 返回的位置所属的词项结果。
     */
    IndexResult currentTerm();

    /**
     * 不产出任何位置的迭代器。
     */
    static OffsetIterator empty() {
        return EmptyOffsetIterator.INSTANCE;
    }
}

final class EmptyOffsetIterator implements OffsetIterator {
    static final EmptyOffsetIterator INSTANCE = new EmptyOffsetIterator();

    private EmptyOffsetIterator() {
    }

    @Override
    public int next() {
        return EOF;
    }

    @Override
    public IndexResult currentTerm() {
        return null;
    }
}
