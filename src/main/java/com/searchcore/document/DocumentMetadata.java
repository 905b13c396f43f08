package com.searchcore.document;

import com.searchcore.sorting.SortingVector;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 文档元数据
 *
 * 引用计数初始为 1，代表文档表自身持有的引用；删除时释放这一引用。
 * 计数归零后释放键、载荷与排序向量，之后 {@link #tryIncref()} 总是失败。
 * 回收线程只会把计数从 0 原子地改为 RECLAIMED，读者持有引用期间记录不会被摘除。
 */
public final class DocumentMetadata {
    static final int RECLAIMED = -1;

    private final long id;
    private final AtomicInteger refCount = new AtomicInteger(1);
    private final Set<DocumentFlag> flags = Collections.synchronizedSet(EnumSet.noneOf(DocumentFlag.class));
    private volatile byte[] key;
    private volatile float score;
    private volatile byte[] payload;
    private volatile SortingVector sortVector;

    DocumentMetadata(long id, byte[] key, float score, Set<DocumentFlag> flags, byte[] payload) {
        this.id = id;
        this.key = key;
        this.score = score;
        if (flags != null) {
            this.flags.addAll(flags);
        }
        this.flags.remove(DocumentFlag.DELETED);
        setPayload(payload);
    }

    public long id() {
        return id;
    }

    /**
     * 文档键字节；记录释放后返回null。
     */
    public byte[] key() {
        return key;
    }

    public float score() {
        return score;
    }

    public void setScore(float score) {
        this.score = score;
    }

    public byte[] payload() {
        return payload;
    }

    public SortingVector sortVector() {
        return sortVector;
    }

    public boolean hasFlag(DocumentFlag flag) {
        return flags.contains(flag);
    }

    public boolean isDeleted() {
        return flags.contains(DocumentFlag.DELETED);
    }

    /**
     * 标志快照。
     */
    public Set<DocumentFlag> flags() {
        synchronized (flags) {
            return flags.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.noneOf(DocumentFlag.class))
                    : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        }
    }

    public int refCount() {
        return refCount.get();
    }

    /**
     * 尝试增加引用。
     *
     * @return 记录已释放或已回收时返回 false
     */
    public boolean tryIncref() {
        while (true) {
            int count = refCount.get();
            if (count <= 0) {
                return false;
            }
            if (refCount.compareAndSet(count, count + 1)) {
                return true;
            }
        }
    }

    /**
     * 增加引用。
     *
     * @throws IllegalStateException 如果记录已释放
     */
    public void incref() {
        if (!tryIncref()) {
            throw new IllegalStateException("文档元数据已释放, id=" + id);
        }
    }

    /**
     * 释放一个引用，归零时释放键、载荷与排序向量。
     *
     * @return 剩余引用数
     * @throws IllegalStateException 如果引用数已为零
     */
    public int decref() {
        while (true) {
            int count = refCount.get();
            if (count <= 0) {
                throw new IllegalStateException("文档元数据引用计数已为零, id=" + id);
            }
            if (refCount.compareAndSet(count, count - 1)) {
                if (count == 1) {
                    release();
                }
                return count - 1;
            }
        }
    }

    void setPayload(byte[] payload) {
        if (payload == null || payload.length == 0) {
            this.payload = null;
            flags.remove(DocumentFlag.HAS_PAYLOAD);
        } else {
            this.payload = payload.clone();
            flags.add(DocumentFlag.HAS_PAYLOAD);
        }
    }

    void setSortVector(SortingVector sortVector) {
        this.sortVector = sortVector;
        if (sortVector == null) {
            flags.remove(DocumentFlag.HAS_SORT_VECTOR);
        } else {
            flags.add(DocumentFlag.HAS_SORT_VECTOR);
        }
    }

    /**
     * 标记删除并释放载荷与排序向量，键保留到引用归零。
     */
    void markDeleted() {
        flags.add(DocumentFlag.DELETED);
        setPayload(null);
        setSortVector(null);
    }

    /**
     * 引用数为零时把记录标记为已回收。
     */
    boolean markReclaimed() {
        return refCount.compareAndSet(0, RECLAIMED);
    }

    private void release() {
        key = null;
        payload = null;
        sortVector = null;
    }

    @Override
    public String toString() {
        return "DocumentMetadata{id=" + id + ", score=" + score + ", flags=" + flags() + ", refCount=" + refCount.get() + "}";
    }
}
