package com.searchcore.document;

import com.searchcore.config.EngineConfig;
import com.searchcore.sorting.SortingVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 文档表：外部键到内部顺序docId的映射，以及按docId存放的元数据
 *
 * 槽位数组按 cap += 1 + cap / 2 增长到 maxSize 为止，docId 超出容量后取模落入已有槽位的链表。
 * 写入（put/delete/reclaim）由调用方串行化；元数据引用计数可被读者并发增减。
 */
public final class DocumentTable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTable.class);

    private final List<List<DocumentMetadata>> buckets;
    private final Map<DocumentKey, Long> keyIndex = new HashMap<>();
    private final int maxSize;
    private long maxDocId;
    private int liveCount;

    public DocumentTable(EngineConfig config) {
        this(config.getDocTableInitialCapacity(), config.getMaxDocTableSize());
    }

    /**
     * @param initialCapacity 初始槽位数
     * @param maxSize 槽位数上限
     */
    public DocumentTable(int initialCapacity, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("文档表最大容量必须为正数: " + maxSize);
        }
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("文档表初始容量不能为负数: " + initialCapacity);
        }
        int capacity = Math.min(initialCapacity, maxSize);
        this.maxSize = maxSize;
        this.buckets = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) {
            buckets.add(null);
        }
    }

    /**
     * 新增文档并分配下一个docId。
     *
     * @param key 外部键，按字节内容区分
     * @param score 文档先验分
     * @param flags 初始标志，可为null
     * @param payload 载荷，可为null；非空时设置 HAS_PAYLOAD
     * @return 新的docId；键已存在时返回 0
     */
    public long put(byte[] key, float score, Set<DocumentFlag> flags, byte[] payload) {
        DocumentKey documentKey = DocumentKey.of(key);
        if (keyIndex.containsKey(documentKey)) {
            return 0;
        }
        long docId = ++maxDocId;
        ensureCapacity(docId);

        DocumentMetadata metadata = new DocumentMetadata(docId, documentKey.bytes(), score, flags, payload);
        bucketFor(docId).add(metadata);
        keyIndex.put(documentKey, docId);
        liveCount++;
        return docId;
    }

    public long put(String key, float score, Set<DocumentFlag> flags, byte[] payload) {
        return put(key.getBytes(StandardCharsets.UTF_8), score, flags, payload);
    }

    private void ensureCapacity(long docId) {
        int capacity = buckets.size();
        if (docId < capacity || capacity >= maxSize) {
            return;
        }
        long newCapacity = capacity;
        do {
            newCapacity += 1 + newCapacity / 2;
        } while (docId >= newCapacity);
        int target = (int) Math.min(newCapacity, maxSize);
        while (buckets.size() < target) {
            buckets.add(null);
        }
        logger.debug("文档表槽位扩容: {} -> {}", capacity, target);
    }

    private int bucketIndex(long docId) {
        int capacity = buckets.size();
        return (int) (docId < capacity ? docId : docId % maxSize);
    }

    private List<DocumentMetadata> bucketFor(long docId) {
        int index = bucketIndex(docId);
        List<DocumentMetadata> bucket = buckets.get(index);
        if (bucket == null) {
            bucket = new ArrayList<>(1);
            buckets.set(index, bucket);
        }
        return bucket;
    }

    private DocumentMetadata find(long docId) {
        if (docId <= 0 || docId > maxDocId) {
            return null;
        }
        List<DocumentMetadata> bucket = buckets.get(bucketIndex(docId));
        if (bucket == null) {
            return null;
        }
        for (DocumentMetadata metadata : bucket) {
            if (metadata.id() == docId) {
                return metadata;
            }
        }
        return null;
    }

    /**
     * 按docId获取元数据。
     *
     * @return 0、未知或已删除的docId返回null
     */
    public DocumentMetadata get(long docId) {
        DocumentMetadata metadata = find(docId);
        if (metadata == null || metadata.isDeleted()) {
            return null;
        }
        return metadata;
    }

    public DocumentMetadata getByKey(byte[] key) {
        Long docId = keyIndex.get(DocumentKey.of(key));
        return docId == null ? null : get(docId);
    }

    public DocumentMetadata getByKey(String key) {
        return getByKey(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return 键对应的docId，不存在时返回 0
     */
    public long getId(byte[] key) {
        return keyIndex.getOrDefault(DocumentKey.of(key), 0L);
    }

    public long getId(String key) {
        return getId(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return 文档先验分，不存在时返回 0
     */
    public float getScore(long docId) {
        DocumentMetadata metadata = get(docId);
        return metadata == null ? 0f : metadata.score();
    }

    /**
     * @return 文档键，不存在时返回null
     */
    public byte[] getKey(long docId) {
        DocumentMetadata metadata = get(docId);
        return metadata == null ? null : metadata.key();
    }

    public boolean exists(long docId) {
        return get(docId) != null;
    }

    /**
     * 替换载荷。
     *
     * @return 文档不存在时返回 false
     */
    public boolean setPayload(long docId, byte[] payload) {
        DocumentMetadata metadata = get(docId);
        if (metadata == null) {
            return false;
        }
        metadata.setPayload(payload);
        return true;
    }

    /**
     * 设置排序向量。
     *
     * @return 文档不存在时返回 false
     */
    public boolean setSortingVector(long docId, SortingVector vector) {
        DocumentMetadata metadata = get(docId);
        if (metadata == null) {
            return false;
        }
        metadata.setSortVector(vector);
        return true;
    }

    /**
     * 删除文档：标记 DELETED、从键索引移除、释放载荷与排序向量，并释放文档表持有的引用。
     * 槽位中的记录由 {@link #reclaim()} 在引用归零后摘除。
     *
     * @return 键存在时返回 true
     */
    public boolean delete(byte[] key) {
        Long docId = keyIndex.remove(DocumentKey.of(key));
        if (docId == null) {
            return false;
        }
        DocumentMetadata metadata = find(docId);
        if (metadata != null && !metadata.isDeleted()) {
            metadata.markDeleted();
            metadata.decref();
            liveCount--;
        }
        return true;
    }

    public boolean delete(String key) {
        return delete(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 回收已删除且无人引用的记录；仍被引用的记录推迟到下一轮。
     *
     * @return 本轮摘除的记录数
     */
    public int reclaim() {
        int reclaimed = 0;
        int deferred = 0;
        for (List<DocumentMetadata> bucket : buckets) {
            if (bucket == null) {
                continue;
            }
            Iterator<DocumentMetadata> iterator = bucket.iterator();
            while (iterator.hasNext()) {
                DocumentMetadata metadata = iterator.next();
                if (!metadata.isDeleted()) {
                    continue;
                }
                if (metadata.markReclaimed()) {
                    iterator.remove();
                    reclaimed++;
                } else {
                    deferred++;
                }
            }
        }
        if (reclaimed > 0 || deferred > 0) {
            logger.debug("文档表回收完成: reclaimed={}, deferred={}", reclaimed, deferred);
        }
        return reclaimed;
    }

    /**
     * 存活文档数加一。
     */
    public int size() {
        return liveCount + 1;
    }

    /**
     * 已分配的最大docId。
     */
    public long maxDocId() {
        return maxDocId;
    }

    /**
     * 当前槽位数。
     */
    public int capacity() {
        return buckets.size();
    }

    /**
     * 某个槽位链上的记录快照，包括已删除未回收的记录。
     */
    List<DocumentMetadata> bucketSnapshot(long docId) {
        List<DocumentMetadata> bucket = buckets.get(bucketIndex(docId));
        return bucket == null ? Collections.emptyList() : List.copyOf(bucket);
    }
}
