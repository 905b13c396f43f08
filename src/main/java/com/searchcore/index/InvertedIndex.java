package com.searchcore.index;

import com.searchcore.config.Constants;
import com.searchcore.config.EngineConfig;
import com.searchcore.storage.BufferReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongPredicate;

/**
 * 倒排索引
 *
 * 由有序倒排块组成，只支持按docId严格递增追加。以下任一情况开新块：
 * - 当前块条目数达到块大小
 * - 与块内上一条目的差值超出32位
 *
 * 写入不加锁，调用方需保证写入与读取不并发。
 */
public final class InvertedIndex implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    private final List<IndexBlock> blocks = new ArrayList<>();
    private final Set<IndexFlag> flags;
    private final PostingCodec codec;
    private final int blockSize;
    private final IndexResult writeRecord;
    private final long wideMaskLimit;
    private long lastId;
    private long numDocs;
    private boolean closed;

    public InvertedIndex(Set<IndexFlag> flags) {
        this(flags, EngineConfig.defaults());
    }

    public InvertedIndex(Set<IndexFlag> flags, EngineConfig config) {
        if (flags == null || config == null) {
            throw new IllegalArgumentException("索引标志与配置不能为null");
        }
        this.flags = flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(IndexFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.codec = PostingCodec.forFlags(this.flags);
        this.blockSize = config.getIndexBlockSize();
        this.writeRecord = codec == PostingCodec.NUMERIC ? IndexResult.numeric(1.0) : IndexResult.term(null, 1.0);
        boolean wideFields = this.flags.contains(IndexFlag.STORE_FIELD_FLAGS) && this.flags.contains(IndexFlag.WIDE_SCHEMA);
        this.wideMaskLimit = wideFields ? 1L << Constants.WIDE_SCHEMA_FIELD_BITS : 0;
        blocks.add(new IndexBlock(0, Constants.INDEX_BLOCK_INITIAL_CAPACITY));
    }

    /**
     * 追加一个词项条目。
     *
     * @param entry 条目，docId必须大于已写入的最大docId
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果docId不递增，或宽模式下字段掩码超出48位
     * @throws IllegalStateException 如果这是数值索引或索引已关闭
     */
    public int writeEntry(PostingEntry entry) {
        if (codec == PostingCodec.NUMERIC) {
            throw new IllegalStateException("数值索引不能写入词项条目");
        }
        if (wideMaskLimit != 0 && (entry.fieldMask() & -wideMaskLimit) != 0) {
            throw new IllegalArgumentException("宽模式字段掩码超出" + Constants.WIDE_SCHEMA_FIELD_BITS
                    + "位: 0x" + Long.toHexString(entry.fieldMask()));
        }
        writeRecord.setFreq(entry.frequency());
        writeRecord.setFieldMask(entry.fieldMask());
        writeRecord.offsets().reset(entry.offsets());
        return append(entry.docId(), writeRecord);
    }

    /**
     * 追加一个数值条目。
     *
     * @return 写入的字节数
     * @throws IllegalArgumentException 如果docId不递增
     * @throws IllegalStateException 如果这不是数值索引或索引已关闭
     */
    public int writeNumericEntry(long docId, double value) {
        if (codec != PostingCodec.NUMERIC) {
            throw new IllegalStateException("非数值索引不能写入数值条目");
        }
        writeRecord.setValue(value);
        return append(docId, writeRecord);
    }

    private int append(long docId, IndexResult record) {
        ensureOpen();
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (numDocs > 0 && docId <= lastId) {
            throw new IllegalArgumentException("docId必须严格递增, lastId=" + lastId + ", current=" + docId);
        }

        IndexBlock block = blocks.get(blocks.size() - 1);
        if (block.numEntries() >= blockSize) {
            block = addBlock(docId);
        } else if (block.numEntries() == 0) {
            block.rebase(docId);
        }

        long delta = docId - block.lastId();
        if (delta > Constants.MAX_BLOCK_DELTA) {
            block = addBlock(docId);
            delta = 0;
        }

        int size = codec.encode(block.writer(), delta, record);
        block.appended(docId);
        lastId = docId;
        numDocs++;
        return size;
    }

    private IndexBlock addBlock(long firstId) {
        IndexBlock block = new IndexBlock(firstId, Constants.INDEX_BLOCK_INITIAL_CAPACITY);
        blocks.add(block);
        logger.debug("倒排索引新增块: firstId={}, blocks={}", firstId, blocks.size());
        return block;
    }

    /**
     * 回收已删除文档的条目
     *
     * 逐块解码，丢弃 isLive 判定为否的条目，幸存条目重新计算差值后写入新块；
     * 变空的块被移除，但始终保留至少一个块。执行期间不能有打开的读取器。
     *
     * @param isLive 判断docId是否仍然有效
     * @return 回收统计
     */
    public RepairStats repair(LongPredicate isLive) {
        ensureOpen();
        long removed = 0;
        long bytesBefore = 0;
        long bytesAfter = 0;
        int blocksBefore = blocks.size();

        DecoderContext context = new DecoderContext(Constants.FIELD_MASK_ALL, null);
        IndexResult record = codec == PostingCodec.NUMERIC ? IndexResult.numeric(1.0) : IndexResult.term(null, 1.0);
        List<IndexBlock> repaired = new ArrayList<>(blocks.size());

        for (IndexBlock block : blocks) {
            bytesBefore += block.byteLength();
            if (block.numEntries() == 0) {
                block.release();
                continue;
            }

            BufferReader reader = block.newReader();
            IndexBlock rewritten = null;
            long baseId = block.firstId();
            for (int i = 0; i < block.numEntries(); i++) {
                codec.decode(reader, baseId, context, record);
                baseId = record.docId();
                if (!isLive.test(record.docId())) {
                    removed++;
                    continue;
                }
                if (rewritten != null && record.docId() - rewritten.lastId() > Constants.MAX_BLOCK_DELTA) {
                    // 中间条目被移除后差值可能超出32位，另起一块
                    bytesAfter += rewritten.byteLength();
                    repaired.add(rewritten);
                    rewritten = null;
                }
                if (rewritten == null) {
                    rewritten = new IndexBlock(record.docId(), Constants.INDEX_BLOCK_INITIAL_CAPACITY);
                }
                codec.encode(rewritten.writer(), record.docId() - rewritten.lastId(), record);
                rewritten.appended(record.docId());
            }
            block.release();

            if (rewritten != null) {
                bytesAfter += rewritten.byteLength();
                repaired.add(rewritten);
            }
        }

        if (repaired.isEmpty()) {
            repaired.add(new IndexBlock(0, Constants.INDEX_BLOCK_INITIAL_CAPACITY));
        }
        blocks.clear();
        blocks.addAll(repaired);
        numDocs -= removed;

        RepairStats stats = new RepairStats(removed, bytesBefore, bytesAfter, Math.max(0, blocksBefore - blocks.size()));
        logger.debug("倒排索引回收完成: {}", stats);
        return stats;
    }

    public Set<IndexFlag> flags() {
        return flags;
    }

    public PostingCodec codec() {
        return codec;
    }

    /**
     * 已写入的条目数（回收后扣除被移除的条目）。
     */
    public long numDocs() {
        return numDocs;
    }

    /**
     * 已写入的最大docId。
     */
    public long lastId() {
        return lastId;
    }

    public int blockCount() {
        return blocks.size();
    }

    public IndexBlock block(int index) {
        return blocks.get(index);
    }

    /**
     * 所有块缓冲区占用的容量（字节）。
     */
    public long memoryUsage() {
        long total = 0;
        for (IndexBlock block : blocks) {
            total += block.capacity();
        }
        return total;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 释放所有块。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        for (IndexBlock block : blocks) {
            block.release();
        }
        blocks.clear();
        closed = true;
    }

    void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("倒排索引已关闭");
        }
    }

    /**
     * 回收统计。
     *
     * @param entriesRemoved 移除的条目数
     * @param bytesBefore 回收前的编码字节数
     * @param bytesAfter 回收后的编码字节数
     * @param blocksRemoved 移除的块数
     */
    public record RepairStats(long entriesRemoved, long bytesBefore, long bytesAfter, int blocksRemoved) {
    }
}
