package com.searchcore.index;

import com.searchcore.query.ReadStatus;
import com.searchcore.storage.BufferReader;

/**
 * 倒排索引读取器
 *
 * 顺序解码块内条目，跳过不满足字段掩码或数值过滤的条目。
 * skipTo 先按块的 lastId 二分定位块，再在块内逐条扫描。
 * 到达末尾后保持 EOF，除非调用 {@link #rewind()}。
 */
public abstract class IndexReader implements AutoCloseable {
    private final InvertedIndex index;
    private final PostingCodec codec;
    private final DecoderContext context;
    private final IndexResult record;
    private int blockIndex;
    private BufferReader reader;
    private long lastId;
    private long lastDocId;
    private boolean atEnd;

    IndexReader(InvertedIndex index, DecoderContext context, IndexResult record) {
        if (index == null) {
            throw new IllegalArgumentException("倒排索引不能为null");
        }
        index.ensureOpen();
        this.index = index;
        this.codec = index.codec();
        this.context = context;
        this.record = record;
        seekBlock(0);
    }

    /**
     * 读取下一个满足过滤条件的条目。
     *
     * @return OK 或 EOF
     */
    public ReadStatus read() {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        index.ensureOpen();
        while (true) {
            while (reader.atEnd()) {
                if (!refreshBlock()) {
                    if (blockIndex + 1 >= index.blockCount()) {
                        atEnd = true;
                        return ReadStatus.EOF;
                    }
                    seekBlock(blockIndex + 1);
                }
            }
            boolean matched = codec.decode(reader, lastId, context, record);
            lastId = record.docId();
            if (matched) {
                lastDocId = lastId;
                return ReadStatus.OK;
            }
        }
    }

    /**
     * 跳到第一个 docId 不小于目标的条目。
     *
     * @return 命中目标返回 OK，越过目标返回 NOT_FOUND，没有更多条目返回 EOF
     */
    public ReadStatus skipTo(long docId) {
        if (atEnd) {
            return ReadStatus.EOF;
        }
        if (docId > index.lastId() || index.numDocs() == 0) {
            atEnd = true;
            return ReadStatus.EOF;
        }
        skipToBlock(docId);
        while (read() == ReadStatus.OK) {
            long id = record.docId();
            if (id < docId) {
                continue;
            }
            return id == docId ? ReadStatus.OK : ReadStatus.NOT_FOUND;
        }
        return ReadStatus.EOF;
    }

    /**
     * 当前块已覆盖目标时原地继续，否则在后续块中二分查找第一个 lastId 不小于目标的块。
     */
    private void skipToBlock(long docId) {
        if (index.block(blockIndex).lastId() >= docId) {
            return;
        }
        int low = blockIndex + 1;
        int high = index.blockCount() - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (index.block(mid).lastId() < docId) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        seekBlock(low);
    }

    private void seekBlock(int newBlockIndex) {
        IndexBlock block = index.block(newBlockIndex);
        blockIndex = newBlockIndex;
        reader = block.newReader();
        lastId = block.firstId();
    }

    /**
     * 读取器创建后块内可能又追加了条目，重新取快照并保持读位置。
     */
    private boolean refreshBlock() {
        IndexBlock block = index.block(blockIndex);
        int position = reader.position();
        if (block.byteLength() <= position) {
            return false;
        }
        reader = block.newReader();
        reader.skip(position);
        if (position == 0) {
            // 空块在读取器创建后才写入第一个条目，首尾docId已对齐
            lastId = block.firstId();
        }
        return true;
    }

    /**
     * 最近一次读取的结果，下次推进时被覆盖。
     */
    public IndexResult current() {
        return record;
    }

    /**
     * 最近一次产出的docId。
     */
    public long lastDocId() {
        return lastDocId;
    }

    public boolean hasNext() {
        return !atEnd;
    }

    /**
     * 强制进入 EOF。
     */
    public void abort() {
        atEnd = true;
    }

    /**
     * 回到第一个块重新读取。
     */
    public void rewind() {
        index.ensureOpen();
        seekBlock(0);
        lastDocId = 0;
        record.setDocId(0);
        atEnd = false;
    }

    /**
     * 结果数量估计，即索引条目数。
     */
    public long estimatedCount() {
        return index.numDocs();
    }

    public InvertedIndex index() {
        return index;
    }

    @Override
    public void close() {
        atEnd = true;
    }
}
