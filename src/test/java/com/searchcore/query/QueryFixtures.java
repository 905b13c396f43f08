package com.searchcore.query;

import com.searchcore.config.Constants;
import com.searchcore.index.IndexFlag;
import com.searchcore.index.IndexResult;
import com.searchcore.index.InvertedIndex;
import com.searchcore.index.OffsetVector;
import com.searchcore.index.PostingEntry;
import com.searchcore.index.QueryTerm;
import com.searchcore.index.TermIndexReader;

import java.util.ArrayList;
import java.util.List;

/**
 * 查询测试用的索引与迭代器构造。
 */
final class QueryFixtures {

    private QueryFixtures() {
        // 工具类，禁止实例化
    }

    /**
     * 构造 docId 为 step, 2*step, ..., size*step 的索引，词频为 1。
     */
    static InvertedIndex createIndex(int size, long step) {
        InvertedIndex index = new InvertedIndex(IndexFlag.defaults());
        for (int i = 1; i <= size; i++) {
            index.writeEntry(new PostingEntry(i * step, 1, 1, OffsetVector.of(i % 64)));
        }
        return index;
    }

    static ReadIterator reader(InvertedIndex index, double weight) {
        return new ReadIterator(new TermIndexReader(index, Constants.FIELD_MASK_ALL,
                new QueryTerm("t" + index.lastId(), 1.0), weight));
    }

    static ReadIterator reader(InvertedIndex index) {
        return reader(index, 1.0);
    }

    static List<Long> drain(IndexIterator iterator) {
        List<Long> ids = new ArrayList<>();
        while (iterator.read() == ReadStatus.OK) {
            ids.add(iterator.current().docId());
        }
        return ids;
    }

    static List<Long> ids(long... values) {
        List<Long> ids = new ArrayList<>(values.length);
        for (long value : values) {
            ids.add(value);
        }
        return ids;
    }

    /**
     * 读取前休眠的包装迭代器，用于触发超时。
     */
    static final class SlowIterator implements IndexIterator {
        private final IndexIterator delegate;
        private final long sleepMillis;
        private final long sleepOnRead;
        private long reads;
        private boolean aborted;

        /**
         * 每次读取前都休眠。
         */
        SlowIterator(IndexIterator delegate, long sleepMillis) {
            this(delegate, sleepMillis, 0);
        }

        /**
         * @param sleepOnRead 只在第几次读取前休眠，0 表示每次都休眠
         */
        SlowIterator(IndexIterator delegate, long sleepMillis, long sleepOnRead) {
            this.delegate = delegate;
            this.sleepMillis = sleepMillis;
            this.sleepOnRead = sleepOnRead;
        }

        @Override
        public ReadStatus read() {
            reads++;
            if (sleepOnRead != 0 && reads != sleepOnRead) {
                return delegate.read();
            }
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ReadStatus.EOF;
            }
            return delegate.read();
        }

        @Override
        public ReadStatus skipTo(long docId) {
            return delegate.skipTo(docId);
        }

        @Override
        public IndexResult current() {
            return delegate.current();
        }

        @Override
        public long lastDocId() {
            return delegate.lastDocId();
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public void abort() {
            aborted = true;
            delegate.abort();
        }

        boolean isAborted() {
            return aborted;
        }

        long reads() {
            return reads;
        }

        @Override
        public void rewind() {
            delegate.rewind();
        }

        @Override
        public long estimatedCount() {
            return delegate.estimatedCount();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
