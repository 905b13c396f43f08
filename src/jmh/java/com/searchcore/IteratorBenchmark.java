package com.searchcore;

import com.searchcore.config.Constants;
import com.searchcore.config.EngineConfig;
import com.searchcore.document.DocumentTable;
import com.searchcore.index.IndexFlag;
import com.searchcore.index.InvertedIndex;
import com.searchcore.index.OffsetVector;
import com.searchcore.index.PostingEntry;
import com.searchcore.index.QueryTerm;
import com.searchcore.index.TermIndexReader;
import com.searchcore.query.IndexIterator;
import com.searchcore.query.IntersectIterator;
import com.searchcore.query.QueryExecutor;
import com.searchcore.query.ReadIterator;
import com.searchcore.query.ReadStatus;
import com.searchcore.query.UnionIterator;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 倒排写入与查询迭代性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IteratorBenchmark {

    private static final int DOCS = 100_000;

    @Benchmark
    public long writeThroughput() {
        try (InvertedIndex index = new InvertedIndex(IndexFlag.defaults())) {
            OffsetVector offsets = OffsetVector.of(1, 5, 9);
            for (int i = 1; i <= DOCS; i++) {
                index.writeEntry(new PostingEntry(i, 1, 3, offsets));
            }
            return index.memoryUsage();
        }
    }

    @State(Scope.Benchmark)
    public static class QueryState {
        InvertedIndex step2;
        InvertedIndex step3;
        DocumentTable docTable;
        QueryExecutor executor;

        @Setup
        public void setup() {
            step2 = createIndex(DOCS, 2);
            step3 = createIndex(DOCS, 3);
            docTable = new DocumentTable(EngineConfig.defaults());
            for (int i = 1; i <= DOCS * 3; i++) {
                docTable.put("doc" + i, i % 100, null, null);
            }
            executor = new QueryExecutor(docTable, EngineConfig.defaults());
        }

        @TearDown
        public void tearDown() {
            step2.close();
            step3.close();
        }

        private static InvertedIndex createIndex(int size, long step) {
            InvertedIndex index = new InvertedIndex(IndexFlag.defaults());
            for (int i = 1; i <= size; i++) {
                index.writeEntry(new PostingEntry(i * step, 1, 1, OffsetVector.of(i % 32)));
            }
            return index;
        }

        IndexIterator reader(InvertedIndex index) {
            return new ReadIterator(new TermIndexReader(index, Constants.FIELD_MASK_ALL, new QueryTerm("t", 1.0), 1.0));
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int intersectDrain(QueryState state) {
        IndexIterator intersect = new IntersectIterator(
                List.of(state.reader(state.step2), state.reader(state.step3)), Constants.FIELD_MASK_ALL, -1, false, 1.0);
        int count = 0;
        while (intersect.read() == ReadStatus.OK) {
            count++;
        }
        return count;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int unionDrain(QueryState state) {
        IndexIterator union = new UnionIterator(
                List.of(state.reader(state.step2), state.reader(state.step3)), false, 1.0);
        int count = 0;
        while (union.read() == ReadStatus.OK) {
            count++;
        }
        return count;
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long queryTop10(QueryState state) {
        IndexIterator union = new UnionIterator(
                List.of(state.reader(state.step2), state.reader(state.step3)), false, 1.0);
        return state.executor.execute(union, 0, 10).totalMatched();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IteratorBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
