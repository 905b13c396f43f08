package com.searchcore.query;

import com.searchcore.config.Constants;
import com.searchcore.config.EngineConfig;
import com.searchcore.document.DocumentKey;
import com.searchcore.document.DocumentMetadata;
import com.searchcore.document.DocumentTable;
import com.searchcore.index.IndexResult;
import com.searchcore.scoring.TfIdfScorer;
import com.searchcore.sorting.SortingKey;
import com.searchcore.sorting.SortingVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 查询执行器
 *
 * 驱动已构建的迭代器树直到 EOF、超时或取消：逐条解析文档元数据、跳过已删除文档、
 * 打分或按排序键比较，保留前 offset + limit 条命中。迭代器树由调用方持有和关闭。
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DocumentTable docTable;
    private final EngineConfig config;
    private final TfIdfScorer scorer;

    public QueryExecutor(DocumentTable docTable, EngineConfig config) {
        this(docTable, config, new TfIdfScorer());
    }

    public QueryExecutor(DocumentTable docTable, EngineConfig config, TfIdfScorer scorer) {
        if (docTable == null || config == null || scorer == null) {
            throw new IllegalArgumentException("文档表、配置与打分器不能为null");
        }
        this.docTable = docTable;
        this.config = config;
        this.scorer = scorer;
    }

    public SearchResult execute(IndexIterator root, int offset, int limit) {
        return execute(root, offset, limit, List.of());
    }

    /**
     * 执行查询。
     *
     * @param root 迭代器树的根
     * @param offset 跳过的命中数
     * @param limit 返回的命中数
     * @param sortBy 排序键，空列表表示按得分降序
     * @return 查询结果
     */
    public SearchResult execute(IndexIterator root, int offset, int limit, List<SortingKey> sortBy) {
        if (root == null) {
            throw new IllegalArgumentException("迭代器不能为null");
        }
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset与limit不能为负数: offset=" + offset + ", limit=" + limit);
        }
        List<SortingKey> keys = sortBy == null ? List.of() : sortBy;
        long startNanos = System.nanoTime();
        long timeoutNanos = config.getQueryTimeoutMs() * 1_000_000L;
        QueryError error = new QueryError();

        int wanted = (int) Math.min((long) offset + limit, Integer.MAX_VALUE);
        boolean unsorted = keys.isEmpty() && wanted > config.getMaxResultsToUnsortedMode();
        Comparator<SearchHit> ranking = rankingComparator(keys, error);
        // 堆顶是当前最差的命中
        PriorityQueue<SearchHit> heap = new PriorityQueue<>(Math.max(1, Math.min(wanted, 1024)), ranking.reversed());
        List<SearchHit> unsortedHits = new ArrayList<>();

        long totalMatched = 0;
        long reads = 0;
        boolean timedOut = false;
        while (root.read() == ReadStatus.OK) {
            reads++;
            IndexResult result = root.current();
            DocumentMetadata metadata = docTable.get(result.docId());
            if (metadata != null && metadata.tryIncref()) {
                try {
                    totalMatched++;
                    if (wanted > 0) {
                        SearchHit hit = new SearchHit(result.docId(), DocumentKey.of(metadata.key()),
                                scorer.score(result, metadata), metadata.sortVector());
                        if (unsorted) {
                            if (unsortedHits.size() < wanted) {
                                unsortedHits.add(hit);
                            }
                        } else {
                            heap.add(hit);
                            if (heap.size() > wanted) {
                                heap.poll();
                            }
                        }
                    }
                } finally {
                    metadata.decref();
                }
            }

            // 当前命中已计入后再检查超时
            if (timeoutNanos > 0 && reads % Constants.TIMEOUT_CHECK_INTERVAL == 0
                    && System.nanoTime() - startNanos > timeoutNanos) {
                root.abort();
                timedOut = true;
                logger.warn("查询超时，已中止迭代: timeoutMs={}, reads={}, policy={}",
                        config.getQueryTimeoutMs(), reads, config.getTimeoutPolicy());
                break;
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (timedOut && config.getTimeoutPolicy() == TimeoutPolicy.FAIL) {
            error.setError(ErrorCode.TIMED_OUT, "查询超过 " + config.getQueryTimeoutMs() + "ms 未完成");
            return new SearchResult(List.of(), totalMatched, elapsedMs, true, error);
        }

        List<SearchHit> ranked;
        if (unsorted) {
            ranked = unsortedHits;
        } else {
            ranked = new ArrayList<>(heap);
            ranked.sort(ranking);
        }
        List<SearchHit> page = offset >= ranked.size()
                ? List.of()
                : List.copyOf(ranked.subList(offset, ranked.size()));
        logger.debug("查询完成: totalMatched={}, returned={}, elapsedMs={}", totalMatched, page.size(), elapsedMs);
        return new SearchResult(page, totalMatched, elapsedMs, timedOut, error);
    }

    /**
     * 无排序键时按得分降序，否则按排序键；均相同时docId小者在前。
     */
    private static Comparator<SearchHit> rankingComparator(List<SortingKey> keys, QueryError error) {
        if (keys.isEmpty()) {
            return Comparator.comparingDouble(SearchHit::score).reversed()
                    .thenComparingLong(SearchHit::docId);
        }
        int width = 0;
        for (SortingKey key : keys) {
            width = Math.max(width, key.index() + 1);
        }
        SortingVector missing = new SortingVector(width);
        Comparator<SearchHit> bySortKeys = (left, right) -> SortingVector.cmp(
                vectorOrMissing(left, missing), vectorOrMissing(right, missing), keys, error);
        return bySortKeys.thenComparingLong(SearchHit::docId);
    }

    private static SortingVector vectorOrMissing(SearchHit hit, SortingVector missing) {
        SortingVector vector = hit.sortVector();
        return vector == null || vector.length() < missing.length() ? missing : vector;
    }

    public DocumentTable getDocTable() {
        return docTable;
    }
}
