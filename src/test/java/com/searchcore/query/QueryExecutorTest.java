package com.searchcore.query;

import com.searchcore.config.Constants;
import com.searchcore.config.EngineConfig;
import com.searchcore.document.DocumentTable;
import com.searchcore.index.InvertedIndex;
import com.searchcore.scoring.TfIdfScorer;
import com.searchcore.sorting.SortingKey;
import com.searchcore.sorting.SortingVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.searchcore.query.QueryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class QueryExecutorTest {

    private static final int DOCS = 100;

    private EngineConfig config;
    private DocumentTable docTable;
    private InvertedIndex index;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        docTable = new DocumentTable(10, 1000);
        for (int i = 1; i <= DOCS; i++) {
            assertEquals(i, docTable.put("doc" + i, i, null, null));
        }
        index = createIndex(DOCS, 1);
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    private static List<Long> docIds(SearchResult result) {
        List<Long> ids = new ArrayList<>();
        for (SearchHit hit : result.hits()) {
            ids.add(hit.docId());
        }
        return ids;
    }

    // ==================== 打分排序测试 ====================

    @Test
    @DisplayName("按得分降序返回前 limit 条")
    void testTopByScore() {
        QueryExecutor executor = new QueryExecutor(docTable, config);
        SearchResult result = executor.execute(reader(index), 0, 5);

        assertEquals(ids(100, 99, 98, 97, 96), docIds(result));
        assertEquals(DOCS, result.totalMatched());
        assertFalse(result.timedOut());
        assertFalse(result.error().hasError());

        SearchHit top = result.hits().get(0);
        assertEquals("doc100", top.key().toString());
        assertEquals(100.0, top.score(), 1e-9);
    }

    @Test
    @DisplayName("offset 跳过前面的命中")
    void testOffset() {
        QueryExecutor executor = new QueryExecutor(docTable, config);

        assertEquals(ids(95, 94, 93), docIds(executor.execute(reader(index), 5, 3)));
        assertTrue(executor.execute(reader(index), 200, 10).hits().isEmpty());
    }

    @Test
    @DisplayName("limit 为 0 时只统计命中数")
    void testCountOnly() {
        SearchResult result = new QueryExecutor(docTable, config).execute(reader(index), 0, 0);

        assertTrue(result.hits().isEmpty());
        assertEquals(DOCS, result.totalMatched());
    }

    @Test
    @DisplayName("得分相同时docId小者在前")
    void testTieBreakByDocId() {
        DocumentTable flat = new DocumentTable(10, 1000);
        for (int i = 1; i <= DOCS; i++) {
            flat.put("doc" + i, 1.0f, null, null);
        }
        SearchResult result = new QueryExecutor(flat, config).execute(reader(index), 0, 3);

        assertEquals(ids(1, 2, 3), docIds(result));
    }

    @Test
    @DisplayName("已删除的文档不出现在结果中")
    void testDeletedSkipped() {
        assertTrue(docTable.delete("doc100"));
        assertTrue(docTable.delete("doc98"));

        SearchResult result = new QueryExecutor(docTable, config).execute(reader(index), 0, 3);

        assertEquals(ids(99, 97, 96), docIds(result));
        assertEquals(DOCS - 2, result.totalMatched());
    }

    @Test
    @DisplayName("关闭邻近度折减时得分为先验分乘以词项得分")
    void testScorerWithoutProximity() {
        QueryExecutor executor = new QueryExecutor(docTable, config, new TfIdfScorer(false));
        SearchResult result = executor.execute(reader(index, 2.0), 0, 1);

        assertEquals(200.0, result.hits().get(0).score(), 1e-9);
    }

    // ==================== 排序键测试 ====================

    @Test
    @DisplayName("按排序键排序，相同时按docId")
    void testSortByKey() {
        for (int i = 1; i <= DOCS; i++) {
            SortingVector vector = new SortingVector(2);
            vector.putNumber(0, i % 10);
            vector.putString(1, "name" + (DOCS - i));
            docTable.setSortingVector(i, vector);
        }
        QueryExecutor executor = new QueryExecutor(docTable, config);

        SearchResult ascending = executor.execute(reader(index), 0, 3, List.of(new SortingKey(0, true)));
        assertEquals(ids(10, 20, 30), docIds(ascending));

        SearchResult descending = executor.execute(reader(index), 0, 3,
                List.of(new SortingKey(0, false), new SortingKey(1, true)));
        assertEquals(ids(99, 89, 79), docIds(descending));
        assertFalse(descending.error().hasError());
    }

    @Test
    @DisplayName("没有排序向量的文档按空值处理")
    void testMissingSortVector() {
        for (int i = 1; i <= 50; i++) {
            SortingVector vector = new SortingVector(1);
            vector.putNumber(0, i);
            docTable.setSortingVector(i, vector);
        }
        QueryExecutor executor = new QueryExecutor(docTable, config);

        SearchResult ascending = executor.execute(reader(index), 0, 3, List.of(new SortingKey(0, true)));
        assertEquals(ids(51, 52, 53), docIds(ascending));

        SearchResult descending = executor.execute(reader(index), 0, 3, List.of(new SortingKey(0, false)));
        assertEquals(ids(50, 49, 48), docIds(descending));
    }

    @Test
    @DisplayName("排序值类型不一致时记录错误")
    void testSortTypeMismatch() {
        for (int i = 1; i <= DOCS; i++) {
            SortingVector vector = new SortingVector(1);
            if (i == 1) {
                vector.putString(0, "text");
            } else {
                vector.putNumber(0, i);
            }
            docTable.setSortingVector(i, vector);
        }
        SearchResult result = new QueryExecutor(docTable, config)
                .execute(reader(index), 0, 5, List.of(new SortingKey(0, true)));

        assertEquals(ErrorCode.TYPE_MISMATCH, result.error().getCode());
        assertEquals(5, result.hits().size());
    }

    @Test
    @DisplayName("结果数超过阈值且无排序键时按文档顺序收集")
    void testUnsortedMode() {
        config.setMaxResultsToUnsortedMode(5);
        SearchResult result = new QueryExecutor(docTable, config).execute(reader(index), 2, 8);

        assertEquals(ids(3, 4, 5, 6, 7, 8, 9, 10), docIds(result));
        assertEquals(DOCS, result.totalMatched());
    }

    // ==================== 超时测试 ====================

    @Test
    @DisplayName("超时按 RETURN 策略返回部分结果")
    void testTimeoutReturnsPartial() {
        for (int i = DOCS + 1; i <= 3 * DOCS; i++) {
            docTable.put("doc" + i, i, null, null);
        }
        config.setQueryTimeoutMs(20);
        config.setTimeoutPolicy(TimeoutPolicy.RETURN);
        try (InvertedIndex large = createIndex(3 * DOCS, 1)) {
            SlowIterator slow = new SlowIterator(reader(large), 1);

            SearchResult result = new QueryExecutor(docTable, config).execute(slow, 0, 10);

            assertTrue(result.timedOut());
            assertTrue(slow.isAborted(), "超时后应中止迭代器");
            assertFalse(result.error().hasError());
            assertEquals(Constants.TIMEOUT_CHECK_INTERVAL, slow.reads(), "第一次检查即超时");
            assertEquals(Constants.TIMEOUT_CHECK_INTERVAL, result.totalMatched());
            assertEquals(ids(100, 99, 98, 97, 96, 95, 94, 93, 92, 91), docIds(result));
        }
    }

    @Test
    @DisplayName("触发超时的那次读取命中仍计入结果")
    void testTimeoutKeepsLastReadHit() {
        config.setQueryTimeoutMs(1);
        config.setTimeoutPolicy(TimeoutPolicy.RETURN);
        SlowIterator slow = new SlowIterator(reader(index), 5, Constants.TIMEOUT_CHECK_INTERVAL);

        SearchResult result = new QueryExecutor(docTable, config).execute(slow, 0, DOCS);

        assertTrue(result.timedOut());
        assertEquals(Constants.TIMEOUT_CHECK_INTERVAL, slow.reads());
        assertEquals(Constants.TIMEOUT_CHECK_INTERVAL, result.totalMatched());
        assertEquals(Constants.TIMEOUT_CHECK_INTERVAL, result.hits().size());
        assertEquals(DOCS, result.hits().get(0).docId(), "最后读到的文档得分最高");
    }

    @Test
    @DisplayName("超时按 FAIL 策略返回错误")
    void testTimeoutFails() {
        config.setQueryTimeoutMs(20);
        config.setTimeoutPolicy(TimeoutPolicy.FAIL);
        SlowIterator slow = new SlowIterator(reader(index), 1);

        SearchResult result = new QueryExecutor(docTable, config).execute(slow, 0, 10);

        assertTrue(result.timedOut());
        assertTrue(result.hits().isEmpty());
        assertEquals(ErrorCode.TIMED_OUT, result.error().getCode());
    }

    @Test
    @DisplayName("超时为 0 时不检查超时")
    void testTimeoutDisabled() {
        config.setQueryTimeoutMs(0);
        SearchResult result = new QueryExecutor(docTable, config).execute(reader(index), 0, 10);

        assertFalse(result.timedOut());
        assertEquals(DOCS, result.totalMatched());
    }

    // ==================== 分页边界测试 ====================

    @Test
    @DisplayName("offset + limit 超出 int 范围时按上限处理")
    void testHugeLimitDoesNotOverflow() {
        QueryExecutor executor = new QueryExecutor(docTable, config);

        SearchResult unsorted = executor.execute(reader(index), 1, Integer.MAX_VALUE);
        assertEquals(DOCS, unsorted.totalMatched());
        assertEquals(DOCS - 1, unsorted.hits().size());
        assertEquals(2, unsorted.hits().get(0).docId(), "超过阈值时按文档顺序返回");

        config.setMaxResultsToUnsortedMode(Integer.MAX_VALUE);
        SearchResult ranked = executor.execute(reader(index), 1, Integer.MAX_VALUE);
        assertEquals(DOCS - 1, ranked.hits().size());
        assertEquals(99, ranked.hits().get(0).docId());
        assertEquals(1, ranked.hits().get(DOCS - 2).docId());
    }

    // ==================== 参数校验测试 ====================

    @Test
    void testInvalidArguments() {
        QueryExecutor executor = new QueryExecutor(docTable, config);

        assertThrows(IllegalArgumentException.class, () -> executor.execute(reader(index), -1, 10));
        assertThrows(IllegalArgumentException.class, () -> executor.execute(reader(index), 0, -1));
        assertThrows(IllegalArgumentException.class, () -> executor.execute(null, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new QueryExecutor(null, config));
    }
}
