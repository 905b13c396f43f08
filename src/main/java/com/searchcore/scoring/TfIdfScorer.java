package com.searchcore.scoring;

import com.searchcore.document.DocumentMetadata;
import com.searchcore.index.IndexResult;
import com.searchcore.index.ResultType;

/**
 * TF-IDF 打分
 *
 * 词项叶子贡献 weight * freq * idf，聚合节点把子节点得分之和乘以自身权重，
 * 其他叶子贡献 weight * freq。最终乘以文档先验分，再除以子词项间的最小位置距离。
 */
public class TfIdfScorer {
    private final boolean proximity;

    public TfIdfScorer() {
        this(true);
    }

    /**
     * @param proximity 是否按 {@link IndexResult#minOffsetDelta()} 折减得分
     */
    public TfIdfScorer(boolean proximity) {
        this.proximity = proximity;
    }

    public double score(IndexResult result, DocumentMetadata metadata) {
        if (result == null || metadata == null) {
            return 0.0;
        }
        double score = metadata.score() * termScore(result);
        if (proximity) {
            score /= Math.max(result.minOffsetDelta(), 1);
        }
        return score;
    }

    /**
     * 不含文档先验分的词项得分。
     */
    public double termScore(IndexResult result) {
        if (result.type() == ResultType.TERM) {
            double idf = result.term() == null ? 0.0 : result.term().idf();
            return result.weight() * result.freq() * idf;
        }
        if (result.isAggregate()) {
            double sum = 0.0;
            for (IndexResult child : result.children()) {
                sum += termScore(child);
            }
            return result.weight() * sum;
        }
        return result.weight() * result.freq();
    }

    /**
     * 逆文档频率：log(1 + totalDocs / termDocs)。
     */
    public static double idf(long totalDocs, long termDocs) {
        long boundedTotal = Math.max(totalDocs, 1);
        long boundedTermDocs = Math.max(termDocs, 1);
        return Math.log1p((double) boundedTotal / boundedTermDocs);
    }
}
