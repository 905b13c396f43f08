package com.searchcore.index;

/**
 * 查询词及其逆文档频率，附着在词项读取器产生的每个结果上。
 *
 * @param term 查询词文本
 * @param idf 逆文档频率
 */
public record QueryTerm(String term, double idf) {
    public QueryTerm {
        if (term == null) {
            throw new IllegalArgumentException("查询词不能为null");
        }
    }
}
