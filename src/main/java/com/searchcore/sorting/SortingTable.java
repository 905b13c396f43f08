package com.searchcore.sorting;

import com.searchcore.config.Constants;
import com.searchcore.query.ErrorCode;
import com.searchcore.query.QueryError;

import java.util.ArrayList;
import java.util.List;

/**
 * 可排序字段表，声明顺序即槽位下标。
 */
public final class SortingTable {
    private final List<Field> fields = new ArrayList<>();

    /**
     * 追加一个可排序字段。
     *
     * @return 槽位下标；表已满时返回 -1
     */
    public int add(String name, SortableType type) {
        return add(name, type, null);
    }

    /**
     * 追加一个可排序字段，表已满时把 LIMIT 错误记录到 error。
     *
     * @param name 字段名
     * @param type 字段类型
     * @param error 错误输出参数，可为null
     * @return 槽位下标；表已满时返回 -1
     */
    public int add(String name, SortableType type, QueryError error) {
        if (name == null || type == null) {
            throw new IllegalArgumentException("字段名与类型不能为null");
        }
        if (fields.size() >= Constants.SORTABLES_MAX) {
            if (error != null) {
                error.setError(ErrorCode.LIMIT, "可排序字段数超过上限 " + Constants.SORTABLES_MAX + ": " + name);
            }
            return -1;
        }
        fields.add(new Field(name, type));
        return fields.size() - 1;
    }

    /**
     * 按名称查找槽位下标，忽略大小写。
     *
     * @return 槽位下标，不存在时返回 -1
     */
    public int getFieldIdx(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return fields.size();
    }

    public String fieldName(int index) {
        return fields.get(index).name();
    }

    public SortableType fieldType(int index) {
        return fields.get(index).type();
    }

    /**
     * 创建与本表槽位数相同的空向量。
     */
    public SortingVector newVector() {
        return new SortingVector(fields.size());
    }

    private record Field(String name, SortableType type) {
    }
}
