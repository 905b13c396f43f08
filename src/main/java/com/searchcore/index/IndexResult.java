package com.searchcore.index;

import com.searchcore.config.Constants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 索引结果
 *
 * 每个读取器与迭代节点各自持有一个可复用的结果对象，每次推进时原地改写。
 * 叶子结果（TERM/NUMERIC/VIRTUAL）携带词频、字段掩码、位置或数值；
 * 聚合结果（UNION/INTERSECTION）持有指向子节点当前结果的引用，推进后这些引用即失效。
 * 需要跨推进保留时使用 {@link #deepCopy()}。
 */
public final class IndexResult {
    /** 只剩一个带位置的子结果无法配对时计入的距离 */
    private static final int UNPAIRED_DISTANCE = 100;
    private static final int NON_OFFSET_TYPES = ResultType.VIRTUAL.bit() | ResultType.NUMERIC.bit();

    private final ResultType type;
    private long docId;
    private int freq;
    private long fieldMask;
    private double weight;
    private final OffsetVector offsets;
    private QueryTerm term;
    private double value;
    private final List<IndexResult> children;
    private int typeMask;
    private boolean copy;

    private IndexResult(ResultType type, double weight, int childCapacity) {
        this.type = type;
        this.weight = weight;
        this.offsets = new OffsetVector();
        this.children = type.isAggregate() ? new ArrayList<>(childCapacity) : Collections.emptyList();
    }

    public static IndexResult term(QueryTerm term, double weight) {
        IndexResult result = new IndexResult(ResultType.TERM, weight, 0);
        result.term = term;
        return result;
    }

    public static IndexResult numeric(double weight) {
        IndexResult result = new IndexResult(ResultType.NUMERIC, weight, 0);
        result.freq = 1;
        result.fieldMask = Constants.FIELD_MASK_ALL;
        return result;
    }

    public static IndexResult virtual(double weight) {
        IndexResult result = new IndexResult(ResultType.VIRTUAL, weight, 0);
        result.freq = 1;
        result.fieldMask = Constants.FIELD_MASK_ALL;
        return result;
    }

    public static IndexResult union(int childCapacity, double weight) {
        return new IndexResult(ResultType.UNION, weight, childCapacity);
    }

    public static IndexResult intersection(int childCapacity, double weight) {
        return new IndexResult(ResultType.INTERSECTION, weight, childCapacity);
    }

    public ResultType type() {
        return type;
    }

    public long docId() {
        return docId;
    }

    public void setDocId(long docId) {
        this.docId = docId;
    }

    public int freq() {
        return freq;
    }

    public void setFreq(int freq) {
        this.freq = freq;
    }

    public long fieldMask() {
        return fieldMask;
    }

    public void setFieldMask(long fieldMask) {
        this.fieldMask = fieldMask;
    }

    public double weight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    /**
     * 位置向量视图，仅 TERM 结果有意义。
     */
    public OffsetVector offsets() {
        return offsets;
    }

    public QueryTerm term() {
        return term;
    }

    public void setTerm(QueryTerm term) {
        this.term = term;
    }

    /**
     * 数值，仅 NUMERIC 结果有意义。
     */
    public double value() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    /**
     * 聚合结果的子结果；叶子结果返回空列表。
     */
    public List<IndexResult> children() {
        return children;
    }

    public int numChildren() {
        return children.size();
    }

    /**
     * 子结果类型的位集合，见 {@link ResultType#bit()}。
     */
    public int typeMask() {
        return typeMask;
    }

    public boolean isAggregate() {
        return type.isAggregate();
    }

    public boolean isCopy() {
        return copy;
    }

    /**
     * 追加子结果：词频累加、字段掩码取并、文档ID取子结果的文档ID。
     */
    public void addChild(IndexResult child) {
        if (!isAggregate()) {
            throw new IllegalStateException("叶子结果不能添加子结果: " + type);
        }
        children.add(child);
        typeMask |= child.type.bit();
        freq += child.freq;
        docId = child.docId;
        fieldMask |= child.fieldMask;
    }

    /**
     * 清空聚合状态以便下一次推进。词频不清零，在节点生命周期内持续累加。
     */
    public void resetAggregate() {
        docId = 0;
        children.clear();
        fieldMask = 0;
        typeMask = 0;
    }

    /**
     * 是否可能带有位置信息。
     */
    public boolean hasOffsets() {
        return switch (type) {
            case TERM -> !offsets.isEmpty();
            case UNION, INTERSECTION -> typeMask != 0 && (typeMask & ~NON_OFFSET_TYPES) != 0;
            default -> false;
        };
    }

    /**
     * 按升序遍历该结果下全部词项的位置；聚合结果对所有子结果做 k 路归并。
     */
    public OffsetIterator iterateOffsets() {
        return switch (type) {
            case TERM -> offsets.iterator(this);
            case UNION, INTERSECTION -> children.size() == 1
                    ? children.get(0).iterateOffsets()
                    : new AggregateOffsetIterator(children);
            default -> OffsetIterator.empty();
        };
    }

    /**
     * 相邻带位置子结果之间最小位置距离的平方和开方，用于邻近度打分。
     *
     * @return 叶子或单子结果返回 1；无法计算距离时返回子结果数减一
     */
    public int minOffsetDelta() {
        if (!isAggregate() || children.size() <= 1) {
            return 1;
        }
        int num = children.size();
        long dist = 0;
        int i = 0;
        while (i < num) {
            while (i < num && !children.get(i).hasOffsets()) {
                i++;
            }
            if (i == num) {
                break;
            }
            OffsetIterator left = children.get(i).iterateOffsets();
            i++;
            while (i < num && !children.get(i).hasOffsets()) {
                i++;
            }
            if (i == num) {
                dist = dist != 0 ? dist : UNPAIRED_DISTANCE;
                break;
            }
            OffsetIterator right = children.get(i).iterateOffsets();

            int p1 = left.next();
            int p2 = right.next();
            int closest = Math.abs(p2 - p1);
            while (closest > 1 && p1 != OffsetIterator.EOF && p2 != OffsetIterator.EOF) {
                closest = Math.min(Math.abs(p2 - p1), closest);
                if (p2 > p1) {
                    p1 = left.next();
                } else {
                    p2 = right.next();
                }
            }
            dist += (long) closest * closest;
        }
        return dist != 0 ? (int) Math.sqrt(dist) : num - 1;
    }

    /**
     * 判断子结果的词位置能否落在 maxSlop 的间隔内。
     *
     * @param maxSlop 允许的最大间隔词数
     * @param inOrder 是否要求按子结果顺序出现
     */
    public boolean isWithinRange(int maxSlop, boolean inOrder) {
        if (!isAggregate() || children.size() <= 1) {
            return true;
        }
        int num = children.size();
        OffsetIterator[] iterators = new OffsetIterator[num];
        int n = 0;
        for (IndexResult child : children) {
            if (child.hasOffsets()) {
                iterators[n++] = child.iterateOffsets();
            }
        }
        if (n == 0) {
            return true;
        }
        int[] positions = new int[n];
        return inOrder
                ? withinRangeInOrder(iterators, positions, n, maxSlop)
                : withinRangeUnordered(iterators, positions, n, maxSlop);
    }

    private static boolean withinRangeInOrder(OffsetIterator[] iterators, int[] positions, int num, int maxSlop) {
        // -1 表示尚未读取
        for (int i = 1; i < num; i++) {
            positions[i] = -1;
        }
        while (true) {
            int span = 0;
            for (int i = 0; i < num; i++) {
                int pos = i == 0 ? iterators[0].next() : positions[i];
                int lastPos = i == 0 ? 0 : positions[i - 1];
                while (pos != OffsetIterator.EOF && pos < lastPos) {
                    pos = iterators[i].next();
                }
                if (pos == OffsetIterator.EOF) {
                    return false;
                }
                positions[i] = pos;
                if (i > 0) {
                    span += pos - lastPos - 1;
                    if (span > maxSlop) {
                        break;
                    }
                }
            }
            if (span <= maxSlop) {
                return true;
            }
        }
    }

    private static boolean withinRangeUnordered(OffsetIterator[] iterators, int[] positions, int num, int maxSlop) {
        int max = 0;
        for (int i = 0; i < num; i++) {
            positions[i] = iterators[i].next();
            max = Math.max(max, positions[i]);
        }
        while (true) {
            int minIndex = 0;
            for (int i = 1; i < num; i++) {
                if (positions[i] < positions[minIndex]) {
                    minIndex = i;
                }
            }
            int min = positions[minIndex];
            if (min != max) {
                int span = max - min - (num - 1);
                if (span <= maxSlop) {
                    return true;
                }
            }
            positions[minIndex] = iterators[minIndex].next();
            if (positions[minIndex] == OffsetIterator.EOF) {
                return false;
            }
            if (positions[minIndex] > max) {
                max = positions[minIndex];
            }
        }
    }

    /**
     * 深拷贝：位置字节与子结果均独立持有，结果标记为副本。
     */
    public IndexResult deepCopy() {
        IndexResult result = new IndexResult(type, weight, children.size());
        result.docId = docId;
        result.freq = freq;
        result.fieldMask = fieldMask;
        result.term = term;
        result.value = value;
        result.typeMask = typeMask;
        result.copy = true;
        if (!offsets.isEmpty()) {
            result.offsets.reset(offsets.copy());
        }
        for (IndexResult child : children) {
            result.children.add(child.deepCopy());
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append("{docId=").append(docId)
                .append(", freq=").append(freq)
                .append(", fieldMask=0x").append(Long.toHexString(fieldMask));
        if (type == ResultType.TERM && term != null) {
            sb.append(", term=").append(term.term());
        }
        if (type == ResultType.NUMERIC) {
            sb.append(", value=").append(value);
        }
        if (isAggregate()) {
            sb.append(", children=").append(children);
        }
        return sb.append('}').toString();
    }
}
