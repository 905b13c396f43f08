package com.searchcore.index;

import com.searchcore.config.Constants;
import com.searchcore.storage.BufferReader;
import com.searchcore.storage.BufferWriter;
import com.searchcore.storage.QIntCodec;

import java.util.Set;

/**
 * 倒排条目编码方式，由索引标志唯一确定
 *
 * 每种编码只保存标志要求的信息：差值总是保存，词频、字段掩码、位置按需保存。
 * 未保存词频时解码为 1，未保存字段掩码时解码为全部字段。
 * 非宽模式下字段掩码截断为32位放进 QInt 组，宽模式下单独以 VarLong 写出。
 */
public enum PostingCodec {
    /** q(delta, freq, mask, offLen) + offsets */
    FULL {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode4(writer, (int) delta, record.freq(), (int) record.fieldMask(), offsets.length());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 4);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(Integer.toUnsignedLong(values[2]));
            readOffsets(reader, values[3], record);
            return matchesFields(record, context);
        }
    },
    /** q(delta, freq, offLen) + wide mask + offsets */
    FULL_WIDE {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode3(writer, (int) delta, record.freq(), offsets.length());
            size += writer.writeVarintFieldMask(record.fieldMask());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 3);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(reader.readVarintFieldMask());
            readOffsets(reader, values[2], record);
            return matchesFields(record, context);
        }
    },
    /** q(delta, freq, mask) */
    FREQS_FIELDS {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            return QIntCodec.encode3(writer, (int) delta, record.freq(), (int) record.fieldMask());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 3);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(Integer.toUnsignedLong(values[2]));
            return matchesFields(record, context);
        }
    },
    /** q(delta, freq) + wide mask */
    FREQS_FIELDS_WIDE {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            int size = QIntCodec.encode2(writer, (int) delta, record.freq());
            return size + writer.writeVarintFieldMask(record.fieldMask());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 2);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(reader.readVarintFieldMask());
            return matchesFields(record, context);
        }
    },
    /** q(delta, freq) */
    FREQS_ONLY {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            return QIntCodec.encode2(writer, (int) delta, record.freq());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 2);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(Constants.FIELD_MASK_ALL);
            return true;
        }
    },
    /** q(delta, mask) */
    FIELDS_ONLY {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            return QIntCodec.encode2(writer, (int) delta, (int) record.fieldMask());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 2);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(1);
            record.setFieldMask(Integer.toUnsignedLong(values[1]));
            return matchesFields(record, context);
        }
    },
    /** v(delta) + wide mask */
    FIELDS_ONLY_WIDE {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            int size = writer.writeVarint(delta);
            return size + writer.writeVarintFieldMask(record.fieldMask());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            record.setDocId(baseId + reader.readVarint());
            record.setFreq(1);
            record.setFieldMask(reader.readVarintFieldMask());
            return matchesFields(record, context);
        }
    },
    /** q(delta, offLen) + offsets */
    OFFSETS_ONLY {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode2(writer, (int) delta, offsets.length());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 2);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(1);
            record.setFieldMask(Constants.FIELD_MASK_ALL);
            readOffsets(reader, values[1], record);
            return true;
        }
    },
    /** q(delta, mask, offLen) + offsets */
    FIELDS_OFFSETS {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode3(writer, (int) delta, (int) record.fieldMask(), offsets.length());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 3);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(1);
            record.setFieldMask(Integer.toUnsignedLong(values[1]));
            readOffsets(reader, values[2], record);
            return matchesFields(record, context);
        }
    },
    /** q(delta, offLen) + wide mask + offsets */
    FIELDS_OFFSETS_WIDE {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode2(writer, (int) delta, offsets.length());
            size += writer.writeVarintFieldMask(record.fieldMask());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 2);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(1);
            record.setFieldMask(reader.readVarintFieldMask());
            readOffsets(reader, values[1], record);
            return matchesFields(record, context);
        }
    },
    /** q(delta, freq, offLen) + offsets */
    FREQS_OFFSETS {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            OffsetVector offsets = record.offsets();
            int size = QIntCodec.encode3(writer, (int) delta, record.freq(), offsets.length());
            return size + offsets.writeTo(writer);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            int[] values = context.scratch;
            QIntCodec.decode(reader, values, 3);
            record.setDocId(baseId + Integer.toUnsignedLong(values[0]));
            record.setFreq(values[1]);
            record.setFieldMask(Constants.FIELD_MASK_ALL);
            readOffsets(reader, values[2], record);
            return true;
        }
    },
    /** v(delta) */
    DOC_IDS_ONLY {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            return writer.writeVarint(delta);
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            record.setDocId(baseId + reader.readVarint());
            record.setFreq(1);
            record.setFieldMask(Constants.FIELD_MASK_ALL);
            return true;
        }
    },
    /** 数值条目，见 {@link NumericCodec} */
    NUMERIC {
        @Override
        public int encode(BufferWriter writer, long delta, IndexResult record) {
            return NumericCodec.encode(writer, delta, record.value());
        }

        @Override
        boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record) {
            long delta = NumericCodec.decode(reader, record);
            record.setDocId(baseId + delta);
            NumericFilter filter = context.numericFilter;
            return filter == null || filter.matches(record.value());
        }
    };

    /**
     * 把一条记录编码到写入器。
     *
     * @param writer 写入器
     * @param delta 与块内上一条目的docId差值，32位无符号
     * @param record 待编码记录
     * @return 写入的字节数
     */
    public abstract int encode(BufferWriter writer, long delta, IndexResult record);

    /**
     * 解码一条记录到 record。
     *
     * @return 记录是否通过字段掩码或数值过滤
     */
    abstract boolean decode(BufferReader reader, long baseId, DecoderContext context, IndexResult record);

    /**
     * 根据索引标志选择编码方式。
     */
    public static PostingCodec forFlags(Set<IndexFlag> flags) {
        if (flags.contains(IndexFlag.STORE_NUMERIC)) {
            return NUMERIC;
        }
        boolean freqs = flags.contains(IndexFlag.STORE_FREQS);
        boolean fields = flags.contains(IndexFlag.STORE_FIELD_FLAGS);
        boolean offsets = flags.contains(IndexFlag.STORE_TERM_OFFSETS);
        boolean wide = fields && flags.contains(IndexFlag.WIDE_SCHEMA);

        if (freqs && fields && offsets) {
            return wide ? FULL_WIDE : FULL;
        }
        if (freqs && fields) {
            return wide ? FREQS_FIELDS_WIDE : FREQS_FIELDS;
        }
        if (fields && offsets) {
            return wide ? FIELDS_OFFSETS_WIDE : FIELDS_OFFSETS;
        }
        if (fields) {
            return wide ? FIELDS_ONLY_WIDE : FIELDS_ONLY;
        }
        if (freqs && offsets) {
            return FREQS_OFFSETS;
        }
        if (freqs) {
            return FREQS_ONLY;
        }
        if (offsets) {
            return OFFSETS_ONLY;
        }
        return DOC_IDS_ONLY;
    }

    private static void readOffsets(BufferReader reader, int length, IndexResult record) {
        record.offsets().reset(reader.data(), reader.position(), length);
        reader.skip(length);
    }

    private static boolean matchesFields(IndexResult record, DecoderContext context) {
        return (record.fieldMask() & context.fieldMask) != 0;
    }
}
