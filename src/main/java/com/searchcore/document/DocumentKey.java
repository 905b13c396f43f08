package com.searchcore.document;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 外部文档键，按字节内容比较，允许包含 NUL 等任意字节。
 */
public final class DocumentKey {
    private final byte[] bytes;
    private final int hash;

    private DocumentKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * 拷贝字节构造键。
     */
    public static DocumentKey of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("文档键不能为null");
        }
        return new DocumentKey(Arrays.copyOf(bytes, bytes.length));
    }

    public static DocumentKey of(String key) {
        if (key == null) {
            throw new IllegalArgumentException("文档键不能为null");
        }
        return new DocumentKey(key.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentKey that)) {
            return false;
        }
        return hash == that.hash && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
