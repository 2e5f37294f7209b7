package com.github.blockcache.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 不可变的字节区间视图，引用外部存储，不拷贝数据
 * 用作缓存的key：缓存在插入时会拷贝key字节，因此调用方可以复用底层缓冲区
 *
 * 线程安全：实例不可变，但底层数组被外部修改时视图内容随之变化
 */
public final class Slice implements Comparable<Slice> {
    public static final Slice EMPTY = new Slice(new byte[0]);

    private final byte[] data;
    private final int offset;
    private final int length;

    public Slice(byte[] data) {
        this(data, 0, data.length);
    }

    public Slice(byte[] data, int offset, int length) {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    public static Slice of(String s) {
        return new Slice(s.getBytes(StandardCharsets.UTF_8));
    }

    public int size() {
        return length;
    }

    public boolean empty() {
        return length == 0;
    }

    /** 返回第n个字节，要求 n < size() */
    public byte get(int n) {
        Objects.checkIndex(n, length);
        return data[offset + n];
    }

    /** 丢弃前n个字节，返回新的视图（原视图不变） */
    public Slice removePrefix(int n) {
        Objects.checkFromToIndex(0, n, length);
        return n == 0 ? this : new Slice(data, offset + n, length - n);
    }

    public boolean startsWith(Slice prefix) {
        return length >= prefix.length
                && Arrays.equals(data, offset, offset + prefix.length,
                prefix.data, prefix.offset, prefix.offset + prefix.length);
    }

    /**
     * 三路比较：按无符号字节字典序，较短的前缀排在前面
     */
    @Override
    public int compareTo(Slice other) {
        return Arrays.compareUnsigned(data, offset, offset + length,
                other.data, other.offset, other.offset + other.length);
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    // 包级访问：供Hash/Crc32c直接读取底层数组，避免拷贝
    byte[] rawArray() {
        return data;
    }

    int rawOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slice)) return false;
        Slice other = (Slice) o;
        return Arrays.equals(data, offset, offset + length,
                other.data, other.offset, other.offset + other.length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = offset; i < offset + length; i++) {
            result = 31 * result + data[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return new String(data, offset, length, StandardCharsets.UTF_8);
    }
}
