package com.github.blockcache.util;

/**
 * 类murmur的32位非加密哈希，用于分片选择与哈希表定位
 * 每次处理4字节（固定按小端解释，与平台字节序无关），再折叠末尾1~3字节
 */
public final class Hash {
    private static final int M = 0xc6a4a793;
    private static final int R = 24;

    private Hash() {
    }

    public static int hash(Slice key, int seed) {
        return hash(key.rawArray(), key.rawOffset(), key.size(), seed);
    }

    public static int hash(byte[] data, int seed) {
        return hash(data, 0, data.length, seed);
    }

    public static int hash(byte[] data, int offset, int length, int seed) {
        int h = seed ^ (length * M);
        int i = offset;
        int limit = offset + length;

        while (i + 4 <= limit) {
            int w = (data[i] & 0xff)
                    | (data[i + 1] & 0xff) << 8
                    | (data[i + 2] & 0xff) << 16
                    | (data[i + 3] & 0xff) << 24;
            i += 4;
            h += w;
            h *= M;
            h ^= h >>> 16;
        }

        switch (limit - i) {
            case 3:
                h += (data[i + 2] & 0xff) << 16;
                // fall through
            case 2:
                h += (data[i + 1] & 0xff) << 8;
                // fall through
            case 1:
                h += data[i] & 0xff;
                h *= M;
                h ^= h >>> R;
                break;
            default:
                break;
        }
        return h;
    }
}
