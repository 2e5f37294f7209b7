package com.github.blockcache;

public final class CacheUtils {
    private CacheUtils() {
    }

    /**
     * 计算桶数组长度：大于等于n的最小2的幂，且不小于minimum
     * 例如：n=5, minimum=4 → 8；n=0, minimum=4 → 4
     */
    public static int tableSizeFor(int n, int minimum) {
        int cap = minimum;
        while (cap < n) {
            cap <<= 1;
        }
        return cap;
    }

    /**
     * 每个分片的容量：向上取整，保证各分片容量之和不小于总容量
     * 先除后补余数，capacity接近Long.MAX_VALUE时不会溢出
     */
    public static long perShardCapacity(long capacity, int shardCount) {
        return capacity / shardCount + (capacity % shardCount == 0 ? 0 : 1);
    }

    /**
     * 取哈希的高shardBits位作为分片下标（无符号右移）
     */
    public static int shardIndex(int hash, int shardBits) {
        return hash >>> (32 - shardBits);
    }
}
