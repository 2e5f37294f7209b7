package com.github.blockcache.cache;

public final class CacheStats {
    static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    private final long hitCount;
    private final long missCount;
    private final long insertCount;
    private final long evictionCount;  // 容量驱逐与prune，不含erase和同key覆盖

    public CacheStats(long hitCount, long missCount, long insertCount, long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.insertCount = insertCount;
        this.evictionCount = evictionCount;
    }

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 1.0 : (double) hitCount / total;
    }

    public long hitCount() { return hitCount; }
    public long missCount() { return missCount; }
    public long insertCount() { return insertCount; }
    public long evictionCount() { return evictionCount; }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, inserts=%d, evictions=%d}",
                hitCount, missCount, insertCount, evictionCount);
    }
}
