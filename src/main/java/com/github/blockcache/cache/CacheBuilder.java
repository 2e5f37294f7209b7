package com.github.blockcache.cache;

/**
 * 缓存构建器：
 * <pre>
 * Cache&lt;Block&gt; cache = CacheBuilder.&lt;Block&gt;newBuilder()
 *         .capacity(8L &lt;&lt; 20)
 *         .recordStats()
 *         .build();
 * </pre>
 */
public final class CacheBuilder<V> {
    static final long UNSET = -1;

    long capacity = UNSET;
    boolean recordStats;

    private CacheBuilder() {}

    public static <V> CacheBuilder<V> newBuilder() {
        return new CacheBuilder<>();
    }

    /** 固定容量、LRU驱逐的缓存 */
    public static <V> Cache<V> newLruCache(long capacity) {
        return CacheBuilder.<V>newBuilder().capacity(capacity).build();
    }

    /**
     * 总容量（所有条目charge之和的上限），0表示不缓存
     */
    public CacheBuilder<V> capacity(long capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity < 0: " + capacity);
        this.capacity = capacity;
        return this;
    }

    public CacheBuilder<V> recordStats() {
        this.recordStats = true;
        return this;
    }

    public Cache<V> build() {
        if (capacity == UNSET) {
            throw new IllegalStateException("capacity must be set");
        }
        return new ShardedLruCache<>(capacity, recordStats);
    }
}
