package com.github.blockcache.cache;

import com.github.blockcache.CacheUtils;
import com.github.blockcache.util.Hash;
import com.github.blockcache.util.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 分片LRU缓存：16个相互独立加锁的 LruCache
 * 用key哈希的高4位选择分片，不同分片上的操作完全并行
 *
 * 每个分片容量为 ceil(capacity / 16)，总容量可能略有偏差
 */
public final class ShardedLruCache<V> implements Cache<V> {
    private static final Logger LOG = LoggerFactory.getLogger(ShardedLruCache.class);

    static final int NUM_SHARD_BITS = 4;
    static final int NUM_SHARDS = 1 << NUM_SHARD_BITS;

    private final LruCache<V>[] shards;

    // id分配使用独立的锁，不与缓存读写竞争
    private final ReentrantLock idLock = new ReentrantLock();
    private long lastId;

    private final boolean recordStats;
    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder insertCount = new LongAdder();

    public ShardedLruCache(long capacity) {
        this(capacity, false);
    }

    @SuppressWarnings("unchecked")
    ShardedLruCache(long capacity, boolean recordStats) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity < 0: " + capacity);
        }
        this.recordStats = recordStats;
        long perShard = CacheUtils.perShardCapacity(capacity, NUM_SHARDS);
        this.shards = new LruCache[NUM_SHARDS];
        for (int s = 0; s < NUM_SHARDS; s++) {
            shards[s] = new LruCache<>(perShard);
        }
        LOG.debug("Initialized cache with {} shards, {} capacity per shard", NUM_SHARDS, perShard);
    }

    static int hashSlice(Slice key) {
        return Hash.hash(key, 0);
    }

    static int shard(int hash) {
        return CacheUtils.shardIndex(hash, NUM_SHARD_BITS);
    }

    @Override
    public Handle<V> insert(Slice key, V value, long charge, Deleter<V> deleter) {
        Objects.requireNonNull(key, "key");
        int hash = hashSlice(key);
        Handle<V> handle = shards[shard(hash)].insert(key, hash, value, charge, deleter);
        if (recordStats) {
            insertCount.increment();
        }
        return handle;
    }

    @Override
    public Handle<V> lookup(Slice key) {
        Objects.requireNonNull(key, "key");
        int hash = hashSlice(key);
        Handle<V> handle = shards[shard(hash)].lookup(key, hash);
        if (recordStats) {
            (handle != null ? hitCount : missCount).increment();
        }
        return handle;
    }

    @Override
    public void release(Handle<V> handle) {
        shards[shard(checkHandle(handle).hash())].release(handle);
    }

    @Override
    public V value(Handle<V> handle) {
        return shards[shard(checkHandle(handle).hash())].value(handle);
    }

    @Override
    public void erase(Slice key) {
        Objects.requireNonNull(key, "key");
        int hash = hashSlice(key);
        shards[shard(hash)].erase(key, hash);
    }

    @Override
    public long newId() {
        idLock.lock();
        try {
            return ++lastId;
        } finally {
            idLock.unlock();
        }
    }

    @Override
    public void prune() {
        for (LruCache<V> shard : shards) {
            shard.prune();
        }
    }

    @Override
    public long totalCharge() {
        long total = 0;
        for (LruCache<V> shard : shards) {
            total += shard.totalCharge();
        }
        return total;
    }

    @Override
    public CacheStats stats() {
        if (!recordStats) {
            return CacheStats.EMPTY;
        }
        long evictions = 0;
        for (LruCache<V> shard : shards) {
            evictions += shard.evictionCount();
        }
        return new CacheStats(hitCount.sum(), missCount.sum(), insertCount.sum(), evictions);
    }

    /**
     * 关闭所有分片。任一分片仍有未释放句柄时，其余分片照常关闭，最后统一抛出
     */
    @Override
    public void close() {
        IllegalStateException failure = null;
        for (LruCache<V> shard : shards) {
            try {
                shard.close();
            } catch (IllegalStateException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    LruCache<V> shardAt(int index) {
        return shards[index];
    }

    private static <V> LruHandle<V> checkHandle(Handle<V> handle) {
        Objects.requireNonNull(handle, "handle");
        if (!(handle instanceof LruHandle)) {
            throw new IllegalStateException("Handle not created by this cache: " + handle);
        }
        return (LruHandle<V>) handle;
    }
}
