package com.github.blockcache.cache;

import com.github.blockcache.util.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个分片的LRU缓存：一个哈希表 + lru/in-use两条链表 + 引用计数
 *
 * 设计要点：
 * 1. 所有读写都在同一把 ReentrantLock 内完成，哈希值由上层路由预先计算
 * 2. 缓存自身持有一个引用（inCache == true），调用方的每个句柄再各持有一个
 * 3. 引用计数 1→2 时从lru移到in-use，2→1 时移回lru，1→0 时执行deleter
 * 4. 只有lru链表上的条目可以被驱逐，被持有的条目即使超容也会保留
 *
 * capacity == 0 时不缓存任何条目（插入直接返回未入表的句柄），
 * 可用于测量纯分配开销
 */
public final class LruCache<V> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LruCache.class);

    private final long capacity;
    private final ReentrantLock lock = new ReentrantLock();

    // 以下字段由lock保护
    private long usage;
    private long evictionCount;
    private boolean closed;

    // lru: refs == 1 && inCache，头部最旧
    private final AccessOrderDeque<V> lru = new AccessOrderDeque<>();
    // in-use: refs >= 2 && inCache，无序，用于关闭时检测泄漏的句柄
    private final AccessOrderDeque<V> inUse = new AccessOrderDeque<>();
    private final HandleTable<V> table = new HandleTable<>();

    public LruCache(long capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity < 0: " + capacity);
        }
        this.capacity = capacity;
    }

    public long capacity() {
        return capacity;
    }

    /**
     * 插入key→value，总是成功。返回的句柄必须调用 release 释放。
     * 已存在相同key的条目会被立即移出缓存（其内存由自身引用计数决定）
     */
    public Handle<V> insert(Slice key, int hash, V value, long charge, Deleter<V> deleter) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(deleter, "deleter");
        if (charge < 0) {
            throw new IllegalArgumentException("charge < 0: " + charge);
        }

        lock.lock();
        try {
            checkOpen();
            LruHandle<V> e = new LruHandle<>(this, new Slice(key.toByteArray()), hash, value, charge, deleter);

            if (capacity > 0) {
                e.incrementRefs();  // 缓存自身的引用
                e.setInCache(true);
                inUse.add(e);
                usage += charge;
                finishErase(table.insert(e));
            }

            while (usage > capacity && !lru.isEmpty()) {
                LruHandle<V> old = lru.peekFirst();
                if (old.refs() != 1) {
                    throw new AssertionError("Evicting entry still referenced: " + old);
                }
                if (!finishErase(table.remove(old.key(), old.hash()))) {
                    throw new AssertionError("LRU entry missing from table: " + old);
                }
                evictionCount++;
            }
            return e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 命中时返回句柄（引用计数+1），未命中返回null
     */
    public Handle<V> lookup(Slice key, int hash) {
        lock.lock();
        try {
            checkOpen();
            LruHandle<V> e = table.lookup(key, hash);
            if (e != null) {
                ref(e);
            }
            return e;
        } finally {
            lock.unlock();
        }
    }

    public void release(Handle<V> handle) {
        LruHandle<V> e = owned(handle);
        lock.lock();
        try {
            // 仍在缓存中时至少有缓存自身的1个引用，调用方不能把它也释放掉
            if (e.isInCache() && e.refs() <= 1) {
                throw new IllegalStateException("Handle released more than once: " + e);
            }
            unref(e);
        } finally {
            lock.unlock();
        }
    }

    public V value(Handle<V> handle) {
        return owned(handle).value();
    }

    /**
     * 若存在则移出缓存；仍被持有时deleter推迟到最后一次release
     */
    public void erase(Slice key, int hash) {
        lock.lock();
        try {
            finishErase(table.remove(key, hash));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 驱逐所有未被调用方持有的条目，与容量压力无关
     */
    public void prune() {
        int pruned = 0;
        lock.lock();
        try {
            while (!lru.isEmpty()) {
                LruHandle<V> e = lru.peekFirst();
                if (e.refs() != 1) {
                    throw new AssertionError("Pruning entry still referenced: " + e);
                }
                if (!finishErase(table.remove(e.key(), e.hash()))) {
                    throw new AssertionError("LRU entry missing from table: " + e);
                }
                pruned++;
            }
            evictionCount += pruned;
        } finally {
            lock.unlock();
        }
        if (pruned > 0) {
            LOG.debug("Pruned {} unreferenced entries", pruned);
        }
    }

    public long totalCharge() {
        lock.lock();
        try {
            return usage;
        } finally {
            lock.unlock();
        }
    }

    long evictionCount() {
        lock.lock();
        try {
            return evictionCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 关闭分片：若仍有未释放的句柄则失败；否则释放lru链表上的所有条目
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (!inUse.isEmpty()) {
                int leaked = inUse.size();
                LOG.error("Closing cache shard with {} unreleased handle(s)", leaked);
                throw new IllegalStateException("Cache closed with " + leaked + " unreleased handle(s)");
            }
            closed = true;
            while (!lru.isEmpty()) {
                LruHandle<V> e = lru.peekFirst();
                if (!e.isInCache() || e.refs() != 1) {
                    throw new AssertionError("Corrupted lru entry: " + e);
                }
                table.remove(e.key(), e.hash());
                lru.remove(e);
                e.setInCache(false);
                usage -= e.charge();
                unref(e);
            }
        } finally {
            lock.unlock();
        }
    }

    // ===== 以下仅供测试使用 =====

    int entryCount() {
        lock.lock();
        try {
            return table.size();
        } finally {
            lock.unlock();
        }
    }

    int lruCount() {
        lock.lock();
        try {
            return lru.size();
        } finally {
            lock.unlock();
        }
    }

    int inUseCount() {
        lock.lock();
        try {
            return inUse.size();
        } finally {
            lock.unlock();
        }
    }

    // ===== 需持有lock =====

    private void ref(LruHandle<V> e) {
        if (e.refs() == 1 && e.isInCache()) {  // 在lru上，移到in-use
            lru.remove(e);
            inUse.add(e);
        }
        e.incrementRefs();
    }

    private void unref(LruHandle<V> e) {
        if (e.refs() <= 0) {
            throw new IllegalStateException("Handle released more than once: " + e);
        }
        int refs = e.decrementRefs();
        if (refs == 0) {
            if (e.isInCache()) {
                throw new AssertionError("Deallocating entry still in cache: " + e);
            }
            e.invokeDeleter();
        } else if (e.isInCache() && refs == 1) {  // 不再被调用方持有，移回lru
            inUse.remove(e);
            lru.add(e);
        }
    }

    /**
     * e已从哈希表摘除，完成剩余的移除工作。返回 e != null
     */
    private boolean finishErase(LruHandle<V> e) {
        if (e != null) {
            if (!e.isInCache()) {
                throw new AssertionError("Erasing entry not in cache: " + e);
            }
            // 条目只可能在lru或in-use之一上，侵入式链表直接摘除即可
            lru.remove(e);
            e.setInCache(false);
            usage -= e.charge();
            unref(e);
        }
        return e != null;
    }

    private LruHandle<V> owned(Handle<V> handle) {
        Objects.requireNonNull(handle, "handle");
        if (!(handle instanceof LruHandle) || ((LruHandle<V>) handle).owner() != this) {
            throw new IllegalStateException("Handle not owned by this cache: " + handle);
        }
        return (LruHandle<V>) handle;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Cache is closed");
        }
    }
}
