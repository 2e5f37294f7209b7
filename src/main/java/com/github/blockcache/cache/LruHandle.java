package com.github.blockcache.cache;

import com.github.blockcache.util.Slice;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * 缓存条目：既是哈希表链表节点，也是LRU/in-use双向链表节点
 *
 * 状态约束（由所属分片的锁保护）：
 * - inCache && refs == 1：位于lru链表，可被驱逐
 * - inCache && refs >= 2：位于in-use链表，被调用方持有
 * - !inCache：不在任何链表中（已被擦除/驱逐，但仍有调用方持有）
 * - refs == 0：deleter已执行，不得再访问
 */
final class LruHandle<V> implements Handle<V> {
    private static final VarHandle REFS;

    static {
        try {
            REFS = MethodHandles.lookup().findVarHandle(LruHandle.class, "refs", int.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final LruCache<V> owner;
    private final Slice key;
    private final int hash;
    private final V value;
    private final long charge;
    private final Deleter<V> deleter;

    // 写操作都在分片锁内完成；value()无锁读取，因此用acquire/release语义
    private int refs;
    private boolean inCache;

    // 哈希桶链表
    private LruHandle<V> nextHash;

    // lru / in-use 链表指针
    private LruHandle<V> prev;
    private LruHandle<V> next;

    LruHandle(LruCache<V> owner, Slice key, int hash, V value, long charge, Deleter<V> deleter) {
        this.owner = owner;
        this.key = key;
        this.hash = hash;
        this.value = value;
        this.charge = charge;
        this.deleter = deleter;
        REFS.setRelease(this, 1);  // 返回给调用方的句柄
    }

    /** 链表哨兵节点，不存储数据 */
    static <V> LruHandle<V> sentinel() {
        LruHandle<V> dummy = new LruHandle<>(null, Slice.EMPTY, 0, null, 0, null);
        dummy.prev = dummy;
        dummy.next = dummy;
        return dummy;
    }

    LruCache<V> owner() { return owner; }
    Slice key() { return key; }
    int hash() { return hash; }
    long charge() { return charge; }

    /**
     * 读取负载。句柄已被释放（引用计数归零）时视为使用已释放句柄
     */
    V value() {
        if ((int) REFS.getAcquire(this) <= 0) {
            throw new IllegalStateException("Use of released handle for key " + key);
        }
        return value;
    }

    int refs() {
        return (int) REFS.getAcquire(this);
    }

    int incrementRefs() {
        int r = (int) REFS.getAcquire(this) + 1;
        REFS.setRelease(this, r);
        return r;
    }

    int decrementRefs() {
        int r = (int) REFS.getAcquire(this) - 1;
        REFS.setRelease(this, r);
        return r;
    }

    boolean isInCache() { return inCache; }
    void setInCache(boolean inCache) { this.inCache = inCache; }

    LruHandle<V> getNextHash() { return nextHash; }
    void setNextHash(LruHandle<V> nextHash) { this.nextHash = nextHash; }

    void invokeDeleter() {
        deleter.delete(key, value);
    }

    // lru / in-use 链表指针
    LruHandle<V> getPreviousInAccessOrder() { return prev; }
    void setPreviousInAccessOrder(LruHandle<V> prev) { this.prev = prev; }

    LruHandle<V> getNextInAccessOrder() { return next; }
    void setNextInAccessOrder(LruHandle<V> next) { this.next = next; }

    @Override
    public String toString() {
        return "LruHandle{key=" + key + ", charge=" + charge + ", refs=" + refs()
                + ", inCache=" + inCache + "}";
    }
}
