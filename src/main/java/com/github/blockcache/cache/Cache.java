package com.github.blockcache.cache;

import com.github.blockcache.util.Slice;

/**
 * key→value 缓存，内部自带同步，可被多线程并发访问
 * 每个条目按调用方指定的 charge 占用容量，超出容量时按LRU驱逐未被持有的条目
 */
public interface Cache<V> extends AutoCloseable {
    /**
     * 插入映射并返回对应句柄；调用方不再需要时必须 release。
     * 条目最终不再被需要时，key和value会被传给deleter
     */
    Handle<V> insert(Slice key, V value, long charge, Deleter<V> deleter);

    /** 未命中返回null；命中返回的句柄必须 release */
    Handle<V> lookup(Slice key);

    /** 要求：句柄由本缓存返回且尚未被释放 */
    void release(Handle<V> handle);

    /** 要求：句柄由本缓存返回且尚未被释放 */
    V value(Handle<V> handle);

    /** 条目会保留到所有已发出的句柄都被释放 */
    void erase(Slice key);

    /**
     * 返回新的数字id。共享同一缓存的多个使用方可以用它划分key空间，
     * 通常在启动时分配一个id并作为key的前缀
     */
    long newId();

    /** 移除所有未被使用的条目 */
    void prune();

    /** 所有缓存条目charge之和 */
    long totalCharge();

    CacheStats stats();

    /** 仍有未释放的句柄时抛出 IllegalStateException */
    @Override
    void close();
}
