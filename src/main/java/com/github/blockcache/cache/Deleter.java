package com.github.blockcache.cache;

import com.github.blockcache.util.Slice;

/**
 * 条目最后一个引用被释放时回调，每个条目恰好调用一次
 * 在触发释放的线程中、持有分片锁时同步执行：不得再访问同一个缓存
 */
@FunctionalInterface
public interface Deleter<V> {
    void delete(Slice key, V value);

    static <V> Deleter<V> noop() {
        return (key, value) -> { };
    }
}
