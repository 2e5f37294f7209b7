package com.github.blockcache.cache;

import com.github.blockcache.CacheUtils;
import com.github.blockcache.util.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 专用于缓存条目的拉链法哈希表
 * 桶数组长度始终为2的幂；元素数超过桶数时扩容，使平均链长 <= 1
 *
 * 非线程安全：始终在所属分片的锁内调用
 */
final class HandleTable<V> {
    private static final Logger LOG = LoggerFactory.getLogger(HandleTable.class);

    private static final int MIN_LENGTH = 4;

    private LruHandle<V>[] list;
    private int length;
    private int elems;

    HandleTable() {
        resize();
    }

    LruHandle<V> lookup(Slice key, int hash) {
        LruHandle<V> e = list[hash & (length - 1)];
        while (e != null && (e.hash() != hash || !key.equals(e.key()))) {
            e = e.getNextHash();
        }
        return e;
    }

    /**
     * 插入到桶链表头部。若已存在相同key的条目，将其摘除并返回，
     * 由调用方完成其余的移除工作
     */
    LruHandle<V> insert(LruHandle<V> h) {
        int index = h.hash() & (length - 1);
        LruHandle<V> old = unlink(index, h.key(), h.hash());
        h.setNextHash(list[index]);
        list[index] = h;
        if (old == null) {
            elems++;
            if (elems > length) {
                resize();
            }
        }
        return old;
    }

    LruHandle<V> remove(Slice key, int hash) {
        LruHandle<V> result = unlink(hash & (length - 1), key, hash);
        if (result != null) {
            elems--;
        }
        return result;
    }

    int size() {
        return elems;
    }

    int bucketCount() {
        return length;
    }

    private LruHandle<V> unlink(int index, Slice key, int hash) {
        LruHandle<V> prev = null;
        LruHandle<V> e = list[index];
        while (e != null && (e.hash() != hash || !key.equals(e.key()))) {
            prev = e;
            e = e.getNextHash();
        }
        if (e != null) {
            if (prev == null) {
                list[index] = e.getNextHash();
            } else {
                prev.setNextHash(e.getNextHash());
            }
            e.setNextHash(null);
        }
        return e;
    }

    @SuppressWarnings("unchecked")
    private void resize() {
        int newLength = CacheUtils.tableSizeFor(elems, MIN_LENGTH);
        LruHandle<V>[] newList = new LruHandle[newLength];
        int count = 0;
        for (int i = 0; i < length; i++) {
            LruHandle<V> h = list[i];
            while (h != null) {
                LruHandle<V> next = h.getNextHash();
                int index = h.hash() & (newLength - 1);
                h.setNextHash(newList[index]);
                newList[index] = h;
                h = next;
                count++;
            }
        }
        if (count != elems) {
            throw new AssertionError("HandleTable resize lost entries: expected "
                    + elems + ", redistributed " + count);
        }
        LOG.trace("Resized handle table {} -> {} buckets", length, newLength);
        list = newList;
        length = newLength;
    }
}
