package com.github.blockcache.cache;

/**
 * 带哨兵的循环双向链表
 * 头部(dummy.next)为最久未使用，尾部(dummy.prev)为最近使用
 * 非线程安全：由所属分片的锁保护
 */
final class AccessOrderDeque<V> {
    private final LruHandle<V> dummy; // 哨兵节点

    AccessOrderDeque() {
        this.dummy = LruHandle.sentinel();
    }

    /** 添加到尾部（MRU位置）- O(1) */
    void add(LruHandle<V> e) {
        LruHandle<V> prev = dummy.getPreviousInAccessOrder();
        e.setPreviousInAccessOrder(prev);
        e.setNextInAccessOrder(dummy);
        prev.setNextInAccessOrder(e);
        dummy.setPreviousInAccessOrder(e);
    }

    /** 移除指定节点 - O(1) */
    void remove(LruHandle<V> e) {
        LruHandle<V> prev = e.getPreviousInAccessOrder();
        LruHandle<V> next = e.getNextInAccessOrder();
        prev.setNextInAccessOrder(next);
        next.setPreviousInAccessOrder(prev);

        e.setPreviousInAccessOrder(null);
        e.setNextInAccessOrder(null);
    }

    /** 查看头部（LRU位置）不移除 */
    LruHandle<V> peekFirst() {
        LruHandle<V> next = dummy.getNextInAccessOrder();
        return next == dummy ? null : next;
    }

    boolean isEmpty() {
        return dummy.getNextInAccessOrder() == dummy;
    }

    int size() {
        int count = 0;
        LruHandle<V> current = dummy.getNextInAccessOrder();
        while (current != dummy) {
            count++;
            current = current.getNextInAccessOrder();
        }
        return count;
    }
}
