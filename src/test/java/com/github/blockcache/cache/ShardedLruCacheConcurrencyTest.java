package com.github.blockcache.cache;

import com.github.blockcache.util.Slice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 并发测试：多线程混合 insert/lookup/release/erase/prune
 * 验证：每个负载的deleter恰好执行一次、句柄读到的值与key一致、无死锁
 */
public class ShardedLruCacheConcurrencyTest {

    private static final int CONCURRENCY = Runtime.getRuntime().availableProcessors() * 2;
    private static final int OPS_PER_THREAD = 20_000;
    private static final int KEY_RANGE = 2_000;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null && !executor.isShutdown()) {
            executor.shutdownNow();
        }
    }

    /** 负载：记录所属key，便于校验句柄读到的值 */
    static final class Block {
        final long id;
        final int key;

        Block(long id, int key) {
            this.id = id;
            this.key = key;
        }
    }

    private static Slice key(int k) {
        return new Slice(("block-" + k).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("混合读写：所有负载最终恰好被删除一次")
    void testMixedWorkload() throws InterruptedException {
        ShardedLruCache<Block> cache = new ShardedLruCache<>(500);
        AtomicLong ids = new AtomicLong();
        Set<Long> deleted = ConcurrentHashMap.newKeySet();
        AtomicReference<String> failure = new AtomicReference<>();

        Deleter<Block> deleter = (k, block) -> {
            if (!deleted.add(block.id)) {
                failure.compareAndSet(null, "负载被重复删除: " + block.id);
            }
            if (!k.equals(key(block.key))) {
                failure.compareAndSet(null, "deleter收到的key与负载不一致: " + k);
            }
        };

        executor = Executors.newFixedThreadPool(CONCURRENCY);
        CountDownLatch latch = new CountDownLatch(CONCURRENCY);

        for (int t = 0; t < CONCURRENCY; t++) {
            executor.submit(() -> {
                try {
                    ThreadLocalRandom rand = ThreadLocalRandom.current();
                    for (int i = 0; i < OPS_PER_THREAD; i++) {
                        int k = rand.nextInt(KEY_RANGE);
                        int op = rand.nextInt(100);
                        if (op < 40) {
                            Block block = new Block(ids.incrementAndGet(), k);
                            cache.release(cache.insert(key(k), block, 1 + rand.nextInt(3), deleter));
                        } else if (op < 90) {
                            Handle<Block> h = cache.lookup(key(k));
                            if (h != null) {
                                if (cache.value(h).key != k) {
                                    failure.compareAndSet(null, "读到其他key的负载: " + k);
                                }
                                cache.release(h);
                            }
                        } else if (op < 99) {
                            cache.erase(key(k));
                        } else {
                            cache.prune();
                        }
                    }
                } catch (Throwable e) {
                    failure.compareAndSet(null, e.toString());
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS), "测试超时，可能死锁");
        assertNull(failure.get(), failure.get());

        cache.close();
        assertEquals(ids.get(), deleted.size(), "关闭后所有负载都应已删除");
        assertEquals(0, cache.totalCharge());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("被持有的负载在其他线程覆盖、驱逐时不会被删除")
    void testPinnedAcrossThreads() throws InterruptedException {
        ShardedLruCache<Block> cache = new ShardedLruCache<>(64);
        Set<Long> deleted = ConcurrentHashMap.newKeySet();
        Deleter<Block> deleter = (k, block) -> deleted.add(block.id);

        Handle<Block> pinned = cache.insert(key(0), new Block(-1, 0), 1, deleter);

        executor = Executors.newFixedThreadPool(CONCURRENCY);
        CountDownLatch latch = new CountDownLatch(CONCURRENCY);
        AtomicLong ids = new AtomicLong();
        for (int t = 0; t < CONCURRENCY; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 5_000; i++) {
                        int k = i % 500;
                        cache.release(cache.insert(key(k), new Block(ids.incrementAndGet(), k), 1, deleter));
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS), "测试超时，可能死锁");
        assertFalse(deleted.contains(-1L), "仍被持有的负载不应被删除");
        assertEquals(0, cache.value(pinned).key);

        cache.release(pinned);
        assertTrue(deleted.contains(-1L), "最后一次release后应删除");
        cache.close();
        assertEquals(ids.get() + 1, deleted.size());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testConcurrentNewIdIsUnique() throws InterruptedException {
        ShardedLruCache<Block> cache = new ShardedLruCache<>(100);
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        AtomicReference<String> failure = new AtomicReference<>();

        executor = Executors.newFixedThreadPool(CONCURRENCY);
        CountDownLatch latch = new CountDownLatch(CONCURRENCY);
        for (int t = 0; t < CONCURRENCY; t++) {
            executor.submit(() -> {
                try {
                    long last = 0;
                    for (int i = 0; i < 1_000; i++) {
                        long id = cache.newId();
                        if (id <= last || !seen.add(id)) {
                            failure.compareAndSet(null, "id重复或未递增: " + id);
                        }
                        last = id;
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertNull(failure.get(), failure.get());
        assertEquals(CONCURRENCY * 1_000, seen.size());
    }
}
