package com.stripedcache.shard;

import com.stripedcache.config.CacheBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many threads hammering one cache.
 */
class ShardedCacheConcurrencyTest {

    private static final int THREADS = 8;
    private static final int OPERATIONS = 2_000;

    @Test
    void testConcurrentMixedWorkloadKeepsInvariants() throws Exception {
        ShardedCache<String, Integer> cache = CacheBuilder.<String, Integer>newBuilder()
                .maxCapacity(500)
                .shards(8)
                .withLfu()
                .build();
        AtomicLong gets = new AtomicLong();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < OPERATIONS; i++) {
                    String key = "key" + ((thread * 31 + i) % 1_500);
                    if (i % 3 == 0) {
                        cache.insert(key, i);
                    } else if (i % 3 == 1) {
                        cache.get(key);
                        gets.incrementAndGet();
                    } else if (i % 50 == 2) {
                        cache.remove(key);
                    } else {
                        cache.containsKey(key);
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(2, TimeUnit.SECONDS));

        assertTrue(cache.size() <= 500, "size " + cache.size() + " exceeded capacity");
        assertEquals(gets.get(), cache.stats().requestCount());
        assertEquals(cache.size(), cache.keys().size());
    }

    @Test
    void testComputeIfPresentIsAtomicPerKey() throws Exception {
        ShardedCache<String, Integer> cache = CacheBuilder.<String, Integer>newBuilder()
                .unbounded()
                .shards(4)
                .build();
        cache.insert("counter", 0);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch done = new CountDownLatch(THREADS);
        for (int t = 0; t < THREADS; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 1_000; i++) {
                        cache.computeIfPresent("counter", (k, v) -> v + 1);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(THREADS * 1_000, cache.get("counter"));
    }

    @Test
    void testGlobalOperationsDuringWrites() throws Exception {
        ShardedCache<String, String> cache = CacheBuilder.<String, String>newBuilder()
                .maxCapacity(1_000)
                .shards(4)
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        Future<?> writer = executor.submit(() -> {
            for (int i = 0; i < 5_000; i++) {
                cache.insert("key" + (i % 2_000), "value" + i);
            }
        });
        Future<?> reader = executor.submit(() -> {
            for (int i = 0; i < 200; i++) {
                assertTrue(cache.size() <= 1_000);
                cache.entries();
                cache.sweepExpired();
                if (i % 50 == 0) {
                    cache.clear();
                }
            }
        });

        writer.get(30, TimeUnit.SECONDS);
        reader.get(30, TimeUnit.SECONDS);
        executor.shutdown();
        assertTrue(cache.size() <= 1_000);
    }
}
