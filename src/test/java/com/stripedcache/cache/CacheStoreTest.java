package com.stripedcache.cache;

import com.stripedcache.eviction.FIFOEvictionPolicy;
import com.stripedcache.eviction.LFUEvictionPolicy;
import com.stripedcache.eviction.LRUEvictionPolicy;
import com.stripedcache.eviction.NoEvictionPolicy;
import com.stripedcache.eviction.SizeBasedEvictionPolicy;
import com.stripedcache.stats.CacheStats;
import com.stripedcache.stats.SimpleStatsCounter;
import com.stripedcache.ttl.TimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CacheStore
 */
class CacheStoreTest {

    private CacheStore<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new CacheStore<>(100, new LRUEvictionPolicy<>());
    }

    @Test
    void testPutAndGet() {
        cache.insert("key1", "value1");
        assertEquals("value1", cache.get("key1"));
    }

    @Test
    void testGetNonExistent() {
        assertNull(cache.get("nonexistent"));
    }

    @Test
    void testDelete() {
        cache.insert("key1", "value1");
        assertEquals("value1", cache.remove("key1"));
        assertNull(cache.get("key1"));
        assertNull(cache.remove("key1"));
    }

    @Test
    void testSize() {
        cache.insert("key1", "value1");
        cache.insert("key2", "value2");
        assertEquals(2, cache.size());
        assertFalse(cache.isEmpty());
    }

    @Test
    void testClear() {
        cache.insert("key1", "value1");
        cache.insert("key2", "value2");
        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.isEmpty());
    }

    @Test
    void testClearTwiceIsHarmless() {
        cache.insert("key1", "value1");
        cache.clear();
        assertEquals(0, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void testReplaceReturnsPreviousValue() {
        assertNull(cache.insert("key1", "v1"));
        assertEquals("v1", cache.insert("key1", "v2"));

        assertEquals(1, cache.size());
        assertEquals("v2", cache.get("key1"));
        assertEquals(2, cache.stats().getInsertions());
    }

    @Test
    void testContainsKeyDoesNotCountAsLookup() {
        cache.insert("key1", "value1");
        assertTrue(cache.containsKey("key1"));
        assertFalse(cache.containsKey("key2"));
        assertEquals(0, cache.stats().requestCount());
    }

    @Test
    @DisplayName("len() never exceeds max capacity, whatever the insert sequence")
    void testCapacityNeverExceeded() {
        CacheStore<String, String> bounded = new CacheStore<>(3, new LRUEvictionPolicy<>());
        for (int i = 0; i < 50; i++) {
            bounded.insert("key" + (i % 7 == 0 ? 0 : i), "value" + i);
            assertTrue(bounded.size() <= 3, "size " + bounded.size() + " exceeded capacity");
        }
        assertEquals(3, bounded.size());
        assertTrue(bounded.stats().getEvictions() > 0);
    }

    @Test
    @DisplayName("LRU: insert A, B, read A, insert C evicts B")
    void testLruEvictsLeastRecentlyUsed() {
        CacheStore<String, String> lru = new CacheStore<>(2, new LRUEvictionPolicy<>());
        lru.insert("A", "a");
        lru.insert("B", "b");
        lru.get("A");
        lru.insert("C", "c");

        assertTrue(lru.containsKey("A"));
        assertFalse(lru.containsKey("B"));
        assertTrue(lru.containsKey("C"));
        assertEquals(1, lru.stats().getEvictions());
    }

    @Test
    @DisplayName("LFU: A read three times, B once, inserting C evicts B")
    void testLfuEvictsLeastFrequentlyUsed() {
        CacheStore<String, String> lfu = new CacheStore<>(2, new LFUEvictionPolicy<>());
        lfu.insert("A", "a");
        lfu.insert("B", "b");
        lfu.get("A");
        lfu.get("A");
        lfu.get("A");
        lfu.get("B");
        lfu.insert("C", "c");

        assertTrue(lfu.containsKey("A"));
        assertFalse(lfu.containsKey("B"));
        assertTrue(lfu.containsKey("C"));
    }

    @Test
    void testFifoIgnoresReads() {
        CacheStore<String, String> fifo = new CacheStore<>(2, new FIFOEvictionPolicy<>());
        fifo.insert("A", "a");
        fifo.insert("B", "b");
        fifo.get("A");
        fifo.insert("C", "c");

        assertFalse(fifo.containsKey("A"));
        assertTrue(fifo.containsKey("B"));
        assertTrue(fifo.containsKey("C"));
    }

    @Test
    void testNoEvictionRejectsWritesPastCapacity() {
        CacheStore<String, String> strict = new CacheStore<>(2, new NoEvictionPolicy<>());
        strict.insert("a", "1");
        strict.insert("b", "2");

        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> strict.insert("c", "3"));
        assertEquals("c", e.getKey());
        assertEquals(2, e.getCapacity());

        assertEquals(2, strict.size());
        assertFalse(strict.containsKey("c"));
        assertEquals(0, strict.stats().getEvictions());
        assertEquals(2, strict.stats().getInsertions());
    }

    @Test
    void testNoEvictionAllowsReplacingAtCapacity() {
        CacheStore<String, String> strict = new CacheStore<>(2, new NoEvictionPolicy<>());
        strict.insert("a", "1");
        strict.insert("b", "2");

        assertEquals("1", strict.insert("a", "updated"));
        assertEquals("updated", strict.get("a"));
        assertEquals(2, strict.size());
    }

    @Test
    void testRejectedReplacementKeepsPreviousValue() {
        CacheStore<String, String> sized = new CacheStore<>("sized", CacheStore.UNBOUNDED,
                new SizeBasedEvictionPolicy<>(10), new SimpleStatsCounter(), TimeSource.system(),
                (key, value) -> value.length(), null, null);
        sized.insert("a", "12345");

        assertThrows(CapacityExceededException.class, () -> sized.insert("a", "this is far too long"));

        assertEquals("12345", sized.get("a"));
        assertEquals(1, sized.size());
    }

    @Test
    @DisplayName("SizeBased keeps evicting the heaviest entry until the new one fits")
    void testSizeBasedEvictsGreedily() {
        SizeBasedEvictionPolicy<String, String> policy = new SizeBasedEvictionPolicy<>(10);
        CacheStore<String, String> sized = new CacheStore<>("sized", CacheStore.UNBOUNDED,
                policy, new SimpleStatsCounter(), TimeSource.system(),
                (key, value) -> value.length(), null, null);
        sized.insert("a", "aaaa");
        sized.insert("b", "bbb");
        sized.insert("c", "ccc");
        assertEquals(10, policy.getWeightedSize());

        sized.insert("d", "ddddddddd");

        assertEquals(1, sized.size());
        assertTrue(sized.containsKey("d"));
        assertEquals(3, sized.stats().getEvictions());
        assertEquals(9, policy.getWeightedSize());
    }

    @Test
    void testStatsConsistency() {
        cache.insert("key1", "value1");
        int gets = 0;
        for (int i = 0; i < 10; i++) {
            cache.get(i % 2 == 0 ? "key1" : "missing" + i);
            gets++;
        }

        CacheStats stats = cache.stats();
        assertEquals(gets, stats.getHits() + stats.getMisses());
        assertEquals(5, stats.getHits());
        assertEquals(0.5, stats.hitRate(), 1e-9);

        cache.resetStats();
        assertEquals(CacheStats.empty(), cache.stats());
    }

    @Test
    void testComputeIfPresent() {
        cache.insert("counter", "1");

        assertEquals("2", cache.computeIfPresent("counter", (k, v) -> String.valueOf(Integer.parseInt(v) + 1)));
        assertEquals("2", cache.get("counter"));

        assertNull(cache.computeIfPresent("missing", (k, v) -> "x"));
        assertFalse(cache.containsKey("missing"));

        assertNull(cache.computeIfPresent("counter", (k, v) -> null));
        assertFalse(cache.containsKey("counter"));
    }

    @Test
    @DisplayName("A grown value is weighed again and evicts others to stay within the budget")
    void testComputeIfPresentReweighsValue() {
        SizeBasedEvictionPolicy<String, String> policy = new SizeBasedEvictionPolicy<>(10);
        CacheStore<String, String> sized = new CacheStore<>("sized", CacheStore.UNBOUNDED,
                policy, new SimpleStatsCounter(), TimeSource.system(),
                (key, value) -> value.length(), null, null);
        sized.insert("x", "aa");
        sized.insert("y", "yyyy");
        sized.insert("z", "zzz");

        assertEquals("xxxxxx", sized.computeIfPresent("x", (k, v) -> "xxxxxx"));

        assertFalse(sized.containsKey("y"));
        assertEquals("xxxxxx", sized.get("x"));
        assertEquals(9, policy.getWeightedSize());
        long realWeight = sized.entries().stream().mapToLong(e -> e.getValue().length()).sum();
        assertEquals(realWeight, policy.getWeightedSize());
        assertEquals(1, sized.stats().getEvictions());
    }

    @Test
    void testComputeIfPresentRejectsValueThatCanNeverFit() {
        SizeBasedEvictionPolicy<String, String> policy = new SizeBasedEvictionPolicy<>(10);
        CacheStore<String, String> sized = new CacheStore<>("sized", CacheStore.UNBOUNDED,
                policy, new SimpleStatsCounter(), TimeSource.system(),
                (key, value) -> value.length(), null, null);
        sized.insert("x", "a");
        sized.insert("b", "bbb");

        assertThrows(CapacityExceededException.class,
                () -> sized.computeIfPresent("x", (k, v) -> "x".repeat(1000)));

        assertEquals("a", sized.get("x"));
        assertTrue(sized.containsKey("b"));
        assertEquals(4, policy.getWeightedSize());
        assertTrue(policy.getWeightedSize() <= policy.getMaxWeight());
    }

    @Test
    void testNegativeWeightRejected() {
        CacheStore<String, String> weighed = new CacheStore<>("weighed", 10, new LRUEvictionPolicy<>(),
                new SimpleStatsCounter(), TimeSource.system(),
                (key, value) -> value.equals("bad") ? -1L : 1L, null, null);
        weighed.insert("a", "ok");

        assertThrows(IllegalArgumentException.class, () -> weighed.insert("a", "bad"));
        assertThrows(IllegalArgumentException.class, () -> weighed.computeIfPresent("a", (k, v) -> "bad"));

        assertEquals("ok", weighed.get("a"));
        assertEquals(1, weighed.size());
    }

    @Test
    void testExplicitRemovalIsNotAnEviction() {
        cache.insert("key1", "value1");
        cache.remove("key1");
        cache.insert("key2", "value2");
        cache.computeIfPresent("key2", (k, v) -> null);

        assertEquals(0, cache.stats().getEvictions());
        assertFalse(RemovalCause.EXPLICIT.wasEvicted());
        assertTrue(RemovalCause.CAPACITY.wasEvicted());
        assertTrue(RemovalCause.EXPIRED.wasEvicted());
    }

    @Test
    @DisplayName("Keys are told apart by equals; the comparator only orders snapshots")
    void testComparatorDoesNotMergeDistinctKeys() {
        CacheStore<String, String> store = new CacheStore<>("ci", 10, new LRUEvictionPolicy<>(),
                new SimpleStatsCounter(), TimeSource.system(), (k, v) -> 1L, null, String.CASE_INSENSITIVE_ORDER);
        store.insert("apple", "lower");
        store.insert("APPLE", "upper");
        store.insert("banana", "b");

        assertEquals(3, store.size());
        assertEquals("lower", store.get("apple"));
        assertEquals("upper", store.get("APPLE"));
        assertEquals("banana", store.keySnapshot().get(2));
    }

    @Test
    void testNonComparableKeyRejectedWithoutComparator() {
        CacheStore<Object, String> store = new CacheStore<>(10, new LRUEvictionPolicy<>());

        assertThrows(IllegalArgumentException.class, () -> store.insert(new Object(), "v"));
        assertEquals(0, store.size());
    }

    @Test
    void testNullsRejected() {
        assertThrows(NullPointerException.class, () -> cache.insert(null, "v"));
        assertThrows(NullPointerException.class, () -> cache.insert("k", null));
        assertThrows(NullPointerException.class, () -> cache.get(null));
    }

    @Test
    void testEntriesAreKeyOrdered() {
        cache.insert("c", "3");
        cache.insert("a", "1");
        cache.insert("b", "2");

        List<String> keys = cache.entries().stream().map(Map.Entry::getKey).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), keys);
        assertEquals(List.of("a", "b", "c"), cache.keySnapshot());
    }

    @Test
    void testCustomComparator() {
        CacheStore<String, String> reversed = new CacheStore<>("reversed", 10, new LRUEvictionPolicy<>(),
                new SimpleStatsCounter(), TimeSource.system(), (k, v) -> 1L, null, Comparator.<String>reverseOrder());
        reversed.insert("a", "1");
        reversed.insert("b", "2");

        assertEquals(List.of("b", "a"), reversed.keySnapshot());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new CacheStore<>(0, new LRUEvictionPolicy<String, String>()));
    }
}
