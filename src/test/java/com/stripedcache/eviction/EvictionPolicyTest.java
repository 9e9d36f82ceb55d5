package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Victim selection of each policy, driven directly with entry metadata.
 */
class EvictionPolicyTest {

    private static CacheEntry<String, String> entry(String key, long seq) {
        return new CacheEntry<>(key, "v-" + key, seq, CacheEntry.NO_EXPIRY, 1);
    }

    private static CacheEntry<String, String> expiring(String key, long seq, long expiresAt) {
        return new CacheEntry<>(key, "v-" + key, seq, expiresAt, 1);
    }

    @Test
    void testFifoPicksOldestInsertion() {
        FIFOEvictionPolicy<String, String> policy = new FIFOEvictionPolicy<>();
        CacheEntry<String, String> a = entry("a", 1);
        CacheEntry<String, String> b = entry("b", 2);
        policy.onAccess(a, 10);

        assertEquals(Optional.of("a"), policy.selectVictim(List.of(b, a), 0));
        assertEquals("FIFO", policy.getPolicyName());
    }

    @Test
    void testLruPicksLeastRecentAccess() {
        LRUEvictionPolicy<String, String> policy = new LRUEvictionPolicy<>();
        CacheEntry<String, String> a = entry("a", 1);
        CacheEntry<String, String> b = entry("b", 2);
        CacheEntry<String, String> c = entry("c", 3);
        policy.onAccess(a, 4);

        assertEquals(Optional.of("b"), policy.selectVictim(List.of(a, b, c), 0));
        assertEquals(4, a.getLastAccessTick());
    }

    @Test
    void testLfuBreaksFrequencyTiesByRecency() {
        LFUEvictionPolicy<String, String> policy = new LFUEvictionPolicy<>();
        CacheEntry<String, String> a = entry("a", 1);
        CacheEntry<String, String> b = entry("b", 2);
        CacheEntry<String, String> c = entry("c", 3);
        policy.onAccess(a, 4);
        policy.onAccess(b, 5);

        assertEquals(2, a.getFrequency());
        // a and b share frequency 2, c has 1
        assertEquals(Optional.of("c"), policy.selectVictim(List.of(a, b, c), 0));
        assertEquals(Optional.of("a"), policy.selectVictim(List.of(a, b), 0));
    }

    @Test
    void testNoEvictionNeverSelects() {
        NoEvictionPolicy<String, String> policy = new NoEvictionPolicy<>();
        assertTrue(policy.selectVictim(List.of(entry("a", 1)), 0).isEmpty());
    }

    @Test
    @DisplayName("TTL-aware prefers the expired entry that expired first")
    void testTtlAwarePrefersExpired() {
        TtlAwareEvictionPolicy<String, String> policy = TtlAwareEvictionPolicy.lru();
        CacheEntry<String, String> fresh = entry("fresh", 1);
        CacheEntry<String, String> late = expiring("late", 2, 50);
        CacheEntry<String, String> early = expiring("early", 3, 20);
        policy.onAccess(fresh, 4);
        policy.onAccess(late, 5);
        policy.onAccess(early, 6);

        assertEquals(Optional.of("early"), policy.selectVictim(List.of(fresh, late, early), 60));
        assertEquals(Optional.of("early"), policy.selectVictim(List.of(fresh, late, early), 30));
        // nothing expired yet: plain LRU
        assertEquals(Optional.of("fresh"), policy.selectVictim(List.of(fresh, late, early), 10));
        assertEquals("TTL-LRU", policy.getPolicyName());
        assertEquals("TTL-LFU", TtlAwareEvictionPolicy.<String, String>lfu().getPolicyName());
    }

    @Test
    void testSizeBasedTracksWeight() {
        SizeBasedEvictionPolicy<String, String> policy = new SizeBasedEvictionPolicy<>(10);
        CacheEntry<String, String> light = new CacheEntry<>("light", "v", 1, CacheEntry.NO_EXPIRY, 2);
        CacheEntry<String, String> heavy = new CacheEntry<>("heavy", "v", 2, CacheEntry.NO_EXPIRY, 7);
        policy.onInsert(light);
        policy.onInsert(heavy);
        assertEquals(9, policy.getWeightedSize());

        CacheEntry<String, String> incoming = new CacheEntry<>("next", "v", 3, CacheEntry.NO_EXPIRY, 2);
        assertTrue(policy.isOverBudget(incoming));
        assertTrue(policy.admits(incoming));
        assertFalse(policy.admits(new CacheEntry<>("huge", "v", 4, CacheEntry.NO_EXPIRY, 11)));
        assertEquals(Optional.of("heavy"), policy.selectVictim(List.of(light, heavy), 0));

        policy.onRemove(heavy);
        assertEquals(2, policy.getWeightedSize());
        assertFalse(policy.isOverBudget(incoming));

        policy.clear();
        assertEquals(0, policy.getWeightedSize());
    }

    @Test
    void testSizeBasedRejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new SizeBasedEvictionPolicy<String, String>(0));
    }

    @Test
    void testSeededRandomIsReproducible() {
        List<CacheEntry<String, String>> entries = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            entries.add(entry("k" + i, i + 1));
        }
        RandomEvictionPolicy<String, String> first = new RandomEvictionPolicy<>(42L);
        RandomEvictionPolicy<String, String> second = new RandomEvictionPolicy<>(42L);

        for (int i = 0; i < 10; i++) {
            Optional<String> victim = first.selectVictim(entries, 0);
            assertTrue(victim.isPresent());
            assertEquals(victim, second.selectVictim(entries, 0));
        }
        assertTrue(first.selectVictim(List.of(), 0).isEmpty());
    }
}
