package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * LFU (Least Frequently Used) eviction policy.
 *
 * Evicts the entry with the smallest access count. Ties go to the least recently
 * accessed entry, then to the oldest insertion.
 */
public class LFUEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    static <K, V> Comparator<CacheEntry<K, V>> frequencyOrder() {
        return Comparator.<CacheEntry<K, V>>comparingLong(CacheEntry::getFrequency)
                .thenComparingLong(CacheEntry::getLastAccessTick)
                .thenComparingLong(CacheEntry::getInsertionSequence);
    }

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
        entry.recordAccess(tick);
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        return entries.stream()
                .min(frequencyOrder())
                .map(CacheEntry::getKey);
    }

    @Override
    public void clear() {
    }

    @Override
    public String getPolicyName() {
        return "LFU";
    }
}
