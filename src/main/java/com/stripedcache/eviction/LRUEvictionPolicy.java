package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * LRU (Least Recently Used) eviction policy.
 *
 * Evicts the entry that was accessed least recently, breaking ties by insertion order.
 */
public class LRUEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    static <K, V> Comparator<CacheEntry<K, V>> recencyOrder() {
        return Comparator.<CacheEntry<K, V>>comparingLong(CacheEntry::getLastAccessTick)
                .thenComparingLong(CacheEntry::getInsertionSequence);
    }

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
        entry.touch(tick);
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        return entries.stream()
                .min(recencyOrder())
                .map(CacheEntry::getKey);
    }

    @Override
    public void clear() {
    }

    @Override
    public String getPolicyName() {
        return "LRU";
    }
}
