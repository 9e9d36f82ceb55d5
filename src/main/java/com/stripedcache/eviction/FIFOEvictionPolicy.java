package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * FIFO (First In First Out) eviction policy.
 *
 * Evicts the entry with the smallest insertion sequence. Reads are ignored.
 */
public class FIFOEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
        // FIFO doesn't care about access
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        return entries.stream()
                .min(Comparator.comparingLong(CacheEntry::getInsertionSequence))
                .map(CacheEntry::getKey);
    }

    @Override
    public void clear() {
    }

    @Override
    public String getPolicyName() {
        return "FIFO";
    }
}
