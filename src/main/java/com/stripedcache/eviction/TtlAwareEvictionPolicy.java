package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * TTL + LRU/LFU hybrid policy.
 *
 * Evicts an already expired entry first (the one that expired earliest), since it carries
 * no value anymore, and otherwise falls back to the wrapped base policy.
 */
public class TtlAwareEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    private final EvictionPolicy<K, V> base;

    public TtlAwareEvictionPolicy(EvictionPolicy<K, V> base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    /**
     * TTL-aware LRU.
     */
    public static <K, V> TtlAwareEvictionPolicy<K, V> lru() {
        return new TtlAwareEvictionPolicy<>(new LRUEvictionPolicy<>());
    }

    /**
     * TTL-aware LFU.
     */
    public static <K, V> TtlAwareEvictionPolicy<K, V> lfu() {
        return new TtlAwareEvictionPolicy<>(new LFUEvictionPolicy<>());
    }

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
        base.onInsert(entry);
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
        base.onAccess(entry, tick);
    }

    @Override
    public void onMiss(K key) {
        base.onMiss(key);
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
        base.onRemove(entry);
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        Optional<K> expired = entries.stream()
                .filter(entry -> entry.isExpiredAt(now))
                .min(Comparator.<CacheEntry<K, V>>comparingLong(CacheEntry::getExpiresAt)
                        .thenComparingLong(CacheEntry::getInsertionSequence))
                .map(CacheEntry::getKey);
        if (expired.isPresent()) {
            return expired;
        }
        return base.selectVictim(entries, now);
    }

    @Override
    public boolean isOverBudget(CacheEntry<K, V> incoming) {
        return base.isOverBudget(incoming);
    }

    @Override
    public boolean admits(CacheEntry<K, V> incoming) {
        return base.admits(incoming);
    }

    @Override
    public void clear() {
        base.clear();
    }

    @Override
    public String getPolicyName() {
        return "TTL-" + base.getPolicyName();
    }
}
