package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * Never selects a victim. A bounded store using it rejects writes once full.
 */
public class NoEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        return Optional.empty();
    }

    @Override
    public void clear() {
    }

    @Override
    public String getPolicyName() {
        return "NONE";
    }
}
