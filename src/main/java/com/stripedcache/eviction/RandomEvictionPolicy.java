package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Random eviction policy.
 *
 * Picks a uniformly distributed live entry using the injected {@link Random}, which makes
 * the victim sequence reproducible under a fixed seed.
 */
public class RandomEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    private final Random random;

    public RandomEvictionPolicy(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public RandomEvictionPolicy(long seed) {
        this(new Random(seed));
    }

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
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        int target = random.nextInt(entries.size());
        Iterator<CacheEntry<K, V>> it = entries.iterator();
        for (int i = 0; i < target; i++) {
            it.next();
        }
        return Optional.of(it.next().getKey());
    }

    @Override
    public void clear() {
    }

    @Override
    public String getPolicyName() {
        return "RANDOM";
    }
}
