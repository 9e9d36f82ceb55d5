package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Size-based eviction policy.
 *
 * Keeps a running total of entry weights and reports the budget exceeded whenever an
 * incoming entry would push the total past {@code maxWeight}. The store then keeps
 * evicting the heaviest entry until the incoming one fits. Entries heavier than the
 * whole budget are never admitted.
 */
public class SizeBasedEvictionPolicy<K, V> implements EvictionPolicy<K, V> {

    private final long maxWeight;
    private long weightedSize;

    public SizeBasedEvictionPolicy(long maxWeight) {
        if (maxWeight <= 0) {
            throw new IllegalArgumentException("Max weight must be positive, got: " + maxWeight);
        }
        this.maxWeight = maxWeight;
        this.weightedSize = 0;
    }

    @Override
    public void onInsert(CacheEntry<K, V> entry) {
        weightedSize += entry.getWeight();
    }

    @Override
    public void onAccess(CacheEntry<K, V> entry, long tick) {
    }

    @Override
    public void onRemove(CacheEntry<K, V> entry) {
        weightedSize -= entry.getWeight();
    }

    @Override
    public Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now) {
        // heaviest first, oldest among equals
        return entries.stream()
                .min(Comparator.<CacheEntry<K, V>>comparingLong(entry -> -entry.getWeight())
                        .thenComparingLong(CacheEntry::getInsertionSequence))
                .map(CacheEntry::getKey);
    }

    @Override
    public boolean isOverBudget(CacheEntry<K, V> incoming) {
        return weightedSize + incoming.getWeight() > maxWeight;
    }

    @Override
    public boolean admits(CacheEntry<K, V> incoming) {
        return incoming.getWeight() <= maxWeight;
    }

    @Override
    public void clear() {
        weightedSize = 0;
    }

    @Override
    public String getPolicyName() {
        return "SIZE-BASED";
    }

    public long getWeightedSize() {
        return weightedSize;
    }

    public long getMaxWeight() {
        return maxWeight;
    }
}
