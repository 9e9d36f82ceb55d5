package com.stripedcache.eviction;

import com.stripedcache.cache.CacheEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * EvictionPolicy defines the interface for cache eviction strategies.
 *
 * Each store owns one policy instance. The store calls every hook synchronously while
 * holding its shard lock, so a policy's bookkeeping always matches the live entry set
 * and implementations need no synchronization of their own.
 *
 * Policies that care about reads update the entry metadata themselves in
 * {@link #onAccess(CacheEntry, long)}; policies that ignore reads leave it untouched.
 */
public interface EvictionPolicy<K, V> {

    /**
     * Notify the policy that an entry was added to the store.
     *
     * @param entry The new entry, already carrying its insertion sequence
     */
    void onInsert(CacheEntry<K, V> entry);

    /**
     * Notify the policy that an entry was read.
     *
     * @param entry The entry that was hit
     * @param tick  The store's logical clock value for this access
     */
    void onAccess(CacheEntry<K, V> entry, long tick);

    /**
     * Notify the policy that a lookup found nothing.
     *
     * @param key The key that missed
     */
    default void onMiss(K key) {
    }

    /**
     * Notify the policy that an entry left the store, for whatever reason.
     *
     * @param entry The removed entry
     */
    void onRemove(CacheEntry<K, V> entry);

    /**
     * Select the key to evict.
     *
     * @param entries The live entries of the store
     * @param now     Current time from the store's time source, for expiry-aware policies
     * @return The victim key, or empty if this policy cannot choose one
     */
    Optional<K> selectVictim(Collection<CacheEntry<K, V>> entries, long now);

    /**
     * Whether adding {@code incoming} would exceed a budget this policy enforces on top of
     * the store's entry count. The store keeps evicting while this returns true.
     */
    default boolean isOverBudget(CacheEntry<K, V> incoming) {
        return false;
    }

    /**
     * Whether {@code incoming} could ever fit. Entries refused here fail without evicting anything.
     */
    default boolean admits(CacheEntry<K, V> incoming) {
        return true;
    }

    /**
     * Drop all tracking data (the store was cleared).
     */
    void clear();

    /**
     * Get the name of this eviction policy.
     *
     * @return The policy name (e.g., "LRU", "FIFO")
     */
    String getPolicyName();
}
