package com.stripedcache.cache;

import com.stripedcache.batch.BatchOperation;
import com.stripedcache.batch.BatchResult;
import com.stripedcache.stats.CacheStats;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Public operations of a thread-safe cache.
 *
 * Operations on one key are linearized; operations spanning the whole cache (size, clear,
 * stats, snapshots) visit partitions one at a time and are therefore not atomic.
 * Null keys and values are rejected.
 */
public interface Cache<K, V> extends Iterable<Map.Entry<K, V>> {

    /**
     * Insert or replace a value, applying the default TTL if one is configured.
     *
     * @return the previous value, or null
     * @throws CapacityExceededException if the eviction policy could not make room
     */
    V insert(K key, V value);

    /**
     * Insert or replace a value that expires after {@code ttl}.
     *
     * @return the previous value, or null
     * @throws CapacityExceededException if the eviction policy could not make room
     */
    V insertWithTtl(K key, V value, Duration ttl);

    /**
     * @return the value, or null if absent or expired
     */
    V get(K key);

    /**
     * Update a present value in place.
     *
     * @return the new value, or null if the key was absent or the function returned null
     */
    V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remapping);

    /**
     * @return the removed value, or null if absent
     */
    V remove(K key);

    boolean containsKey(K key);

    int size();

    boolean isEmpty();

    void clear();

    List<K> keys();

    List<V> values();

    /**
     * Snapshot export of all live pairs, for a persistence collaborator.
     */
    List<Map.Entry<K, V>> entries();

    /**
     * Import pairs previously exported with {@link #entries()}.
     *
     * @return number of pairs inserted; pairs rejected for capacity are skipped
     */
    int load(Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs);

    /**
     * Look up several keys. Each lookup counts in the statistics like {@link #get(Object)}.
     *
     * @return map of the keys found to their values
     */
    Map<K, V> getAll(Collection<? extends K> keys);

    /**
     * Apply operations one by one; failures are reported per operation, never rolled back.
     */
    BatchResult<K, V> applyBatch(List<BatchOperation<K, V>> operations);

    /**
     * Remove expired entries now.
     *
     * @return number removed
     */
    int sweepExpired();

    CacheStats stats();

    void resetStats();
}
