package com.stripedcache.cache;

import com.stripedcache.eviction.EvictionPolicy;
import com.stripedcache.eviction.Weigher;
import com.stripedcache.stats.CacheStats;
import com.stripedcache.stats.SimpleStatsCounter;
import com.stripedcache.stats.StatsCounter;
import com.stripedcache.ttl.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * In-memory store that delegates victim selection to an {@link EvictionPolicy}.
 *
 * Keys are matched by {@code equals}/{@code hashCode}, the same contract shards route by.
 * The key ordering (natural, or the configured comparator) only orders snapshots.
 *
 * Writes that would exceed the capacity (or the policy's weight budget) evict first and
 * insert second, so the bound is never exceeded, not even transiently. Expired entries
 * are dropped lazily when touched and proactively by {@link #sweepExpired()}.
 *
 * Not thread-safe. A {@code Shard} guards each store with its own lock.
 */
public class CacheStore<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    /** Capacity value meaning "no entry limit". */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final String name;
    private final Map<K, CacheEntry<K, V>> entries;
    private final Comparator<? super K> keyOrder;
    private final long maxCapacity;
    private final EvictionPolicy<K, V> policy;
    private final StatsCounter stats;
    private final TimeSource timeSource;
    private final Weigher<? super K, ? super V> weigher;
    private final long defaultTtlNanos;
    private long clock;

    public CacheStore(long maxCapacity, EvictionPolicy<K, V> policy) {
        this(maxCapacity, policy, TimeSource.system());
    }

    public CacheStore(long maxCapacity, EvictionPolicy<K, V> policy, TimeSource timeSource) {
        this("store", maxCapacity, policy, new SimpleStatsCounter(), timeSource,
                Weigher.singleton(), null, null);
    }

    /**
     * @param name        label used in log messages and errors (e.g. "shard-3")
     * @param maxCapacity maximum number of entries, or {@link #UNBOUNDED}
     * @param policy      eviction policy owned by this store
     * @param stats       counter owned by this store
     * @param timeSource  clock for TTL decisions
     * @param weigher     weight estimate handed to the policy
     * @param defaultTtl  TTL applied by {@link #insert(Object, Object)}, or null for none
     * @param comparator  snapshot ordering of keys, or null for natural ordering
     */
    public CacheStore(String name,
                      long maxCapacity,
                      EvictionPolicy<K, V> policy,
                      StatsCounter stats,
                      TimeSource timeSource,
                      Weigher<? super K, ? super V> weigher,
                      Duration defaultTtl,
                      Comparator<? super K> comparator) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("Max capacity must be positive, got: " + maxCapacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.maxCapacity = maxCapacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.weigher = Objects.requireNonNull(weigher, "weigher");
        this.defaultTtlNanos = defaultTtl == null ? 0L : requirePositive(defaultTtl).toNanos();
        this.entries = new HashMap<>();
        this.keyOrder = comparator;
        this.clock = 0;
        logger.debug("CacheStore {} initialized (capacity: {}, policy: {})",
                name, maxCapacity == UNBOUNDED ? "unbounded" : maxCapacity, policy.getPolicyName());
    }

    /**
     * Insert or replace a value, applying the default TTL if one is configured.
     *
     * @return the previous live value, or null if there was none
     * @throws CapacityExceededException if no room could be made for the entry
     */
    public V insert(K key, V value) {
        return put(key, value, defaultTtlNanos);
    }

    /**
     * Insert or replace a value that expires once {@code ttl} has elapsed.
     *
     * @return the previous live value, or null if there was none
     * @throws CapacityExceededException if no room could be made for the entry
     */
    public V insertWithTtl(K key, V value, Duration ttl) {
        return put(key, value, requirePositive(ttl).toNanos());
    }

    private V put(K key, V value, long ttlNanos) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (keyOrder == null && !(key instanceof Comparable)) {
            throw new IllegalArgumentException("Key " + key + " of type " + key.getClass().getName() +
                    " is not Comparable and no key comparator is configured");
        }
        long weight = weigh(key, value);
        long now = timeSource.read();

        CacheEntry<K, V> previous = entries.remove(key);
        if (previous != null) {
            policy.onRemove(previous);
        }

        long expiresAt = ttlNanos > 0 ? saturatedAdd(now, ttlNanos) : CacheEntry.NO_EXPIRY;
        CacheEntry<K, V> entry = new CacheEntry<>(key, value, ++clock, expiresAt, weight);

        try {
            makeRoomFor(entry, now);
        } catch (CapacityExceededException e) {
            if (previous != null) {
                entries.put(key, previous);
                policy.onInsert(previous);
            }
            logger.warn("Store {} rejected write for key {}: {}", name, key, e.getMessage());
            throw e;
        }

        entries.put(key, entry);
        policy.onInsert(entry);
        stats.recordInsertion();
        logger.debug("PUT: store={}, key={}, ttlNanos={}", name, key, ttlNanos);

        if (previous == null) {
            return null;
        }
        if (previous.isExpiredAt(now)) {
            recordRemoval(key, RemovalCause.EXPIRED);
            return null;
        }
        return previous.getValue();
    }

    /**
     * Evict until {@code entry} fits, evicting nothing if it can never fit.
     */
    private void makeRoomFor(CacheEntry<K, V> entry, long now) {
        if (!policy.admits(entry)) {
            throw new CapacityExceededException(
                    "Entry for key " + entry.getKey() + " (weight " + entry.getWeight() +
                            ") can never fit the " + policy.getPolicyName() + " budget of " + name,
                    entry.getKey(), maxCapacity);
        }

        while (entries.size() >= maxCapacity || policy.isOverBudget(entry)) {
            Optional<K> victim = entries.isEmpty()
                    ? Optional.empty()
                    : policy.selectVictim(entries.values(), now);
            if (victim.isEmpty()) {
                throw new CapacityExceededException(
                        "Store " + name + " is full (" + entries.size() + "/" + maxCapacity +
                                ") and policy " + policy.getPolicyName() + " selected no victim",
                        entry.getKey(), maxCapacity);
            }
            evict(victim.get(), now);
        }
    }

    private void evict(K victimKey, long now) {
        CacheEntry<K, V> victim = entries.remove(victimKey);
        if (victim == null) {
            throw new IllegalStateException("Policy " + policy.getPolicyName() +
                    " selected key " + victimKey + " which is not in store " + name);
        }
        policy.onRemove(victim);
        recordRemoval(victimKey, victim.isExpiredAt(now) ? RemovalCause.EXPIRED : RemovalCause.CAPACITY);
    }

    private void recordRemoval(K key, RemovalCause cause) {
        if (cause.wasEvicted()) {
            stats.recordEviction(cause == RemovalCause.EXPIRED);
        }
        logger.debug("Removed key: {} from {} (cause: {})", key, name, cause);
    }

    /**
     * Get a value, updating whatever access metadata the policy tracks.
     *
     * @return the value, or null if absent or expired
     */
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        CacheEntry<K, V> entry = liveEntry(key, timeSource.read());
        if (entry == null) {
            stats.recordMiss();
            policy.onMiss(key);
            logger.debug("GET: store={}, key={}, found={}", name, key, false);
            return null;
        }

        policy.onAccess(entry, ++clock);
        stats.recordHit();
        logger.debug("GET: store={}, key={}, found={}", name, key, true);
        return entry.getValue();
    }

    /**
     * Replace the value of a live entry in place. The entry keeps its insertion sequence,
     * expiry and access history; the new value is weighed again and may evict other
     * entries to stay within the budget. Counts as a lookup.
     *
     * @param remapping computes the new value; returning null removes the entry
     * @return the new value, or null if the key was absent or has been removed
     * @throws CapacityExceededException if the new value cannot fit; the old value is kept
     */
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(remapping, "remapping");
        long now = timeSource.read();
        CacheEntry<K, V> entry = liveEntry(key, now);
        if (entry == null) {
            stats.recordMiss();
            policy.onMiss(key);
            return null;
        }

        policy.onAccess(entry, ++clock);
        stats.recordHit();
        V updated = remapping.apply(key, entry.getValue());
        if (updated == null) {
            entries.remove(key);
            policy.onRemove(entry);
            recordRemoval(key, RemovalCause.EXPLICIT);
            return null;
        }

        long weight = weigh(key, updated);
        if (weight == entry.getWeight()) {
            entry.update(updated, weight);
            logger.debug("COMPUTE: store={}, key={} updated", name, key);
            return updated;
        }

        V oldValue = entry.getValue();
        long oldWeight = entry.getWeight();
        entries.remove(key);
        policy.onRemove(entry);
        entry.update(updated, weight);
        try {
            makeRoomFor(entry, now);
        } catch (CapacityExceededException e) {
            entry.update(oldValue, oldWeight);
            entries.put(key, entry);
            policy.onInsert(entry);
            logger.warn("Store {} rejected update for key {}: {}", name, key, e.getMessage());
            throw e;
        }
        entries.put(key, entry);
        policy.onInsert(entry);
        logger.debug("COMPUTE: store={}, key={} updated (weight {} -> {})", name, key, oldWeight, weight);
        return updated;
    }

    /**
     * Delete a key from the store.
     *
     * @return the removed live value, or null if absent or already expired
     */
    public V remove(K key) {
        Objects.requireNonNull(key, "key");
        CacheEntry<K, V> entry = entries.remove(key);
        if (entry == null) {
            return null;
        }
        policy.onRemove(entry);
        if (entry.isExpiredAt(timeSource.read())) {
            recordRemoval(key, RemovalCause.EXPIRED);
            return null;
        }
        recordRemoval(key, RemovalCause.EXPLICIT);
        return entry.getValue();
    }

    /**
     * Whether a live entry exists. Does not count as a lookup; an expired entry found here
     * is dropped.
     */
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        return liveEntry(key, timeSource.read()) != null;
    }

    /**
     * Entry count, including expired entries not yet dropped.
     */
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        int cleared = entries.size();
        entries.clear();
        policy.clear();
        logger.debug("Store {} cleared ({} entries, cause: {})", name, cleared, RemovalCause.EXPLICIT);
    }

    /**
     * Snapshot of the current key set, in key order.
     */
    public List<K> keySnapshot() {
        List<K> keys = new ArrayList<>(entries.keySet());
        keys.sort(keyOrder());
        return keys;
    }

    /**
     * Drop {@code key} if it is expired right now. Keys written after a sweep took its
     * snapshot carry fresh expiry and are left alone.
     *
     * @return true if an expired entry was removed
     */
    public boolean expireIfExpired(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null || !entry.isExpiredAt(timeSource.read())) {
            return false;
        }
        expire(entry);
        return true;
    }

    /**
     * Remove every entry that is expired at the time it is checked.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        int removed = 0;
        for (K key : keySnapshot()) {
            if (expireIfExpired(key)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Store {} swept {} expired entries", name, removed);
        }
        return removed;
    }

    /**
     * Snapshot of live key/value pairs in key order, for export and iteration.
     */
    public List<Map.Entry<K, V>> entries() {
        long now = timeSource.read();
        List<Map.Entry<K, V>> snapshot = new ArrayList<>(entries.size());
        for (CacheEntry<K, V> entry : entries.values()) {
            if (!entry.isExpiredAt(now)) {
                snapshot.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
            }
        }
        Comparator<? super K> order = keyOrder();
        snapshot.sort((a, b) -> order.compare(a.getKey(), b.getKey()));
        return snapshot;
    }

    public CacheStats stats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
    }

    public String getName() {
        return name;
    }

    public EvictionPolicy<K, V> getPolicy() {
        return policy;
    }

    private CacheEntry<K, V> liveEntry(K key, long now) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry != null && entry.isExpiredAt(now)) {
            expire(entry);
            return null;
        }
        return entry;
    }

    private void expire(CacheEntry<K, V> entry) {
        entries.remove(entry.getKey());
        policy.onRemove(entry);
        recordRemoval(entry.getKey(), RemovalCause.EXPIRED);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Comparator<? super K> keyOrder() {
        return keyOrder != null ? keyOrder : (Comparator) Comparator.naturalOrder();
    }

    private long weigh(K key, V value) {
        long weight = weigher.weigh(key, value);
        if (weight < 0) {
            throw new IllegalArgumentException("Weigher returned negative weight " + weight + " for key " + key);
        }
        return weight;
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        return ttl;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        // overflow only when both operands share a sign the result does not
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return CacheEntry.NO_EXPIRY - 1;
        }
        return sum;
    }
}
