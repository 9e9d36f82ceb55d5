package com.stripedcache.cache;

import java.util.Objects;

/**
 * Represents a single cache entry with the metadata eviction and expiry decisions read.
 *
 * Ticks come from the owning store's logical clock, so they are unique and
 * increasing within one store. Entries are only mutated while the owning
 * shard's lock is held.
 */
public class CacheEntry<K, V> {
    /** Marker for entries that never expire. */
    public static final long NO_EXPIRY = Long.MAX_VALUE;

    private final K key;
    private V value;
    private final long insertionSequence;
    private final long expiresAt;
    private long weight;
    private long lastAccessTick;
    private long frequency;

    public CacheEntry(K key, V value, long insertionSequence, long expiresAt, long weight) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.insertionSequence = insertionSequence;
        this.expiresAt = expiresAt;
        this.weight = weight;
        this.lastAccessTick = insertionSequence;
        this.frequency = 1;
    }

    /**
     * Record a read at the given tick (recency only).
     */
    public void touch(long tick) {
        this.lastAccessTick = tick;
    }

    /**
     * Record a read at the given tick, bumping both recency and frequency.
     */
    public void recordAccess(long tick) {
        this.lastAccessTick = tick;
        this.frequency++;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Swap in a new value and its weight; sequence, expiry and access history are kept.
     */
    void update(V value, long weight) {
        this.value = Objects.requireNonNull(value, "value");
        this.weight = weight;
    }

    public long getInsertionSequence() {
        return insertionSequence;
    }

    public long getLastAccessTick() {
        return lastAccessTick;
    }

    public long getFrequency() {
        return frequency;
    }

    public long getWeight() {
        return weight;
    }

    /**
     * @return expiry instant in time-source nanoseconds, or {@link #NO_EXPIRY}
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean hasExpiry() {
        return expiresAt != NO_EXPIRY;
    }

    /**
     * An entry is expired once {@code now >= expiresAt}.
     */
    public boolean isExpiredAt(long now) {
        return hasExpiry() && now >= expiresAt;
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "key=" + key +
                ", seq=" + insertionSequence +
                ", lastAccess=" + lastAccessTick +
                ", frequency=" + frequency +
                ", weight=" + weight +
                (hasExpiry() ? ", expiresAt=" + expiresAt : "") +
                '}';
    }
}
