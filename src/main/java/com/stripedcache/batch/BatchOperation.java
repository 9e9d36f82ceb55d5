package com.stripedcache.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * One operation of a batch. Each operation targets a single key and is applied on its own.
 */
public final class BatchOperation<K, V> {
    private final OperationType type;
    private final K key;
    private final V value;
    private final Duration ttl;

    private BatchOperation(OperationType type, K key, V value, Duration ttl) {
        this.type = Objects.requireNonNull(type, "type");
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
        this.ttl = ttl;
    }

    /**
     * Create an INSERT operation using the cache's default TTL
     */
    public static <K, V> BatchOperation<K, V> insert(K key, V value) {
        return new BatchOperation<>(OperationType.INSERT, key, Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Create an INSERT operation with an explicit TTL
     *
     * @throws IllegalArgumentException if the TTL is zero or negative
     */
    public static <K, V> BatchOperation<K, V> insert(K key, V value, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        return new BatchOperation<>(OperationType.INSERT, key, Objects.requireNonNull(value, "value"), ttl);
    }

    /**
     * Create a REMOVE operation
     */
    public static <K, V> BatchOperation<K, V> remove(K key) {
        return new BatchOperation<>(OperationType.REMOVE, key, null, null);
    }

    /**
     * Create a GET operation
     */
    public static <K, V> BatchOperation<K, V> get(K key) {
        return new BatchOperation<>(OperationType.GET, key, null, null);
    }

    public OperationType getType() {
        return type;
    }

    public K getKey() {
        return key;
    }

    /**
     * @return the value to insert, null for REMOVE and GET
     */
    public V getValue() {
        return value;
    }

    /**
     * @return the explicit TTL of an INSERT, or null to use the cache default
     */
    public Duration getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return String.format("BatchOperation{type=%s, key='%s'%s}",
                type, key, ttl != null ? ", ttl=" + ttl : "");
    }
}
