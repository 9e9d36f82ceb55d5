package com.stripedcache.eviction;

/**
 * Estimates how much of a weight budget an entry consumes.
 */
@FunctionalInterface
public interface Weigher<K, V> {

    /**
     * @return the estimated weight of the entry, never negative
     */
    long weigh(K key, V value);

    /**
     * @return a weigher that gives every entry a weight of 1
     */
    static <K, V> Weigher<K, V> singleton() {
        return (key, value) -> 1L;
    }
}
