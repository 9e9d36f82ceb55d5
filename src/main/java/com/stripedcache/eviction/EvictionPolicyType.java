package com.stripedcache.eviction;

/**
 * The closed set of eviction strategies a cache can be configured with.
 */
public enum EvictionPolicyType {
    /**
     * Never evicts; writes past capacity fail.
     */
    NONE,

    /**
     * Evicts the oldest insertion.
     */
    FIFO,

    /**
     * Evicts the least recently used entry.
     */
    LRU,

    /**
     * Evicts the least frequently used entry.
     */
    LFU,

    /**
     * Evicts expired entries first, then falls back to LRU.
     */
    TTL_LRU,

    /**
     * Evicts expired entries first, then falls back to LFU.
     */
    TTL_LFU,

    /**
     * Evicts the heaviest entries until a weight budget is respected.
     */
    SIZE_BASED,

    /**
     * Switches between LRU and LFU depending on which one misses less.
     */
    ADAPTIVE,

    /**
     * Evicts a uniformly chosen entry.
     */
    RANDOM;

    /**
     * @return true for the variants that prefer expired victims
     */
    public boolean isTtlAware() {
        return this == TTL_LRU || this == TTL_LFU;
    }
}
