package com.stripedcache.cache;

/**
 * Why an entry left a store.
 */
public enum RemovalCause {
    /**
     * Removed explicitly by the caller (remove or clear).
     */
    EXPLICIT,

    /**
     * Chosen as a victim by the eviction policy to respect a capacity or weight budget.
     */
    CAPACITY,

    /**
     * Its time-to-live elapsed.
     */
    EXPIRED;

    /**
     * @return true for causes that count as evictions in the statistics
     */
    public boolean wasEvicted() {
        return this != EXPLICIT;
    }
}
