package com.stripedcache.stats;

/**
 * Records the events a store produces. Each shard owns its own counter and only
 * touches it while holding the shard lock, so implementations need no synchronization.
 */
public interface StatsCounter {

    void recordHit();

    void recordMiss();

    void recordInsertion();

    /**
     * Record an eviction.
     *
     * @param expired true when the entry left because its TTL elapsed rather than for capacity
     */
    void recordEviction(boolean expired);

    /**
     * @return the counters accumulated so far
     */
    CacheStats snapshot();

    /**
     * Reset all counters to zero.
     */
    void reset();
}
