package com.stripedcache.stats;

/**
 * Plain counters for a single shard.
 */
public class SimpleStatsCounter implements StatsCounter {
    private long hits;
    private long misses;
    private long insertions;
    private long evictions;
    private long expirations;

    @Override
    public void recordHit() {
        hits++;
    }

    @Override
    public void recordMiss() {
        misses++;
    }

    @Override
    public void recordInsertion() {
        insertions++;
    }

    @Override
    public void recordEviction(boolean expired) {
        evictions++;
        if (expired) {
            expirations++;
        }
    }

    @Override
    public CacheStats snapshot() {
        return new CacheStats(hits, misses, insertions, evictions, expirations);
    }

    @Override
    public void reset() {
        hits = 0;
        misses = 0;
        insertions = 0;
        evictions = 0;
        expirations = 0;
    }
}
