package com.stripedcache.stats;

/**
 * Counter used when statistics are turned off. Records nothing.
 */
public enum DisabledStatsCounter implements StatsCounter {
    INSTANCE;

    @Override
    public void recordHit() {
    }

    @Override
    public void recordMiss() {
    }

    @Override
    public void recordInsertion() {
    }

    @Override
    public void recordEviction(boolean expired) {
    }

    @Override
    public CacheStats snapshot() {
        return CacheStats.empty();
    }

    @Override
    public void reset() {
    }
}
