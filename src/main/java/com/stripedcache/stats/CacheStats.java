package com.stripedcache.stats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of cache counters.
 *
 * Evictions include both capacity evictions and expirations; {@link #getExpirations()}
 * reports the expired subset. Snapshots taken from a sharded cache are sums of
 * per-shard snapshots read one shard at a time, so they are not atomic across shards.
 */
public final class CacheStats {
    private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0);

    private final long hits;
    private final long misses;
    private final long insertions;
    private final long evictions;
    private final long expirations;

    public CacheStats(long hits, long misses, long insertions, long evictions, long expirations) {
        if (hits < 0 || misses < 0 || insertions < 0 || evictions < 0 || expirations < 0) {
            throw new IllegalArgumentException("Counters must be non-negative");
        }
        if (expirations > evictions) {
            throw new IllegalArgumentException(
                    "Expirations (" + expirations + ") cannot exceed evictions (" + evictions + ")");
        }
        this.hits = hits;
        this.misses = misses;
        this.insertions = insertions;
        this.evictions = evictions;
        this.expirations = expirations;
    }

    public static CacheStats empty() {
        return EMPTY;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getInsertions() {
        return insertions;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getExpirations() {
        return expirations;
    }

    /**
     * @return hits + misses, i.e. the number of lookups issued
     */
    public long requestCount() {
        return hits + misses;
    }

    /**
     * @return hits / (hits + misses), or 0.0 when no lookups were issued
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }

    /**
     * @return misses / (hits + misses), or 0.0 when no lookups were issued
     */
    public double missRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) misses / requests;
    }

    /**
     * Sum of this snapshot and another, used to aggregate shards.
     */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hits + other.hits,
                misses + other.misses,
                insertions + other.insertions,
                evictions + other.evictions,
                expirations + other.expirations);
    }

    /**
     * Convert to a flat map for whatever telemetry sink the host wires up.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("hits", hits);
        map.put("misses", misses);
        map.put("insertions", insertions);
        map.put("evictions", evictions);
        map.put("expirations", expirations);
        map.put("hitRate", hitRate());
        map.put("missRate", missRate());
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheStats)) return false;
        CacheStats that = (CacheStats) o;
        return hits == that.hits
                && misses == that.misses
                && insertions == that.insertions
                && evictions == that.evictions
                && expirations == that.expirations;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hits, misses, insertions, evictions, expirations);
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, insertions=%d, evictions=%d, expirations=%d, hitRate=%.3f}",
                hits, misses, insertions, evictions, expirations, hitRate());
    }
}
