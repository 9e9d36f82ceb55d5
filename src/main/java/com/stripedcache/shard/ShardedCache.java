package com.stripedcache.shard;

import com.stripedcache.batch.BatchExecutor;
import com.stripedcache.batch.BatchOperation;
import com.stripedcache.batch.BatchResult;
import com.stripedcache.cache.Cache;
import com.stripedcache.cache.CacheStore;
import com.stripedcache.cache.CapacityExceededException;
import com.stripedcache.stats.CacheStats;
import com.stripedcache.ttl.ExpirationSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Lock-striped cache: routes every key to one of a fixed number of shards by hash.
 *
 * Single-key operations lock only the owning shard, and only for that call. Operations
 * over the whole cache lock the shards one at a time in ascending index order, never two
 * at once, so they cannot deadlock but only see each shard at a slightly different moment.
 * That relaxation is intentional: a global view is an eventually consistent snapshot.
 *
 * The shard count is fixed for the lifetime of the cache so live keys never move.
 */
public class ShardedCache<K, V> implements Cache<K, V>, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ShardedCache.class);

    private final List<Shard<K, V>> shards;
    private final BatchExecutor<K, V> batchExecutor;
    private final ExpirationSweeper sweeper;

    /**
     * @param stores        one store per shard, in shard index order
     * @param sweepInterval period of the background expiration sweep, or null for none
     */
    public ShardedCache(List<CacheStore<K, V>> stores, Duration sweepInterval) {
        Objects.requireNonNull(stores, "stores");
        if (stores.isEmpty()) {
            throw new IllegalArgumentException("At least one shard is required");
        }

        List<Shard<K, V>> created = new ArrayList<>(stores.size());
        for (int i = 0; i < stores.size(); i++) {
            created.add(new Shard<>(i, stores.get(i)));
        }
        this.shards = Collections.unmodifiableList(created);
        this.batchExecutor = new BatchExecutor<>(this);

        if (sweepInterval != null) {
            this.sweeper = new ExpirationSweeper(this::sweepExpired, sweepInterval);
            this.sweeper.start();
        } else {
            this.sweeper = null;
        }

        logger.info("ShardedCache initialized with {} shards (policy: {})",
                shards.size(), stores.get(0).getPolicy().getPolicyName());
    }

    /**
     * Index of the shard owning {@code key}. Pure function of the key's hash code and the
     * shard count, so it is stable for the lifetime of the cache.
     */
    public int shardFor(K key) {
        Objects.requireNonNull(key, "key");
        int h = key.hashCode();
        h ^= (h >>> 16);
        return Math.floorMod(h, shards.size());
    }

    private Shard<K, V> shard(K key) {
        return shards.get(shardFor(key));
    }

    @Override
    public V insert(K key, V value) {
        return shard(key).withLock(store -> store.insert(key, value));
    }

    @Override
    public V insertWithTtl(K key, V value, Duration ttl) {
        return shard(key).withLock(store -> store.insertWithTtl(key, value, ttl));
    }

    @Override
    public V get(K key) {
        return shard(key).withLock(store -> store.get(key));
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        return shard(key).withLock(store -> store.computeIfPresent(key, remapping));
    }

    @Override
    public V remove(K key) {
        return shard(key).withLock(store -> store.remove(key));
    }

    @Override
    public boolean containsKey(K key) {
        return shard(key).withLock(store -> store.containsKey(key));
    }

    @Override
    public int size() {
        int total = 0;
        for (Shard<K, V> shard : shards) {
            total += shard.withLock(CacheStore::size);
        }
        return total;
    }

    @Override
    public boolean isEmpty() {
        for (Shard<K, V> shard : shards) {
            if (!shard.withLock(CacheStore::isEmpty)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void clear() {
        for (Shard<K, V> shard : shards) {
            shard.withLock(store -> {
                store.clear();
                return null;
            });
        }
        logger.info("Cache cleared ({} shards)", shards.size());
    }

    @Override
    public List<K> keys() {
        List<K> keys = new ArrayList<>();
        for (Map.Entry<K, V> entry : entries()) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    @Override
    public List<V> values() {
        List<V> values = new ArrayList<>();
        for (Map.Entry<K, V> entry : entries()) {
            values.add(entry.getValue());
        }
        return values;
    }

    @Override
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> snapshot = new ArrayList<>();
        for (Shard<K, V> shard : shards) {
            snapshot.addAll(shard.withLock(CacheStore::entries));
        }
        return snapshot;
    }

    /**
     * Lazily walks the cache one shard snapshot at a time. Each shard is copied when the
     * iterator reaches it, so writes to later shards made during iteration may be seen.
     */
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return new Iterator<>() {
            private int nextShard = 0;
            private Iterator<Map.Entry<K, V>> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && nextShard < shards.size()) {
                    current = shards.get(nextShard++).withLock(CacheStore::entries).iterator();
                }
                return current.hasNext();
            }

            @Override
            public Map.Entry<K, V> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }

    @Override
    public int load(Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        int loaded = 0;
        int rejected = 0;
        for (Map.Entry<? extends K, ? extends V> pair : pairs) {
            try {
                insert(pair.getKey(), pair.getValue());
                loaded++;
            } catch (CapacityExceededException e) {
                rejected++;
            }
        }
        if (rejected > 0) {
            logger.warn("Loaded {} entries, {} rejected for capacity", loaded, rejected);
        } else {
            logger.info("Loaded {} entries", loaded);
        }
        return loaded;
    }

    @Override
    public Map<K, V> getAll(Collection<? extends K> keys) {
        Objects.requireNonNull(keys, "keys");
        Map<K, V> found = new LinkedHashMap<>();
        for (K key : keys) {
            V value = get(key);
            if (value != null) {
                found.put(key, value);
            }
        }
        return found;
    }

    @Override
    public BatchResult<K, V> applyBatch(List<BatchOperation<K, V>> operations) {
        return batchExecutor.apply(operations);
    }

    /**
     * Takes a key snapshot of each shard, then re-checks and removes each key under its
     * shard lock one key at a time. Keys written after the snapshot are not visited.
     */
    @Override
    public int sweepExpired() {
        int removed = 0;
        for (Shard<K, V> shard : shards) {
            List<K> snapshot = shard.withLock(CacheStore::keySnapshot);
            for (K key : snapshot) {
                if (shard.withLock(store -> store.expireIfExpired(key))) {
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        CacheStats total = CacheStats.empty();
        for (Shard<K, V> shard : shards) {
            total = total.plus(shard.withLock(CacheStore::stats));
        }
        return total;
    }

    /**
     * Per-shard counters, in shard index order.
     */
    public List<CacheStats> shardStats() {
        List<CacheStats> perShard = new ArrayList<>(shards.size());
        for (Shard<K, V> shard : shards) {
            perShard.add(shard.withLock(CacheStore::stats));
        }
        return perShard;
    }

    @Override
    public void resetStats() {
        for (Shard<K, V> shard : shards) {
            shard.withLock(store -> {
                store.resetStats();
                return null;
            });
        }
    }

    public int getShardCount() {
        return shards.size();
    }

    /**
     * Entry count of one shard.
     */
    public int shardSize(int index) {
        return shards.get(index).withLock(CacheStore::size);
    }

    public String getPolicyName() {
        return shards.get(0).withLock(store -> store.getPolicy().getPolicyName());
    }

    public boolean isSweeping() {
        return sweeper != null && sweeper.isRunning();
    }

    /**
     * Stop the background sweep, if any. The cached data stays readable.
     */
    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.stop();
        }
    }
}
