package com.stripedcache.shard;

import com.stripedcache.batch.BatchOperation;
import com.stripedcache.batch.BatchResult;
import com.stripedcache.cache.Cache;
import com.stripedcache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Reference-counted handle to a {@link ShardedCache} for multi-threaded consumers.
 *
 * {@link #share()} hands out another handle to the same shards in O(1). Each handle is
 * closed independently; the underlying cache is cleared and its sweeper stopped when the
 * last handle closes. A closed handle rejects every operation.
 */
public class SharedCache<K, V> implements Cache<K, V>, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SharedCache.class);

    private final ShardedCache<K, V> cache;
    private final AtomicInteger handles;
    private final AtomicBoolean closed;

    public SharedCache(ShardedCache<K, V> cache) {
        this(cache, new AtomicInteger(1));
    }

    private SharedCache(ShardedCache<K, V> cache, AtomicInteger handles) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.handles = handles;
        this.closed = new AtomicBoolean(false);
    }

    /**
     * @return a new handle to the same underlying cache
     * @throws IllegalStateException if this handle is closed or the cache was already released
     */
    public SharedCache<K, V> share() {
        ensureOpen();
        int current;
        do {
            current = handles.get();
            if (current == 0) {
                // a concurrent close() released the cache after ensureOpen()
                throw new IllegalStateException("SharedCache has been released");
            }
        } while (!handles.compareAndSet(current, current + 1));
        return new SharedCache<>(cache, handles);
    }

    /**
     * @return number of open handles to the underlying cache
     */
    public int getHandleCount() {
        return handles.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Access to the sharded cache behind this handle, e.g. for {@code shardFor}.
     */
    public ShardedCache<K, V> unwrap() {
        ensureOpen();
        return cache;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int remaining = handles.decrementAndGet();
        if (remaining == 0) {
            cache.clear();
            cache.close();
            logger.info("Last SharedCache handle closed, cache released");
        } else {
            logger.debug("SharedCache handle closed, {} remaining", remaining);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("SharedCache handle is closed");
        }
    }

    @Override
    public V insert(K key, V value) {
        ensureOpen();
        return cache.insert(key, value);
    }

    @Override
    public V insertWithTtl(K key, V value, Duration ttl) {
        ensureOpen();
        return cache.insertWithTtl(key, value, ttl);
    }

    @Override
    public V get(K key) {
        ensureOpen();
        return cache.get(key);
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        ensureOpen();
        return cache.computeIfPresent(key, remapping);
    }

    @Override
    public V remove(K key) {
        ensureOpen();
        return cache.remove(key);
    }

    @Override
    public boolean containsKey(K key) {
        ensureOpen();
        return cache.containsKey(key);
    }

    @Override
    public int size() {
        ensureOpen();
        return cache.size();
    }

    @Override
    public boolean isEmpty() {
        ensureOpen();
        return cache.isEmpty();
    }

    @Override
    public void clear() {
        ensureOpen();
        cache.clear();
    }

    @Override
    public List<K> keys() {
        ensureOpen();
        return cache.keys();
    }

    @Override
    public List<V> values() {
        ensureOpen();
        return cache.values();
    }

    @Override
    public List<Map.Entry<K, V>> entries() {
        ensureOpen();
        return cache.entries();
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        ensureOpen();
        return cache.iterator();
    }

    @Override
    public int load(Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs) {
        ensureOpen();
        return cache.load(pairs);
    }

    @Override
    public Map<K, V> getAll(Collection<? extends K> keys) {
        ensureOpen();
        return cache.getAll(keys);
    }

    @Override
    public BatchResult<K, V> applyBatch(List<BatchOperation<K, V>> operations) {
        ensureOpen();
        return cache.applyBatch(operations);
    }

    @Override
    public int sweepExpired() {
        ensureOpen();
        return cache.sweepExpired();
    }

    @Override
    public CacheStats stats() {
        ensureOpen();
        return cache.stats();
    }

    @Override
    public void resetStats() {
        ensureOpen();
        cache.resetStats();
    }
}
