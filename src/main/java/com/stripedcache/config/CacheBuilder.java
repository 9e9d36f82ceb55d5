package com.stripedcache.config;

import com.stripedcache.cache.CacheStore;
import com.stripedcache.eviction.AdaptiveEvictionPolicy;
import com.stripedcache.eviction.EvictionPolicy;
import com.stripedcache.eviction.EvictionPolicyType;
import com.stripedcache.eviction.FIFOEvictionPolicy;
import com.stripedcache.eviction.LFUEvictionPolicy;
import com.stripedcache.eviction.LRUEvictionPolicy;
import com.stripedcache.eviction.NoEvictionPolicy;
import com.stripedcache.eviction.RandomEvictionPolicy;
import com.stripedcache.eviction.SizeBasedEvictionPolicy;
import com.stripedcache.eviction.TtlAwareEvictionPolicy;
import com.stripedcache.eviction.Weigher;
import com.stripedcache.shard.ShardedCache;
import com.stripedcache.shard.SharedCache;
import com.stripedcache.stats.DisabledStatsCounter;
import com.stripedcache.stats.SimpleStatsCounter;
import com.stripedcache.stats.StatsCounter;
import com.stripedcache.ttl.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Fluent builder assembling a fully configured cache.
 *
 * <pre>
 * ShardedCache&lt;String, byte[]&gt; cache = CacheBuilder.&lt;String, byte[]&gt;newBuilder()
 *         .maxCapacity(10_000)
 *         .withLru()
 *         .withTtl(Duration.ofMinutes(5))
 *         .shards(16)
 *         .build();
 * </pre>
 *
 * Setters never throw on bad numbers; {@link #build()} validates everything at once and
 * throws {@link CacheConfigException} instead of producing a half-built cache.
 *
 * Capacity and weight budgets are split across shards so that they add up exactly to the
 * configured totals. With more than one shard, eviction order is per shard, not global.
 */
public class CacheBuilder<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(CacheBuilder.class);

    private Long maxCapacity;
    private EvictionPolicyType policyType = EvictionPolicyType.LRU;
    private Duration defaultTtl;
    private int shards = CacheConfig.DEFAULT_SHARDS;
    private boolean statsEnabled = true;
    private Long maxWeight;
    private Weigher<? super K, ? super V> weigher = Weigher.singleton();
    private Long randomSeed;
    private int adaptiveWindow = CacheConfig.DEFAULT_ADAPTIVE_WINDOW;
    private Duration sweepInterval;
    private TimeSource timeSource = TimeSource.system();
    private Comparator<? super K> comparator;

    private CacheBuilder() {
    }

    public static <K, V> CacheBuilder<K, V> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Start from declarative settings, typically loaded with {@link CacheConfig#load(String)}.
     */
    public static <K, V> CacheBuilder<K, V> fromConfig(CacheConfig config) {
        Objects.requireNonNull(config, "config");
        CacheBuilder<K, V> builder = new CacheBuilder<>();
        builder.maxCapacity = config.getMaxCapacity();
        builder.policyType = config.getEvictionPolicy();
        builder.defaultTtl = config.getDefaultTtl();
        builder.shards = config.getShards();
        builder.statsEnabled = config.isStatsEnabled();
        builder.maxWeight = config.getMaxWeight();
        builder.randomSeed = config.getRandomSeed();
        builder.adaptiveWindow = config.getAdaptiveWindow();
        builder.sweepInterval = config.getSweepInterval();
        return builder;
    }

    public CacheBuilder<K, V> maxCapacity(long maxCapacity) {
        this.maxCapacity = maxCapacity;
        return this;
    }

    public CacheBuilder<K, V> unbounded() {
        this.maxCapacity = null;
        return this;
    }

    public CacheBuilder<K, V> withLru() {
        this.policyType = EvictionPolicyType.LRU;
        return this;
    }

    public CacheBuilder<K, V> withLfu() {
        this.policyType = EvictionPolicyType.LFU;
        return this;
    }

    public CacheBuilder<K, V> withFifo() {
        this.policyType = EvictionPolicyType.FIFO;
        return this;
    }

    public CacheBuilder<K, V> withNoEviction() {
        this.policyType = EvictionPolicyType.NONE;
        return this;
    }

    /**
     * Random eviction; each shard draws from its own {@code Random(seed + shardIndex)}.
     */
    public CacheBuilder<K, V> withRandom(long seed) {
        this.policyType = EvictionPolicyType.RANDOM;
        this.randomSeed = seed;
        return this;
    }

    public CacheBuilder<K, V> withAdaptive(int window) {
        this.policyType = EvictionPolicyType.ADAPTIVE;
        this.adaptiveWindow = window;
        return this;
    }

    /**
     * Evict the heaviest entries once the summed weights would exceed {@code maxWeight}.
     */
    public CacheBuilder<K, V> withSizeBased(long maxWeight, Weigher<? super K, ? super V> weigher) {
        this.policyType = EvictionPolicyType.SIZE_BASED;
        this.maxWeight = maxWeight;
        this.weigher = Objects.requireNonNull(weigher, "weigher");
        return this;
    }

    /**
     * Give entries a default TTL. LRU and LFU become their TTL-aware variants, which evict
     * expired entries before anything else.
     */
    public CacheBuilder<K, V> withTtl(Duration defaultTtl) {
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        return this;
    }

    public CacheBuilder<K, V> shards(int shards) {
        this.shards = shards;
        return this;
    }

    public CacheBuilder<K, V> withStats(boolean enabled) {
        this.statsEnabled = enabled;
        return this;
    }

    public CacheBuilder<K, V> timeSource(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        return this;
    }

    /**
     * Ordering of keys in snapshots ({@code keys()}, {@code entries()}, iteration). Key
     * identity always follows {@code equals}/{@code hashCode}, so keys the comparator
     * ranks as equal remain distinct entries. Without one, keys must be {@link Comparable}.
     */
    public CacheBuilder<K, V> comparator(Comparator<? super K> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        return this;
    }

    /**
     * Run {@code sweepExpired()} on a background daemon thread at this interval.
     */
    public CacheBuilder<K, V> sweepInterval(Duration interval) {
        this.sweepInterval = Objects.requireNonNull(interval, "interval");
        return this;
    }

    /**
     * @return the declarative part of this builder's settings
     */
    public CacheConfig toConfig() {
        return new CacheConfig(maxCapacity, statsEnabled, shards, defaultTtl, policyType,
                maxWeight, randomSeed, adaptiveWindow, sweepInterval);
    }

    /**
     * Build the cache.
     *
     * @throws CacheConfigException if the configuration is invalid
     */
    public ShardedCache<K, V> build() throws CacheConfigException {
        CacheConfig config = toConfig();
        config.validate();

        EvictionPolicyType effectivePolicy = effectivePolicy(config);
        int shardCount = config.getShards();
        List<CacheStore<K, V>> stores = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            long capacity = config.isBounded()
                    ? portion(config.getMaxCapacity(), shardCount, i)
                    : CacheStore.UNBOUNDED;
            StatsCounter counter = config.isStatsEnabled()
                    ? new SimpleStatsCounter()
                    : DisabledStatsCounter.INSTANCE;
            stores.add(new CacheStore<>(
                    "shard-" + i,
                    capacity,
                    createPolicy(effectivePolicy, config, i),
                    counter,
                    timeSource,
                    weigher,
                    config.getDefaultTtl(),
                    comparator));
        }

        logger.info("Building cache: {} (effective policy: {})", config, effectivePolicy);
        return new ShardedCache<>(stores, config.getSweepInterval());
    }

    /**
     * Build the cache wrapped in a shareable, reference-counted handle.
     *
     * @throws CacheConfigException if the configuration is invalid
     */
    public SharedCache<K, V> buildShared() throws CacheConfigException {
        return new SharedCache<>(build());
    }

    static EvictionPolicyType effectivePolicy(CacheConfig config) {
        EvictionPolicyType type = config.getEvictionPolicy();
        if (config.getDefaultTtl() == null || type.isTtlAware()) {
            return type;
        }
        switch (type) {
            case LRU:
                return EvictionPolicyType.TTL_LRU;
            case LFU:
                return EvictionPolicyType.TTL_LFU;
            default:
                return type;
        }
    }

    private EvictionPolicy<K, V> createPolicy(EvictionPolicyType type, CacheConfig config, int shardIndex) {
        switch (type) {
            case NONE:
                return new NoEvictionPolicy<>();
            case FIFO:
                return new FIFOEvictionPolicy<>();
            case LRU:
                return new LRUEvictionPolicy<>();
            case LFU:
                return new LFUEvictionPolicy<>();
            case TTL_LRU:
                return TtlAwareEvictionPolicy.lru();
            case TTL_LFU:
                return TtlAwareEvictionPolicy.lfu();
            case SIZE_BASED:
                return new SizeBasedEvictionPolicy<>(portion(config.getMaxWeight(), config.getShards(), shardIndex));
            case ADAPTIVE:
                return new AdaptiveEvictionPolicy<>(config.getAdaptiveWindow());
            case RANDOM:
                return config.getRandomSeed() != null
                        ? new RandomEvictionPolicy<>(config.getRandomSeed() + shardIndex)
                        : new RandomEvictionPolicy<>(new Random());
            default:
                throw new IllegalStateException("Unknown eviction policy: " + type);
        }
    }

    /**
     * Share of {@code total} given to part {@code index}; the first {@code total % parts}
     * parts get one extra unit so the shares sum to {@code total}.
     */
    static long portion(long total, int parts, int index) {
        long base = total / parts;
        return index < total % parts ? base + 1 : base;
    }
}
