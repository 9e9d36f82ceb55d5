package com.stripedcache.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.stripedcache.eviction.EvictionPolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CacheConfig holds the declarative settings of a cache and loads them from YAML.
 *
 * Configuration format:
 * <pre>
 * cache:
 *   max_capacity: 10000
 *   shards: 16
 *   eviction_policy: lru
 *   enable_stats: true
 *   default_ttl_ms: 300000
 *   sweep_interval_ms: 60000
 * </pre>
 *
 * Every field is optional. Omitted fields mean: unbounded, 1 shard, LRU, stats on,
 * no TTL, no background sweep, adaptive window of 64.
 *
 * Immutable. {@link #validate()} reports every problem at once; loaders validate before
 * returning and {@link CacheBuilder} validates again before building.
 */
public class CacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    public static final int DEFAULT_SHARDS = 1;
    public static final int DEFAULT_ADAPTIVE_WINDOW = 64;

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private final Long maxCapacity;
    private final boolean statsEnabled;
    private final int shards;
    private final Duration defaultTtl;
    private final EvictionPolicyType evictionPolicy;
    private final Long maxWeight;
    private final Long randomSeed;
    private final int adaptiveWindow;
    private final Duration sweepInterval;

    /**
     * Programmatic constructor. Null arguments fall back to the defaults listed on the class.
     */
    public CacheConfig(Long maxCapacity,
                       Boolean statsEnabled,
                       Integer shards,
                       Duration defaultTtl,
                       EvictionPolicyType evictionPolicy,
                       Long maxWeight,
                       Long randomSeed,
                       Integer adaptiveWindow,
                       Duration sweepInterval) {
        this.maxCapacity = maxCapacity;
        this.statsEnabled = statsEnabled == null || statsEnabled;
        this.shards = shards != null ? shards : DEFAULT_SHARDS;
        this.defaultTtl = defaultTtl;
        this.evictionPolicy = evictionPolicy != null ? evictionPolicy : EvictionPolicyType.LRU;
        this.maxWeight = maxWeight;
        this.randomSeed = randomSeed;
        this.adaptiveWindow = adaptiveWindow != null ? adaptiveWindow : DEFAULT_ADAPTIVE_WINDOW;
        this.sweepInterval = sweepInterval;
    }

    /**
     * Factory for Jackson deserialization; durations are given in milliseconds.
     */
    @JsonCreator
    public static CacheConfig fromProperties(
            @JsonProperty("max_capacity") Long maxCapacity,
            @JsonProperty("enable_stats") Boolean statsEnabled,
            @JsonProperty("shards") Integer shards,
            @JsonProperty("default_ttl_ms") Long defaultTtlMs,
            @JsonProperty("eviction_policy") EvictionPolicyType evictionPolicy,
            @JsonProperty("max_weight") Long maxWeight,
            @JsonProperty("random_seed") Long randomSeed,
            @JsonProperty("adaptive_window") Integer adaptiveWindow,
            @JsonProperty("sweep_interval_ms") Long sweepIntervalMs) {
        return new CacheConfig(
                maxCapacity,
                statsEnabled,
                shards,
                defaultTtlMs != null ? Duration.ofMillis(defaultTtlMs) : null,
                evictionPolicy,
                maxWeight,
                randomSeed,
                adaptiveWindow,
                sweepIntervalMs != null ? Duration.ofMillis(sweepIntervalMs) : null);
    }

    /**
     * Load configuration from a YAML file on the file system.
     *
     * @param configPath Path to YAML configuration file
     * @return Loaded and validated CacheConfig
     * @throws IOException          if file cannot be read or is not valid YAML
     * @throws CacheConfigException if configuration is invalid
     */
    public static CacheConfig load(String configPath) throws IOException, CacheConfigException {
        logger.info("Loading cache configuration from file: {}", configPath);

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            throw new IOException("Configuration file not found: " + configPath);
        }

        if (!configFile.canRead()) {
            throw new IOException("Cannot read configuration file: " + configPath);
        }

        Map<String, Object> wrapper = MAPPER.readValue(configFile, Map.class);
        CacheConfig config = fromWrapper(wrapper);

        logger.info("Successfully loaded configuration from {}", configPath);
        return config;
    }

    /**
     * Load configuration from classpath resources.
     *
     * @param resourcePath Path to resource (e.g., "cache-config.yaml")
     * @return Loaded and validated CacheConfig
     * @throws IOException          if resource cannot be read or is not valid YAML
     * @throws CacheConfigException if configuration is invalid
     */
    public static CacheConfig loadFromClasspath(String resourcePath) throws IOException, CacheConfigException {
        logger.info("Loading cache configuration from classpath: {}", resourcePath);

        try (InputStream inputStream = CacheConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Configuration resource not found in classpath: " + resourcePath);
            }

            Map<String, Object> wrapper = MAPPER.readValue(inputStream, Map.class);
            CacheConfig config = fromWrapper(wrapper);

            logger.info("Successfully loaded configuration from classpath resource");
            return config;
        }
    }

    private static CacheConfig fromWrapper(Map<String, Object> wrapper) throws CacheConfigException {
        if (wrapper == null || !wrapper.containsKey("cache")) {
            throw new CacheConfigException(List.of("Configuration must contain 'cache' root element"));
        }

        Object section = wrapper.get("cache");
        if (section != null && !(section instanceof Map)) {
            throw new CacheConfigException(List.of("'cache' element must be a mapping"));
        }

        CacheConfig config;
        try {
            Map<String, Object> cacheData = section == null ? Map.of() : (Map<String, Object>) section;
            config = MAPPER.convertValue(cacheData, CacheConfig.class);
        } catch (IllegalArgumentException e) {
            throw new CacheConfigException("Malformed cache configuration: " + e.getMessage(), e);
        }

        config.validate();
        return config;
    }

    /**
     * Validate the configuration.
     *
     * Checks:
     * - Capacity, shard count, TTL, sweep interval and adaptive window are positive
     * - Capacity (and weight budget) can give every shard at least one unit
     * - SIZE_BASED has a weight budget
     *
     * @throws CacheConfigException listing every problem found
     */
    public void validate() throws CacheConfigException {
        List<String> errors = new ArrayList<>();

        if (shards <= 0) {
            errors.add("Shard count must be positive, got: " + shards);
        }

        if (maxCapacity != null) {
            if (maxCapacity <= 0) {
                errors.add("Max capacity must be positive, got: " + maxCapacity);
            } else if (shards > 0 && maxCapacity < shards) {
                errors.add("Max capacity (" + maxCapacity + ") must be at least the shard count (" + shards + ")");
            }
        }

        if (defaultTtl != null && (defaultTtl.isZero() || defaultTtl.isNegative())) {
            errors.add("Default TTL must be positive, got: " + defaultTtl);
        }

        if (sweepInterval != null && (sweepInterval.isZero() || sweepInterval.isNegative())) {
            errors.add("Sweep interval must be positive, got: " + sweepInterval);
        }

        if (adaptiveWindow <= 0) {
            errors.add("Adaptive window must be positive, got: " + adaptiveWindow);
        }

        if (evictionPolicy == EvictionPolicyType.SIZE_BASED) {
            if (maxWeight == null || maxWeight <= 0) {
                errors.add("SIZE_BASED eviction requires a positive max weight, got: " + maxWeight);
            } else if (shards > 0 && maxWeight < shards) {
                errors.add("Max weight (" + maxWeight + ") must be at least the shard count (" + shards + ")");
            }
        } else if (maxWeight != null) {
            logger.warn("Max weight {} is ignored by eviction policy {}", maxWeight, evictionPolicy);
        }

        if (!errors.isEmpty()) {
            throw new CacheConfigException(errors);
        }

        logger.debug("Cache configuration validation passed");
    }

    /**
     * @return maximum total entry count, or null when unbounded
     */
    public Long getMaxCapacity() {
        return maxCapacity;
    }

    public boolean isBounded() {
        return maxCapacity != null;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public int getShards() {
        return shards;
    }

    /**
     * @return default TTL, or null when entries don't expire by default
     */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public EvictionPolicyType getEvictionPolicy() {
        return evictionPolicy;
    }

    /**
     * @return total weight budget for SIZE_BASED eviction, or null
     */
    public Long getMaxWeight() {
        return maxWeight;
    }

    /**
     * @return seed for RANDOM eviction, or null for an unseeded source
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public int getAdaptiveWindow() {
        return adaptiveWindow;
    }

    /**
     * @return period of the background expiration sweep, or null for none
     */
    public Duration getSweepInterval() {
        return sweepInterval;
    }

    @Override
    public String toString() {
        return "CacheConfig{" +
                "maxCapacity=" + (maxCapacity != null ? maxCapacity : "unbounded") +
                ", shards=" + shards +
                ", evictionPolicy=" + evictionPolicy +
                ", statsEnabled=" + statsEnabled +
                (defaultTtl != null ? ", defaultTtl=" + defaultTtl : "") +
                (maxWeight != null ? ", maxWeight=" + maxWeight : "") +
                (sweepInterval != null ? ", sweepInterval=" + sweepInterval : "") +
                '}';
    }
}
