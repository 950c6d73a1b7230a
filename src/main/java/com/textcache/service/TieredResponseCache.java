package com.textcache.service;

import com.textcache.config.TextCacheProperties;
import com.textcache.model.dto.CacheStatistics;
import com.textcache.model.dto.PerformanceSummary;
import com.textcache.model.metric.InvalidationType;
import com.textcache.monitoring.PerformanceMonitor;
import com.textcache.repository.KeyValueStore;
import com.textcache.service.key.CacheKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Two-tier response cache for AI text-processing results.
 *
 * Flow:
 * 1. Build the key with {@link CacheKeyGenerator}
 * 2. Check the in-process tier (no network cost)
 * 3. On miss, check Redis and backfill the in-process tier
 * 4. On set, write Redis (TTL by text size, compressed above a threshold) and the in-process tier
 *
 * Redis failures never reach the caller: reads degrade to misses and writes skip the Redis tier.
 * Every operation is reported to {@link PerformanceMonitor}.
 */
@Slf4j
@Service
public class TieredResponseCache {

    static final String CACHED_AT = "cached_at";

    private static final int SUMMARY_WINDOW = 10;

    private final KeyValueStore store;
    private final CacheKeyGenerator keyGenerator;
    private final PayloadCodec codec;
    private final PerformanceMonitor monitor;
    private final TextCacheProperties.CacheConfig config;
    private final Clock clock;
    private final MemoryCacheTier memoryTier;

    public TieredResponseCache(KeyValueStore store,
                               CacheKeyGenerator keyGenerator,
                               PayloadCodec codec,
                               PerformanceMonitor monitor,
                               TextCacheProperties properties,
                               Clock clock) {
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.codec = codec;
        this.monitor = monitor;
        this.config = properties.getCache();
        this.clock = clock;
        this.memoryTier = new MemoryCacheTier(config.getMemoryCacheSize());

        validate(config);
        log.info("Tiered response cache initialized (memory tier: {} entries, compression above {} bytes at level {})",
                config.getMemoryCacheSize(), config.getCompressionThreshold(), config.getCompressionLevel());
    }

    private static void validate(TextCacheProperties.CacheConfig config) {
        TextCacheProperties.TextSizeTiers tiers = config.getTextSizeTiers();
        if (tiers.getSmall() < 0 || tiers.getSmall() > tiers.getMedium() || tiers.getMedium() > tiers.getLarge()) {
            throw new IllegalArgumentException("cache.text-size-tiers must satisfy 0 <= small <= medium <= large");
        }
        if (config.getDefaultTtl() == null || config.getDefaultTtl().isNegative() || config.getDefaultTtl().isZero()) {
            throw new IllegalArgumentException("cache.default-ttl must be positive");
        }
        config.getTierTtls().forEach((tier, ttl) -> {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("cache.tier-ttls." + tier + " must be positive");
            }
        });
    }

    // ------------------------------------------------------------------ get / set

    public Optional<Map<String, Object>> get(String text, String operation, Map<String, ?> options) {
        return get(text, operation, options, null);
    }

    /**
     * Look up a cached response.
     *
     * @return a copy of the cached entry (including {@code cached_at}), or empty on miss or when
     * Redis is unavailable
     */
    public Optional<Map<String, Object>> get(String text, String operation, Map<String, ?> options, String question) {
        long start = System.nanoTime();
        String key = keyGenerator.generateCacheKey(text, operation, options, question);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("text_tier", textTier(text));

        Map<String, Object> cached = memoryTier.get(key);
        if (cached != null) {
            extra.put("cache_tier", "memory");
            recordOperation("get", start, true, text, extra);
            log.debug("Memory cache hit for {} operation", operation);
            return Optional.of(new LinkedHashMap<>(cached));
        }

        if (!connectQuietly()) {
            extra.put("reason", "connection_failed");
            recordOperation("get", start, false, text, extra);
            return Optional.empty();
        }

        byte[] stored;
        try {
            stored = store.get(key);
        } catch (Exception e) {
            log.warn("Cache retrieval error for {} operation: {}", operation, e.getMessage());
            extra.put("reason", "store_error");
            extra.put("error", String.valueOf(e.getMessage()));
            recordOperation("get", start, false, text, extra);
            return Optional.empty();
        }

        if (stored == null) {
            extra.put("reason", "not_found");
            recordOperation("get", start, false, text, extra);
            log.debug("Cache miss for {} operation", operation);
            return Optional.empty();
        }

        Map<String, Object> entry;
        try {
            entry = codec.decode(stored);
        } catch (PayloadCodec.CorruptedPayloadException e) {
            log.error("Corrupted cache payload for {} operation, treating as miss: {}", operation, e.getMessage());
            extra.put("reason", "corrupted_payload");
            recordOperation("get", start, false, text, extra);
            return Optional.empty();
        }

        memoryTier.put(key, entry);

        extra.put("cache_tier", "redis");
        extra.put("compressed", stored[0] == PayloadCodec.COMPRESSED);
        recordOperation("get", start, true, text, extra);
        log.debug("Redis cache hit for {} operation", operation);
        return Optional.of(new LinkedHashMap<>(entry));
    }

    public void set(String text, String operation, Map<String, ?> options, Map<String, ?> value) {
        set(text, operation, options, value, null);
    }

    /**
     * Store a response in both tiers. The entry gets a {@code cached_at} timestamp.
     *
     * @throws IllegalArgumentException if the value cannot be serialized as JSON
     */
    public void set(String text, String operation, Map<String, ?> options, Map<String, ?> value, String question) {
        Objects.requireNonNull(value, "value");
        long start = System.nanoTime();
        String key = keyGenerator.generateCacheKey(text, operation, options, question);

        Map<String, Object> entry = new LinkedHashMap<>(value);
        entry.put(CACHED_AT, Instant.now(clock).toString());

        PayloadCodec.EncodedPayload payload = codec.encode(entry);
        if (payload.isCompressed()) {
            monitor.recordCompressionRatio(payload.getOriginalSize(), payload.getPayloadSize(),
                    payload.getCompressionTime(), operation);
        }

        String tier = textTier(text);
        Duration ttl = ttlFor(tier);

        boolean storedInRedis = false;
        if (connectQuietly()) {
            try {
                store.set(key, payload.getBytes(), ttl);
                storedInRedis = true;
            } catch (Exception e) {
                log.warn("Cache storage error for {} operation: {}", operation, e.getMessage());
            }
        } else {
            log.debug("Redis unavailable, storing {} result in memory tier only", operation);
        }

        // same value types a tier-2 backfill would produce
        memoryTier.put(key, codec.normalize(entry));

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("text_tier", tier);
        extra.put("compressed", payload.isCompressed());
        extra.put("ttl_seconds", ttl.getSeconds());
        extra.put("stored_in_redis", storedInRedis);
        recordOperation("set", start, false, text, extra);

        log.debug("Cached {} response (tier: {}, ttl: {}s, compressed: {}, redis: {})",
                operation, tier, ttl.getSeconds(), payload.isCompressed(), storedInRedis);
    }

    // ------------------------------------------------------------------ invalidation

    public int invalidatePattern(String pattern) {
        return invalidatePattern(pattern, "");
    }

    /**
     * Delete every Redis key under the namespace whose key contains {@code pattern} (substring
     * match; an empty pattern matches all keys). Matching in-process entries are dropped too.
     *
     * @return number of Redis keys deleted; 0 when none matched or Redis is unavailable
     */
    public int invalidatePattern(String pattern, String operationContext) {
        String substring = pattern != null ? pattern : "";
        long start = System.nanoTime();

        int memoryRemoved = memoryTier.removeMatching(substring);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("memory_entries_removed", memoryRemoved);

        long deleted = 0;
        if (!connectQuietly()) {
            extra.put("status", "connection_failed");
            log.warn("Cache invalidation skipped for pattern '{}': Redis unavailable", substring);
        } else {
            try {
                Set<String> keys = store.scanKeys(globEscape(config.getKeyPrefix()) + "*" + globEscape(substring) + "*");
                if (keys.isEmpty()) {
                    extra.put("status", "no_keys_found");
                    log.debug("No cache entries found for pattern '{}'", substring);
                } else {
                    deleted = store.delete(keys);
                    extra.put("status", "success");
                    log.info("Invalidated {} cache entries matching '{}'", deleted, substring);
                }
            } catch (Exception e) {
                extra.put("status", "store_error");
                extra.put("error", String.valueOf(e.getMessage()));
                log.warn("Cache invalidation error for pattern '{}': {}", substring, e.getMessage());
            }
        }

        monitor.recordInvalidationEvent(substring, (int) deleted, elapsedSince(start), InvalidationType.MANUAL,
                operationContext, extra);
        return (int) deleted;
    }

    public int invalidateAll() {
        return invalidateAll("manual_clear_all");
    }

    public int invalidateAll(String operationContext) {
        return invalidatePattern("", operationContext);
    }

    public int invalidateByOperation(String operation) {
        return invalidateByOperation(operation, "operation_specific_" + operation);
    }

    /**
     * Invalidate every entry cached for one operation.
     */
    public int invalidateByOperation(String operation, String operationContext) {
        return invalidatePattern(keyGenerator.operationPattern(operation), operationContext);
    }

    public int invalidateMemoryCache() {
        return invalidateMemoryCache("memory_cache_clear");
    }

    /**
     * Clear the in-process tier only. Redis is left untouched.
     *
     * @return number of entries removed
     */
    public int invalidateMemoryCache(String operationContext) {
        long start = System.nanoTime();
        int removed = memoryTier.clear();

        monitor.recordInvalidationEvent("memory_cache", removed, elapsedSince(start), InvalidationType.MEMORY,
                operationContext, Map.of("status", "success"));
        log.info("Cleared {} entries from memory cache", removed);
        return removed;
    }

    // ------------------------------------------------------------------ TTL policy

    /**
     * Size class of a text: small, medium, large or xlarge.
     * Boundaries are exclusive upper bounds: with the default small limit of 500, a text of
     * exactly 500 chars is already medium.
     */
    public String textTier(String text) {
        int length = text != null ? text.length() : 0;
        TextCacheProperties.TextSizeTiers tiers = config.getTextSizeTiers();
        if (length < tiers.getSmall()) {
            return "small";
        } else if (length < tiers.getMedium()) {
            return "medium";
        } else if (length < tiers.getLarge()) {
            return "large";
        }
        return "xlarge";
    }

    public Duration ttlFor(String tier) {
        return config.getTierTtls().getOrDefault(tier, config.getDefaultTtl());
    }

    // ------------------------------------------------------------------ statistics

    /**
     * Status of both tiers plus performance statistics. Records a memory usage snapshot.
     */
    public CacheStatistics getCacheStats() {
        CacheStatistics.StoreStatistics.StoreStatisticsBuilder storeStats = CacheStatistics.StoreStatistics.builder();
        Long storeKeys = null;
        Long storeMemory = null;

        if (connectQuietly()) {
            try {
                Map<String, Object> info = store.info();
                storeKeys = (long) store.scanKeys(globEscape(config.getKeyPrefix()) + "*").size();
                storeMemory = parseLong(info.get("used_memory"));

                storeStats.status("connected")
                        .keys(storeKeys)
                        .memoryUsed(info.getOrDefault("used_memory_human", "unknown").toString())
                        .memoryUsedBytes(storeMemory)
                        .connectedClients(parseInteger(info.get("connected_clients")));
            } catch (Exception e) {
                log.warn("Failed to read Redis statistics: {}", e.getMessage());
                storeKeys = null;
                storeMemory = null;
                storeStats.status("error").error(String.valueOf(e.getMessage()));
            }
        } else {
            storeStats.status("unavailable");
        }

        long memoryBytes = 0;
        for (Map<String, Object> entry : memoryTier.snapshot().values()) {
            memoryBytes += codec.serializedSize(entry);
        }
        int entries = memoryTier.size();

        monitor.recordMemoryUsage(entries, memoryBytes, memoryTier.maxSize(), storeKeys, storeMemory,
                Map.of("source", "cache_stats"));

        return CacheStatistics.builder()
                .store(storeStats.build())
                .memory(CacheStatistics.MemoryTierStatistics.builder()
                        .memoryCacheEntries(entries)
                        .memoryCacheSizeLimit(memoryTier.maxSize())
                        .memoryCacheUtilization(entries + "/" + memoryTier.maxSize())
                        .build())
                .performance(monitor.getPerformanceStats())
                .build();
    }

    /**
     * Hit ratio as a percentage.
     */
    public double getCacheHitRatio() {
        return monitor.getCacheHitRate();
    }

    public PerformanceSummary getPerformanceSummary() {
        return PerformanceSummary.builder()
                .hitRatio(monitor.getCacheHitRate())
                .totalCacheOperations(monitor.getTotalOperations())
                .cacheHits(monitor.getCacheHits())
                .cacheMisses(monitor.getCacheMisses())
                .recentAvgKeyGenerationMs(monitor.getRecentAverageKeyGenerationMs(SUMMARY_WINDOW))
                .recentAvgCacheOperationMs(monitor.getRecentAverageCacheOperationMs(SUMMARY_WINDOW))
                .totalInvalidations(monitor.getTotalInvalidations())
                .totalKeysInvalidated(monitor.getTotalKeysInvalidated())
                .memoryUsage(monitor.hasMemoryMeasurements() ? monitor.getMemoryUsageStats() : null)
                .build();
    }

    public void resetPerformanceStats() {
        monitor.resetStats();
    }

    MemoryCacheTier memoryTier() {
        return memoryTier;
    }

    // ------------------------------------------------------------------ helpers

    private boolean connectQuietly() {
        try {
            return store.connect();
        } catch (Exception e) {
            log.warn("Redis connection check failed: {}", e.getMessage());
            return false;
        }
    }

    private void recordOperation(String operation, long start, boolean hit, String text, Map<String, Object> extra) {
        monitor.recordCacheOperationTime(operation, elapsedSince(start), hit, text != null ? text.length() : 0, extra);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Escape Redis glob metacharacters so the value matches literally.
     */
    static String globEscape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static Long parseLong(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            log.debug("Non-numeric Redis info value: {}", value);
            return null;
        }
    }

    private static Integer parseInteger(Object value) {
        Long parsed = parseLong(value);
        return parsed != null ? parsed.intValue() : null;
    }
}
