package com.textcache.monitoring;

import com.textcache.config.TextCacheProperties;
import com.textcache.model.dto.InvalidationFrequencyStats;
import com.textcache.model.dto.InvalidationRecommendation;
import com.textcache.model.dto.MemoryUsageStats;
import com.textcache.model.dto.MemoryWarning;
import com.textcache.model.dto.MetricsExport;
import com.textcache.model.dto.PerformanceStats;
import com.textcache.model.dto.Severity;
import com.textcache.model.dto.SlowOperation;
import com.textcache.model.metric.CacheOperationMetric;
import com.textcache.model.metric.CompressionMetric;
import com.textcache.model.metric.InvalidationMetric;
import com.textcache.model.metric.InvalidationType;
import com.textcache.model.metric.KeyGenerationMetric;
import com.textcache.model.metric.MemoryUsageMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Collects cache performance measurements and derives statistics from them.
 *
 * Tracks:
 * - Key generation timing
 * - Cache operation timing (get/set) and hit/miss counters
 * - Compression ratios
 * - Memory usage snapshots
 * - Invalidation events and their frequency
 *
 * Every measurement list is pruned by age (retention window) and by count (most recent
 * {@code maxMeasurements} kept) on each append and on each statistics read. All state is
 * guarded by a single lock; log statements are emitted after the lock is released.
 */
@Slf4j
@Service
public class PerformanceMonitor {

    private static final Duration ONE_HOUR = Duration.ofHours(1);
    private static final Duration ONE_DAY = Duration.ofDays(1);
    private static final int ANALYSIS_WINDOW = 50;
    private static final int TOP_PATTERNS = 10;
    private static final int TREND_WINDOW = 10;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final TextCacheProperties.MonitoringConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final List<KeyGenerationMetric> keyGenerationTimes = new ArrayList<>();
    private final List<CacheOperationMetric> cacheOperationTimes = new ArrayList<>();
    private final List<CompressionMetric> compressionRatios = new ArrayList<>();
    private final List<MemoryUsageMetric> memoryUsageMeasurements = new ArrayList<>();
    private final List<InvalidationMetric> invalidationEvents = new ArrayList<>();

    private long cacheHits;
    private long cacheMisses;
    private long totalOperations;
    private long totalInvalidations;
    private long totalKeysInvalidated;

    public PerformanceMonitor(TextCacheProperties properties, Clock clock) {
        this.config = properties.getMonitoring();
        this.clock = clock;
        validate(config);
    }

    private static void validate(TextCacheProperties.MonitoringConfig config) {
        if (config.getRetention() == null || config.getRetention().isNegative() || config.getRetention().isZero()) {
            throw new IllegalArgumentException("monitoring.retention must be positive");
        }
        if (config.getMaxMeasurements() <= 0) {
            throw new IllegalArgumentException("monitoring.max-measurements must be positive");
        }
        if (config.getInvalidationWarningPerHour() > config.getInvalidationCriticalPerHour()) {
            throw new IllegalArgumentException(
                    "monitoring.invalidation-warning-per-hour must not exceed invalidation-critical-per-hour");
        }
        if (config.getMemoryWarningThresholdBytes() <= 0
                || config.getMemoryWarningThresholdBytes() > config.getMemoryCriticalThresholdBytes()) {
            throw new IllegalArgumentException(
                    "monitoring.memory-warning-threshold-bytes must be positive and not exceed the critical threshold");
        }
    }

    // ------------------------------------------------------------------ recording

    /**
     * Record how long building a cache key took.
     */
    public void recordKeyGenerationTime(Duration duration, int textLength, String operationType,
                                        Map<String, Object> additionalData) {
        KeyGenerationMetric metric = KeyGenerationMetric.builder()
                .duration(duration)
                .textLength(textLength)
                .operationType(operationType)
                .additionalData(immutableCopy(additionalData))
                .timestamp(clock.instant())
                .build();

        lock.lock();
        try {
            keyGenerationTimes.add(metric);
            prune(keyGenerationTimes, KeyGenerationMetric::getTimestamp);
        } finally {
            lock.unlock();
        }

        if (duration.compareTo(config.getKeyGenerationThreshold()) > 0) {
            log.warn("Slow key generation: {}ms for {} chars in {} operation",
                    format(toMillis(duration)), textLength, operationType);
        }
        log.debug("Key generation time: {}ms for {} chars ({})", format(toMillis(duration)), textLength, operationType);
    }

    /**
     * Record a cache operation. Only {@code get} operations move the hit/miss counters;
     * every operation counts towards the total.
     */
    public void recordCacheOperationTime(String operation, Duration duration, boolean cacheHit, int textLength,
                                         Map<String, Object> additionalData) {
        CacheOperationMetric metric = CacheOperationMetric.builder()
                .operation(operation)
                .duration(duration)
                .cacheHit(cacheHit)
                .textLength(textLength)
                .additionalData(immutableCopy(additionalData))
                .timestamp(clock.instant())
                .build();

        lock.lock();
        try {
            cacheOperationTimes.add(metric);
            prune(cacheOperationTimes, CacheOperationMetric::getTimestamp);

            totalOperations++;
            if ("get".equals(operation)) {
                if (cacheHit) {
                    cacheHits++;
                } else {
                    cacheMisses++;
                }
            }
        } finally {
            lock.unlock();
        }

        if (duration.compareTo(config.getCacheOperationThreshold()) > 0) {
            log.warn("Slow cache {}: {}ms (hit: {}, text_length: {})",
                    operation, format(toMillis(duration)), cacheHit, textLength);
        }
        log.debug("Cache {} time: {}ms (hit: {}, text_length: {})",
                operation, format(toMillis(duration)), cacheHit, textLength);
    }

    public void recordCompressionRatio(long originalSize, long compressedSize, Duration compressionTime,
                                       String operationType) {
        CompressionMetric metric = CompressionMetric.builder()
                .originalSize(originalSize)
                .compressedSize(compressedSize)
                .compressionRatio(originalSize > 0 ? null : 1.0)
                .compressionTime(compressionTime)
                .operationType(operationType)
                .timestamp(clock.instant())
                .build();

        lock.lock();
        try {
            compressionRatios.add(metric);
            prune(compressionRatios, CompressionMetric::getTimestamp);
        } finally {
            lock.unlock();
        }

        double savingsPercent = originalSize > 0 ? (originalSize - compressedSize) * 100.0 / originalSize : 0.0;
        log.debug("Compression: {} -> {} bytes ({}% savings, {}ms, {})",
                originalSize, compressedSize, format(savingsPercent), format(toMillis(compressionTime)), operationType);
    }

    /**
     * Record a memory snapshot of both tiers.
     *
     * @param storeKeys        number of keys in the external store, or null when unknown
     * @param storeMemoryBytes memory used by the external store, or null when unknown
     */
    public MemoryUsageMetric recordMemoryUsage(int memoryCacheEntryCount, long memoryCacheSizeBytes,
                                               int memoryCacheSizeLimit, Long storeKeys, Long storeMemoryBytes,
                                               Map<String, Object> additionalData) {
        long totalBytes = memoryCacheSizeBytes + (storeMemoryBytes != null ? storeMemoryBytes : 0);
        long entryCount = memoryCacheEntryCount + (storeKeys != null ? storeKeys : 0L);
        double avgEntrySize = memoryCacheEntryCount > 0 ? (double) memoryCacheSizeBytes / memoryCacheEntryCount : 0.0;
        double utilization = totalBytes * 100.0 / config.getMemoryWarningThresholdBytes();
        boolean warningReached = totalBytes >= config.getMemoryWarningThresholdBytes();

        MemoryUsageMetric metric = MemoryUsageMetric.builder()
                .totalCacheSizeBytes(totalBytes)
                .cacheEntryCount(entryCount)
                .avgEntrySizeBytes(avgEntrySize)
                .memoryCacheSizeBytes(memoryCacheSizeBytes)
                .memoryCacheEntryCount(memoryCacheEntryCount)
                .memoryCacheSizeLimit(memoryCacheSizeLimit)
                .processMemoryMb(processMemoryMb())
                .cacheUtilizationPercent(utilization)
                .warningThresholdReached(warningReached)
                .additionalData(immutableCopy(additionalData))
                .timestamp(clock.instant())
                .build();

        lock.lock();
        try {
            memoryUsageMeasurements.add(metric);
            prune(memoryUsageMeasurements, MemoryUsageMetric::getTimestamp);
        } finally {
            lock.unlock();
        }

        if (totalBytes >= config.getMemoryCriticalThresholdBytes()) {
            log.error("Critical cache memory usage: {}MB (>{}MB threshold)",
                    format(totalBytes / BYTES_PER_MB), format(config.getMemoryCriticalThresholdBytes() / BYTES_PER_MB));
        } else if (warningReached) {
            log.warn("High cache memory usage: {}MB (>{}MB threshold)",
                    format(totalBytes / BYTES_PER_MB), format(config.getMemoryWarningThresholdBytes() / BYTES_PER_MB));
        }
        log.debug("Cache memory usage: {}MB ({} entries, {}% of threshold)",
                format(totalBytes / BYTES_PER_MB), entryCount, format(utilization));

        return metric;
    }

    /**
     * Record an invalidation and alert when the trailing-hour rate crosses the configured thresholds.
     */
    public void recordInvalidationEvent(String pattern, int keysInvalidated, Duration duration,
                                        InvalidationType invalidationType, String operationContext,
                                        Map<String, Object> additionalData) {
        InvalidationMetric metric = InvalidationMetric.builder()
                .pattern(pattern)
                .keysInvalidated(keysInvalidated)
                .duration(duration)
                .invalidationType(invalidationType)
                .operationContext(operationContext != null ? operationContext : "")
                .additionalData(immutableCopy(additionalData))
                .timestamp(clock.instant())
                .build();

        int lastHour;
        lock.lock();
        try {
            invalidationEvents.add(metric);
            prune(invalidationEvents, InvalidationMetric::getTimestamp);

            totalInvalidations++;
            totalKeysInvalidated += keysInvalidated;

            lastHour = countSince(invalidationEvents, clock.instant().minus(ONE_HOUR));
        } finally {
            lock.unlock();
        }

        if (lastHour >= config.getInvalidationCriticalPerHour()) {
            log.error("Critical invalidation rate: {} invalidations in last hour (>{} threshold)",
                    lastHour, config.getInvalidationCriticalPerHour());
        } else if (lastHour >= config.getInvalidationWarningPerHour()) {
            log.warn("High invalidation rate: {} invalidations in last hour (>{} threshold)",
                    lastHour, config.getInvalidationWarningPerHour());
        }
        log.debug("Cache invalidation: pattern='{}', keys={}, time={}ms, type={}, context={}",
                pattern, keysInvalidated, format(toMillis(duration)), invalidationType.getValue(), operationContext);
    }

    // ------------------------------------------------------------------ statistics

    public PerformanceStats getPerformanceStats() {
        lock.lock();
        try {
            pruneAll();
            Instant now = clock.instant();

            PerformanceStats.PerformanceStatsBuilder stats = PerformanceStats.builder()
                    .timestamp(now)
                    .retention(config.getRetention())
                    .cacheHitRate(hitRate())
                    .totalCacheOperations(totalOperations)
                    .cacheHits(cacheHits)
                    .cacheMisses(cacheMisses);

            if (!keyGenerationTimes.isEmpty()) {
                stats.keyGeneration(keyGenerationStats());
            }
            if (!cacheOperationTimes.isEmpty()) {
                stats.cacheOperations(cacheOperationStats());
            }
            if (!compressionRatios.isEmpty()) {
                stats.compression(compressionStats());
            }
            if (!memoryUsageMeasurements.isEmpty()) {
                stats.memoryUsage(memoryUsageStats());
            }
            if (!invalidationEvents.isEmpty()) {
                stats.invalidation(invalidationFrequencyStats(now));
            }
            return stats.build();
        } finally {
            lock.unlock();
        }
    }

    private PerformanceStats.KeyGenerationStats keyGenerationStats() {
        List<Double> durations = collect(keyGenerationTimes, m -> toMillis(m.getDuration()));
        List<Double> lengths = collect(keyGenerationTimes, m -> m.getTextLength());
        double slowThreshold = toMillis(config.getKeyGenerationThreshold());

        return PerformanceStats.KeyGenerationStats.builder()
                .totalOperations(keyGenerationTimes.size())
                .avgDurationMs(mean(durations))
                .medianDurationMs(median(durations))
                .maxDurationMs(Collections.max(durations))
                .minDurationMs(Collections.min(durations))
                .avgTextLength(mean(lengths))
                .maxTextLength(keyGenerationTimes.stream().mapToInt(KeyGenerationMetric::getTextLength).max().orElse(0))
                .slowOperations((int) durations.stream().filter(d -> d > slowThreshold).count())
                .build();
    }

    private PerformanceStats.CacheOperationStats cacheOperationStats() {
        List<Double> durations = collect(cacheOperationTimes, m -> toMillis(m.getDuration()));
        double slowThreshold = toMillis(config.getCacheOperationThreshold());

        Map<String, List<Double>> byType = new LinkedHashMap<>();
        for (CacheOperationMetric metric : cacheOperationTimes) {
            byType.computeIfAbsent(metric.getOperation(), k -> new ArrayList<>()).add(toMillis(metric.getDuration()));
        }

        Map<String, PerformanceStats.OperationTypeStats> byOperationType = new LinkedHashMap<>();
        byType.forEach((operation, values) -> byOperationType.put(operation,
                PerformanceStats.OperationTypeStats.builder()
                        .count(values.size())
                        .avgDurationMs(mean(values))
                        .maxDurationMs(Collections.max(values))
                        .build()));

        return PerformanceStats.CacheOperationStats.builder()
                .totalOperations(cacheOperationTimes.size())
                .avgDurationMs(mean(durations))
                .medianDurationMs(median(durations))
                .maxDurationMs(Collections.max(durations))
                .minDurationMs(Collections.min(durations))
                .slowOperations((int) durations.stream().filter(d -> d > slowThreshold).count())
                .byOperationType(byOperationType)
                .build();
    }

    private PerformanceStats.CompressionStats compressionStats() {
        List<Double> ratios = collect(compressionRatios, CompressionMetric::getCompressionRatio);
        List<Double> times = collect(compressionRatios, m -> toMillis(m.getCompressionTime()));
        long totalOriginal = compressionRatios.stream().mapToLong(CompressionMetric::getOriginalSize).sum();
        long totalCompressed = compressionRatios.stream().mapToLong(CompressionMetric::getCompressedSize).sum();
        long saved = totalOriginal - totalCompressed;

        return PerformanceStats.CompressionStats.builder()
                .totalOperations(compressionRatios.size())
                .avgCompressionRatio(mean(ratios))
                .medianCompressionRatio(median(ratios))
                .bestCompressionRatio(Collections.min(ratios))
                .worstCompressionRatio(Collections.max(ratios))
                .avgCompressionTimeMs(mean(times))
                .maxCompressionTimeMs(Collections.max(times))
                .totalBytesProcessed(totalOriginal)
                .totalBytesSaved(saved)
                .overallSavingsPercent(totalOriginal > 0 ? saved * 100.0 / totalOriginal : 0.0)
                .build();
    }

    /**
     * Measurements noticeably slower than the mean of their kind.
     *
     * A measurement is flagged when it exceeds {@code mean * thresholdMultiplier}. The mean includes
     * the outliers themselves, so one extreme value can hide smaller ones in the same window.
     *
     * @return flagged measurements keyed by kind: key_generation, cache_operations, compression, invalidation
     */
    public Map<String, List<SlowOperation>> getRecentSlowOperations(double thresholdMultiplier) {
        lock.lock();
        try {
            pruneAll();

            Map<String, List<SlowOperation>> slow = new LinkedHashMap<>();
            slow.put("key_generation", findSlow(keyGenerationTimes, m -> toMillis(m.getDuration()),
                    thresholdMultiplier, (m, ratio) -> SlowOperation.builder()
                            .durationMs(toMillis(m.getDuration()))
                            .textLength(m.getTextLength())
                            .operationType(m.getOperationType())
                            .timestamp(m.getTimestamp())
                            .timesSlower(ratio)
                            .build()));
            slow.put("cache_operations", findSlow(cacheOperationTimes, m -> toMillis(m.getDuration()),
                    thresholdMultiplier, (m, ratio) -> SlowOperation.builder()
                            .durationMs(toMillis(m.getDuration()))
                            .textLength(m.getTextLength())
                            .operationType(m.getOperation())
                            .timestamp(m.getTimestamp())
                            .timesSlower(ratio)
                            .build()));
            slow.put("compression", findSlow(compressionRatios, m -> toMillis(m.getCompressionTime()),
                    thresholdMultiplier, (m, ratio) -> SlowOperation.builder()
                            .durationMs(toMillis(m.getCompressionTime()))
                            .originalSize(m.getOriginalSize())
                            .compressionRatio(m.getCompressionRatio())
                            .operationType(m.getOperationType())
                            .timestamp(m.getTimestamp())
                            .timesSlower(ratio)
                            .build()));
            slow.put("invalidation", findSlow(invalidationEvents, m -> toMillis(m.getDuration()),
                    thresholdMultiplier, (m, ratio) -> SlowOperation.builder()
                            .durationMs(toMillis(m.getDuration()))
                            .pattern(m.getPattern())
                            .operationType(m.getInvalidationType().getValue())
                            .timestamp(m.getTimestamp())
                            .timesSlower(ratio)
                            .build()));
            return slow;
        } finally {
            lock.unlock();
        }
    }

    private interface SlowOperationFactory<T> {
        SlowOperation create(T metric, double timesSlower);
    }

    private static <T> List<SlowOperation> findSlow(List<T> metrics, ToDoubleFunction<T> value,
                                                    double thresholdMultiplier, SlowOperationFactory<T> factory) {
        List<SlowOperation> result = new ArrayList<>();
        if (metrics.isEmpty()) {
            return result;
        }

        double avg = metrics.stream().mapToDouble(value).average().orElse(0.0);
        double threshold = avg * thresholdMultiplier;
        for (T metric : metrics) {
            double v = value.applyAsDouble(metric);
            if (v > threshold && avg > 0) {
                result.add(factory.create(metric, v / avg));
            }
        }
        return result;
    }

    public InvalidationFrequencyStats getInvalidationFrequencyStats() {
        lock.lock();
        try {
            prune(invalidationEvents, InvalidationMetric::getTimestamp);
            return invalidationFrequencyStats(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    private InvalidationFrequencyStats invalidationFrequencyStats(Instant now) {
        if (invalidationEvents.isEmpty()) {
            return InvalidationFrequencyStats.builder()
                    .noInvalidations(true)
                    .totalInvalidations(totalInvalidations)
                    .totalKeysInvalidated(totalKeysInvalidated)
                    .thresholds(InvalidationFrequencyStats.Thresholds.builder()
                            .warningPerHour(config.getInvalidationWarningPerHour())
                            .criticalPerHour(config.getInvalidationCriticalPerHour())
                            .currentAlertLevel(Severity.NORMAL)
                            .build())
                    .build();
        }

        List<InvalidationMetric> recent = invalidationEvents.subList(
                Math.max(0, invalidationEvents.size() - ANALYSIS_WINDOW), invalidationEvents.size());

        int lastHour = countSince(invalidationEvents, now.minus(ONE_HOUR));
        int last24Hours = countSince(invalidationEvents, now.minus(ONE_DAY));

        Map<String, Integer> patternCounts = new LinkedHashMap<>();
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (InvalidationMetric event : recent) {
            patternCounts.merge(event.getPattern(), 1, Integer::sum);
            typeCounts.merge(event.getInvalidationType().getValue(), 1, Integer::sum);
        }

        Map<String, Integer> mostCommon = patternCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_PATTERNS)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        double retentionHours = config.getRetention().toMillis() / (double) ONE_HOUR.toMillis();
        List<Double> recentDurations = collect(recent, m -> toMillis(m.getDuration()));

        return InvalidationFrequencyStats.builder()
                .totalInvalidations(totalInvalidations)
                .totalKeysInvalidated(totalKeysInvalidated)
                .rates(InvalidationFrequencyStats.Rates.builder()
                        .lastHour(lastHour)
                        .last24Hours(last24Hours)
                        .averagePerHour(invalidationEvents.size() / (retentionHours > 0 ? retentionHours : 1.0))
                        .build())
                .thresholds(InvalidationFrequencyStats.Thresholds.builder()
                        .warningPerHour(config.getInvalidationWarningPerHour())
                        .criticalPerHour(config.getInvalidationCriticalPerHour())
                        .currentAlertLevel(alertLevel(lastHour))
                        .build())
                .patterns(InvalidationFrequencyStats.Patterns.builder()
                        .mostCommonPatterns(mostCommon)
                        .invalidationTypes(typeCounts)
                        .build())
                .efficiency(InvalidationFrequencyStats.Efficiency.builder()
                        .avgKeysPerInvalidation(totalInvalidations > 0
                                ? (double) totalKeysInvalidated / totalInvalidations : 0.0)
                        .avgDurationMs(mean(recentDurations))
                        .maxDurationMs(Collections.max(recentDurations))
                        .build())
                .build();
    }

    private Severity alertLevel(int lastHour) {
        if (lastHour >= config.getInvalidationCriticalPerHour()) {
            return Severity.CRITICAL;
        } else if (lastHour >= config.getInvalidationWarningPerHour()) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    /**
     * Suggestions derived from invalidation frequency, pattern dominance and keys-per-invalidation.
     *
     * @return empty when no invalidation has been recorded
     */
    public List<InvalidationRecommendation> getInvalidationRecommendations() {
        InvalidationFrequencyStats stats;
        int eventCount;
        lock.lock();
        try {
            prune(invalidationEvents, InvalidationMetric::getTimestamp);
            if (invalidationEvents.isEmpty()) {
                return List.of();
            }
            stats = invalidationFrequencyStats(clock.instant());
            eventCount = invalidationEvents.size();
        } finally {
            lock.unlock();
        }

        List<InvalidationRecommendation> recommendations = new ArrayList<>();

        int lastHour = stats.getRates().getLastHour();
        if (lastHour >= config.getInvalidationWarningPerHour()) {
            recommendations.add(InvalidationRecommendation.builder()
                    .severity(stats.getThresholds().getCurrentAlertLevel() == Severity.WARNING
                            ? Severity.WARNING : Severity.CRITICAL)
                    .issue("High invalidation frequency")
                    .message(String.format("Cache is being invalidated %d times per hour", lastHour))
                    .suggestions(List.of(
                            "Review invalidation triggers to reduce unnecessary clearing",
                            "Consider using more specific patterns for selective invalidation",
                            "Check if TTL values are set too low",
                            "Analyze if cache warming strategy needs improvement"))
                    .build());
        }

        Map<String, Integer> patterns = stats.getPatterns().getMostCommonPatterns();
        if (!patterns.isEmpty()) {
            Map.Entry<String, Integer> top = patterns.entrySet().iterator().next();
            if (top.getValue() > eventCount * 0.5) {
                recommendations.add(InvalidationRecommendation.builder()
                        .severity(Severity.INFO)
                        .issue("Dominant invalidation pattern")
                        .message(String.format("Pattern '%s' accounts for %d of %d recent invalidations",
                                top.getKey(), top.getValue(), eventCount))
                        .suggestions(List.of(
                                "Consider optimizing operations that trigger '" + top.getKey() + "' invalidations",
                                "Evaluate if this pattern could be made more specific",
                                "Check if related data could be cached with different strategies"))
                        .build());
            }
        }

        double avgKeys = stats.getEfficiency().getAvgKeysPerInvalidation();
        if (avgKeys < 1.0) {
            recommendations.add(InvalidationRecommendation.builder()
                    .severity(Severity.INFO)
                    .issue("Low invalidation efficiency")
                    .message(String.format("Average of %.1f keys invalidated per operation", avgKeys))
                    .suggestions(List.of(
                            "Many invalidation operations are not finding keys to clear",
                            "Consider using more targeted patterns",
                            "Review if cache keys are structured optimally for invalidation"))
                    .build());
        } else if (avgKeys > 100.0) {
            recommendations.add(InvalidationRecommendation.builder()
                    .severity(Severity.WARNING)
                    .issue("High invalidation impact")
                    .message(String.format("Average of %.0f keys invalidated per operation", avgKeys))
                    .suggestions(List.of(
                            "Invalidation operations are clearing large numbers of entries",
                            "Consider using more selective patterns to preserve valid cache entries",
                            "Evaluate if smaller, more frequent invalidations would be better"))
                    .build());
        }

        return recommendations;
    }

    public MemoryUsageStats getMemoryUsageStats() {
        lock.lock();
        try {
            prune(memoryUsageMeasurements, MemoryUsageMetric::getTimestamp);
            return memoryUsageStats();
        } finally {
            lock.unlock();
        }
    }

    private MemoryUsageStats memoryUsageStats() {
        double warningMb = config.getMemoryWarningThresholdBytes() / BYTES_PER_MB;
        double criticalMb = config.getMemoryCriticalThresholdBytes() / BYTES_PER_MB;

        if (memoryUsageMeasurements.isEmpty()) {
            return MemoryUsageStats.builder()
                    .noMeasurements(true)
                    .thresholds(MemoryUsageStats.Thresholds.builder()
                            .warningThresholdMb(warningMb)
                            .criticalThresholdMb(criticalMb)
                            .build())
                    .build();
        }

        MemoryUsageMetric latest = memoryUsageMeasurements.get(memoryUsageMeasurements.size() - 1);
        List<MemoryUsageMetric> recent = memoryUsageMeasurements.subList(
                Math.max(0, memoryUsageMeasurements.size() - TREND_WINDOW), memoryUsageMeasurements.size());
        List<Double> totalSizes = collect(recent, m -> m.getTotalCacheSizeBytes());
        List<Double> memorySizes = collect(recent, m -> m.getMemoryCacheSizeBytes());
        List<Double> entryCounts = collect(recent, m -> m.getCacheEntryCount());

        Double growthRate = null;
        if (recent.size() >= 2) {
            MemoryUsageMetric first = recent.get(0);
            MemoryUsageMetric last = recent.get(recent.size() - 1);
            long spanMillis = Duration.between(first.getTimestamp(), last.getTimestamp()).toMillis();
            if (spanMillis > 0) {
                double change = last.getTotalCacheSizeBytes() - first.getTotalCacheSizeBytes();
                growthRate = change / spanMillis * ONE_HOUR.toMillis() / BYTES_PER_MB;
            }
        }

        return MemoryUsageStats.builder()
                .current(MemoryUsageStats.Current.builder()
                        .totalCacheSizeMb(latest.getTotalCacheSizeBytes() / BYTES_PER_MB)
                        .memoryCacheSizeMb(latest.getMemoryCacheSizeBytes() / BYTES_PER_MB)
                        .cacheEntryCount(latest.getCacheEntryCount())
                        .memoryCacheEntryCount(latest.getMemoryCacheEntryCount())
                        .avgEntrySizeBytes(latest.getAvgEntrySizeBytes())
                        .processMemoryMb(latest.getProcessMemoryMb())
                        .cacheUtilizationPercent(latest.getCacheUtilizationPercent())
                        .warningThresholdReached(latest.isWarningThresholdReached())
                        .build())
                .thresholds(MemoryUsageStats.Thresholds.builder()
                        .warningThresholdMb(warningMb)
                        .criticalThresholdMb(criticalMb)
                        .warningThresholdReached(latest.isWarningThresholdReached())
                        .criticalThresholdReached(
                                latest.getTotalCacheSizeBytes() >= config.getMemoryCriticalThresholdBytes())
                        .build())
                .trends(MemoryUsageStats.Trends.builder()
                        .totalMeasurements(memoryUsageMeasurements.size())
                        .avgTotalCacheSizeMb(mean(totalSizes) / BYTES_PER_MB)
                        .maxTotalCacheSizeMb(Collections.max(totalSizes) / BYTES_PER_MB)
                        .avgMemoryCacheSizeMb(mean(memorySizes) / BYTES_PER_MB)
                        .avgEntryCount(mean(entryCounts))
                        .maxEntryCount(recent.stream().mapToLong(MemoryUsageMetric::getCacheEntryCount).max().orElse(0))
                        .growthRateMbPerHour(growthRate)
                        .build())
                .build();
    }

    public List<MemoryWarning> getMemoryWarnings() {
        MemoryUsageMetric latest;
        lock.lock();
        try {
            prune(memoryUsageMeasurements, MemoryUsageMetric::getTimestamp);
            if (memoryUsageMeasurements.isEmpty()) {
                return List.of();
            }
            latest = memoryUsageMeasurements.get(memoryUsageMeasurements.size() - 1);
        } finally {
            lock.unlock();
        }

        List<MemoryWarning> warnings = new ArrayList<>();
        double totalMb = latest.getTotalCacheSizeBytes() / BYTES_PER_MB;

        if (latest.getTotalCacheSizeBytes() >= config.getMemoryCriticalThresholdBytes()) {
            warnings.add(MemoryWarning.builder()
                    .severity(Severity.CRITICAL)
                    .message(String.format("Cache memory usage is %.1fMB, exceeding critical threshold of %.1fMB",
                            totalMb, config.getMemoryCriticalThresholdBytes() / BYTES_PER_MB))
                    .recommendations(List.of(
                            "Consider reducing cache TTL values",
                            "Implement more aggressive cache eviction",
                            "Review and optimize large cached responses",
                            "Consider increasing memory limits or scaling horizontally"))
                    .build());
        } else if (latest.isWarningThresholdReached()) {
            warnings.add(MemoryWarning.builder()
                    .severity(Severity.WARNING)
                    .message(String.format("Cache memory usage is %.1fMB, exceeding warning threshold of %.1fMB",
                            totalMb, config.getMemoryWarningThresholdBytes() / BYTES_PER_MB))
                    .recommendations(List.of(
                            "Monitor cache growth closely",
                            "Review cache key patterns for optimization",
                            "Consider reducing memory cache size limit"))
                    .build());
        }

        int limit = latest.getMemoryCacheSizeLimit();
        if (limit > 0 && latest.getMemoryCacheEntryCount() > 0) {
            double utilization = latest.getMemoryCacheEntryCount() * 100.0 / limit;
            if (utilization > 90) {
                warnings.add(MemoryWarning.builder()
                        .severity(Severity.INFO)
                        .message(String.format("Memory cache is %.1f%% full (%d/%d entries)",
                                utilization, latest.getMemoryCacheEntryCount(), limit))
                        .recommendations(List.of(
                                "Memory cache eviction is working properly",
                                "Consider increasing memory cache size if hit rates are good"))
                        .build());
            }
        }

        return warnings;
    }

    // ------------------------------------------------------------------ counters, reset, export

    /**
     * Hits as a percentage (0-100) of all recorded cache operations; 0 when none were recorded.
     */
    public double getCacheHitRate() {
        lock.lock();
        try {
            return hitRate();
        } finally {
            lock.unlock();
        }
    }

    // sets count towards totalOperations, so a set-heavy workload lowers the rate
    private double hitRate() {
        return cacheHits * 100.0 / Math.max(totalOperations, 1);
    }

    public long getCacheHits() {
        lock.lock();
        try {
            return cacheHits;
        } finally {
            lock.unlock();
        }
    }

    public long getCacheMisses() {
        lock.lock();
        try {
            return cacheMisses;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalOperations() {
        lock.lock();
        try {
            return totalOperations;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalInvalidations() {
        lock.lock();
        try {
            return totalInvalidations;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalKeysInvalidated() {
        lock.lock();
        try {
            return totalKeysInvalidated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mean key generation time (ms) over the most recent {@code window} measurements.
     */
    public double getRecentAverageKeyGenerationMs(int window) {
        lock.lock();
        try {
            return recentAverage(keyGenerationTimes, window, m -> toMillis(m.getDuration()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mean cache operation time (ms) over the most recent {@code window} measurements.
     */
    public double getRecentAverageCacheOperationMs(int window) {
        lock.lock();
        try {
            return recentAverage(cacheOperationTimes, window, m -> toMillis(m.getDuration()));
        } finally {
            lock.unlock();
        }
    }

    public boolean hasMemoryMeasurements() {
        lock.lock();
        try {
            return !memoryUsageMeasurements.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear every measurement list and counter.
     */
    public void resetStats() {
        lock.lock();
        try {
            keyGenerationTimes.clear();
            cacheOperationTimes.clear();
            compressionRatios.clear();
            memoryUsageMeasurements.clear();
            invalidationEvents.clear();
            cacheHits = 0;
            cacheMisses = 0;
            totalOperations = 0;
            totalInvalidations = 0;
            totalKeysInvalidated = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache performance statistics reset");
    }

    public MetricsExport exportMetrics() {
        lock.lock();
        try {
            pruneAll();
            return MetricsExport.builder()
                    .keyGenerationTimes(List.copyOf(keyGenerationTimes))
                    .cacheOperationTimes(List.copyOf(cacheOperationTimes))
                    .compressionRatios(List.copyOf(compressionRatios))
                    .memoryUsageMeasurements(List.copyOf(memoryUsageMeasurements))
                    .invalidationEvents(List.copyOf(invalidationEvents))
                    .cacheHits(cacheHits)
                    .cacheMisses(cacheMisses)
                    .totalOperations(totalOperations)
                    .totalInvalidations(totalInvalidations)
                    .totalKeysInvalidated(totalKeysInvalidated)
                    .exportTimestamp(clock.instant())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ helpers

    private void pruneAll() {
        prune(keyGenerationTimes, KeyGenerationMetric::getTimestamp);
        prune(cacheOperationTimes, CacheOperationMetric::getTimestamp);
        prune(compressionRatios, CompressionMetric::getTimestamp);
        prune(memoryUsageMeasurements, MemoryUsageMetric::getTimestamp);
        prune(invalidationEvents, InvalidationMetric::getTimestamp);
    }

    /**
     * Drop measurements outside the retention window, then keep only the newest maxMeasurements.
     */
    private <T> void prune(List<T> measurements, Function<T, Instant> timestampOf) {
        if (measurements.isEmpty()) {
            return;
        }

        Instant cutoff = clock.instant().minus(config.getRetention());
        measurements.removeIf(m -> !timestampOf.apply(m).isAfter(cutoff));

        int overflow = measurements.size() - config.getMaxMeasurements();
        if (overflow > 0) {
            measurements.subList(0, overflow).clear();
        }
    }

    private static int countSince(List<InvalidationMetric> events, Instant cutoff) {
        return (int) events.stream().filter(e -> e.getTimestamp().isAfter(cutoff)).count();
    }

    private static <T> double recentAverage(List<T> metrics, int window, ToDoubleFunction<T> value) {
        if (metrics.isEmpty() || window <= 0) {
            return 0.0;
        }
        return metrics.subList(Math.max(0, metrics.size() - window), metrics.size()).stream()
                .mapToDouble(value)
                .average()
                .orElse(0.0);
    }

    private static <T> List<Double> collect(List<T> metrics, ToDoubleFunction<T> value) {
        List<Double> values = new ArrayList<>(metrics.size());
        for (T metric : metrics) {
            values.add(value.applyAsDouble(metric));
        }
        return values;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    private static double processMemoryMb() {
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
    }
}
