package com.textcache.model.metric;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of cache memory consumption across both tiers.
 */
@Value
@Builder
public class MemoryUsageMetric {
    long totalCacheSizeBytes;
    long cacheEntryCount;
    double avgEntrySizeBytes;
    long memoryCacheSizeBytes;
    int memoryCacheEntryCount;
    int memoryCacheSizeLimit;
    double processMemoryMb;

    /**
     * Total size as a percentage of the warning threshold.
     */
    double cacheUtilizationPercent;

    boolean warningThresholdReached;
    Map<String, Object> additionalData;
    Instant timestamp;
}
