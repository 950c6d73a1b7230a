package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Short performance overview: hit ratio, counters and recent averages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceSummary {
    private double hitRatio;
    private long totalCacheOperations;
    private long cacheHits;
    private long cacheMisses;

    /**
     * Average over the last 10 key generations, in ms.
     */
    private double recentAvgKeyGenerationMs;

    /**
     * Average over the last 10 cache operations, in ms.
     */
    private double recentAvgCacheOperationMs;

    private long totalInvalidations;
    private long totalKeysInvalidated;

    /**
     * Present once at least one memory snapshot was recorded.
     */
    private MemoryUsageStats memoryUsage;
}
