package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregate cache performance statistics.
 *
 * Sections for metric kinds without measurements are left null and omitted from JSON;
 * the hit-rate counters are always present. Durations are in milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceStats {

    private Instant timestamp;
    private Duration retention;

    /**
     * Hit percentage (0-100) over all recorded operations.
     */
    private double cacheHitRate;

    private long totalCacheOperations;
    private long cacheHits;
    private long cacheMisses;

    private KeyGenerationStats keyGeneration;
    private CacheOperationStats cacheOperations;
    private CompressionStats compression;
    private MemoryUsageStats memoryUsage;
    private InvalidationFrequencyStats invalidation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyGenerationStats {
        private int totalOperations;
        private double avgDurationMs;
        private double medianDurationMs;
        private double maxDurationMs;
        private double minDurationMs;
        private double avgTextLength;
        private int maxTextLength;
        private int slowOperations;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheOperationStats {
        private int totalOperations;
        private double avgDurationMs;
        private double medianDurationMs;
        private double maxDurationMs;
        private double minDurationMs;
        private int slowOperations;
        private Map<String, OperationTypeStats> byOperationType;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperationTypeStats {
        private int count;
        private double avgDurationMs;
        private double maxDurationMs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompressionStats {
        private int totalOperations;
        private double avgCompressionRatio;
        private double medianCompressionRatio;

        /**
         * Lowest compressed/original ratio seen.
         */
        private double bestCompressionRatio;

        private double worstCompressionRatio;
        private double avgCompressionTimeMs;
        private double maxCompressionTimeMs;
        private long totalBytesProcessed;
        private long totalBytesSaved;
        private double overallSavingsPercent;
    }
}
