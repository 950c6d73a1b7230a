package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Memory usage snapshot analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryUsageStats {

    private Boolean noMeasurements;
    private Current current;
    private Thresholds thresholds;
    private Trends trends;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Current {
        private double totalCacheSizeMb;
        private double memoryCacheSizeMb;
        private long cacheEntryCount;
        private int memoryCacheEntryCount;
        private double avgEntrySizeBytes;
        private double processMemoryMb;
        private double cacheUtilizationPercent;
        private boolean warningThresholdReached;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private double warningThresholdMb;
        private double criticalThresholdMb;
        private boolean warningThresholdReached;
        private boolean criticalThresholdReached;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Trends {
        private int totalMeasurements;
        private double avgTotalCacheSizeMb;
        private double maxTotalCacheSizeMb;
        private double avgMemoryCacheSizeMb;
        private double avgEntryCount;
        private long maxEntryCount;

        /**
         * Only present with at least two snapshots spread over time.
         */
        private Double growthRateMbPerHour;
    }
}
