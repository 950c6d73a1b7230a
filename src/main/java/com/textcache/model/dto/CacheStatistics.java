package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Combined view of both cache tiers and the performance monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private StoreStatistics store;
    private MemoryTierStatistics memory;
    private PerformanceStats performance;

    /**
     * Redis tier status.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StoreStatistics {
        private String status;  // "connected", "unavailable" or "error"
        private long keys;
        private String memoryUsed;
        private Long memoryUsedBytes;
        private Integer connectedClients;
        private String error;
    }

    /**
     * In-process tier status.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryTierStatistics {
        private int memoryCacheEntries;
        private int memoryCacheSizeLimit;
        private String memoryCacheUtilization;
    }
}
