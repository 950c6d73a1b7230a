package com.textcache.model.dto;

import com.textcache.model.metric.CacheOperationMetric;
import com.textcache.model.metric.CompressionMetric;
import com.textcache.model.metric.InvalidationMetric;
import com.textcache.model.metric.KeyGenerationMetric;
import com.textcache.model.metric.MemoryUsageMetric;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Raw retained measurements plus running counters, for external analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsExport {
    private List<KeyGenerationMetric> keyGenerationTimes;
    private List<CacheOperationMetric> cacheOperationTimes;
    private List<CompressionMetric> compressionRatios;
    private List<MemoryUsageMetric> memoryUsageMeasurements;
    private List<InvalidationMetric> invalidationEvents;
    private long cacheHits;
    private long cacheMisses;
    private long totalOperations;
    private long totalInvalidations;
    private long totalKeysInvalidated;
    private Instant exportTimestamp;
}
