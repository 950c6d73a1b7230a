package com.textcache.model.metric;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One cache get/set/delete measurement.
 */
@Value
@Builder
public class CacheOperationMetric {
    String operation;
    Duration duration;
    boolean cacheHit;
    int textLength;
    Map<String, Object> additionalData;
    Instant timestamp;
}
