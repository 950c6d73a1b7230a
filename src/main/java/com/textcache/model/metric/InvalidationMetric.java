package com.textcache.model.metric;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One cache invalidation event.
 */
@Value
@Builder
public class InvalidationMetric {
    String pattern;
    int keysInvalidated;
    Duration duration;
    InvalidationType invalidationType;

    /**
     * Free-form reason supplied by the caller (e.g. "model_update").
     */
    String operationContext;

    Map<String, Object> additionalData;
    Instant timestamp;
}
