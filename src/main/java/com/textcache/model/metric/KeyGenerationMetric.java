package com.textcache.model.metric;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One cache key generation measurement.
 */
@Value
@Builder
public class KeyGenerationMetric {
    Duration duration;
    int textLength;
    String operationType;

    /**
     * Diagnostic-only metadata (e.g. which text descriptor was used). Never read by cache logic.
     */
    Map<String, Object> additionalData;

    Instant timestamp;
}
