package com.textcache.model.metric;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One payload compression measurement.
 */
@Value
public class CompressionMetric {
    long originalSize;
    long compressedSize;

    /**
     * compressed / original. Lower is better.
     */
    double compressionRatio;

    Duration compressionTime;
    String operationType;
    Instant timestamp;

    /**
     * A missing or zero ratio is derived from the sizes when the original size is positive;
     * otherwise the supplied value (or 0) is kept.
     */
    @Builder
    private CompressionMetric(long originalSize, long compressedSize, Double compressionRatio,
                              Duration compressionTime, String operationType, Instant timestamp) {
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        boolean supplied = compressionRatio != null && compressionRatio != 0.0;
        if (!supplied && originalSize > 0) {
            this.compressionRatio = (double) compressedSize / originalSize;
        } else {
            this.compressionRatio = compressionRatio != null ? compressionRatio : 0.0;
        }
        this.compressionTime = compressionTime;
        this.operationType = operationType;
        this.timestamp = timestamp;
    }
}
