package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A measurement that took notably longer than the mean of its kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlowOperation {
    private double durationMs;
    private String operationType;
    private Integer textLength;
    private Long originalSize;
    private Double compressionRatio;
    private String pattern;
    private Instant timestamp;
    private double timesSlower;
}
