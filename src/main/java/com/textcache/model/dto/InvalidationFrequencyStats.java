package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Invalidation frequency analysis. When nothing has been invalidated yet only
 * {@code noInvalidations}, the totals and the thresholds are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvalidationFrequencyStats {

    private Boolean noInvalidations;
    private long totalInvalidations;
    private long totalKeysInvalidated;
    private Rates rates;
    private Thresholds thresholds;
    private Patterns patterns;
    private Efficiency efficiency;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Rates {
        private int lastHour;
        @JsonProperty("last_24_hours")
        private int last24Hours;
        private double averagePerHour;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private int warningPerHour;
        private int criticalPerHour;
        private Severity currentAlertLevel;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Patterns {
        /**
         * Pattern to event count, most frequent first.
         */
        private Map<String, Integer> mostCommonPatterns;

        private Map<String, Integer> invalidationTypes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Efficiency {
        private double avgKeysPerInvalidation;
        private double avgDurationMs;
        private double maxDurationMs;
    }
}
