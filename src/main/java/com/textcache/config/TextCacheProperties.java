package com.textcache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for text-cache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "textcache")
public class TextCacheProperties {

    private RedisConfig redis = new RedisConfig();
    private CacheConfig cache = new CacheConfig();
    private MonitoringConfig monitoring = new MonitoringConfig();

    @Data
    public static class RedisConfig {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class CacheConfig {
        /**
         * Namespace prepended to every key written to Redis.
         */
        private String keyPrefix = "ai_cache:";

        /**
         * Texts longer than this (in chars) are hashed instead of embedded in the key.
         */
        private int hashThreshold = 1000;

        /**
         * Maximum number of entries held by the in-process tier.
         */
        private int memoryCacheSize = 100;

        /**
         * Serialized payloads larger than this (in bytes) are compressed.
         */
        private int compressionThreshold = 1000;

        /**
         * Deflate level, 1 (fastest) to 9 (smallest).
         */
        private int compressionLevel = 6;

        private Duration defaultTtl = Duration.ofHours(1);
        private TextSizeTiers textSizeTiers = new TextSizeTiers();

        /**
         * TTL per text tier (small, medium, large, xlarge). Missing tiers use defaultTtl.
         */
        private Map<String, Duration> tierTtls = defaultTierTtls();

        private static Map<String, Duration> defaultTierTtls() {
            Map<String, Duration> ttls = new LinkedHashMap<>();
            ttls.put("small", Duration.ofHours(2));
            ttls.put("medium", Duration.ofHours(1));
            ttls.put("large", Duration.ofMinutes(30));
            ttls.put("xlarge", Duration.ofMinutes(15));
            return ttls;
        }
    }

    @Data
    public static class TextSizeTiers {
        private int small = 500;
        private int medium = 5000;
        private int large = 50000;
    }

    @Data
    public static class MonitoringConfig {
        private Duration retention = Duration.ofHours(1);
        private int maxMeasurements = 1000;
        private Duration keyGenerationThreshold = Duration.ofMillis(100);
        private Duration cacheOperationThreshold = Duration.ofMillis(50);
        private int invalidationWarningPerHour = 50;
        private int invalidationCriticalPerHour = 100;
        private long memoryWarningThresholdBytes = 50L * 1024 * 1024;
        private long memoryCriticalThresholdBytes = 100L * 1024 * 1024;
    }
}
