package com.textcache.service.key;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.textcache.config.JacksonConfiguration;
import com.textcache.config.TextCacheProperties;
import com.textcache.monitoring.PerformanceMonitor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys from (text, operation, options, question).
 *
 * Key layout:
 * <pre>
 *   {prefix}op:{operation}|txt:{text descriptor}|opts:{options digest}[|q:{question digest}]
 * </pre>
 *
 * Texts up to the hash threshold are embedded literally; longer texts are replaced by
 * {@code hash:{sha256}|len:{chars}}. Literal segments are percent-escaped for
 * {@code %}, {@code |} and {@code :} so no segment can forge a delimiter.
 *
 * Options are serialized with sorted keys (recursively) before hashing, so insertion order
 * never changes the key.
 */
@Slf4j
@Service
public class CacheKeyGenerator {

    private static final int DIGEST_LENGTH = 16;

    private final TextCacheProperties.CacheConfig config;
    private final PerformanceMonitor monitor;
    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(TextCacheProperties properties, PerformanceMonitor monitor) {
        this.config = properties.getCache();
        this.monitor = monitor;
        this.canonicalMapper = JacksonConfiguration.createObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .setSerializationInclusion(JsonInclude.Include.ALWAYS);

        if (config.getHashThreshold() < 0) {
            throw new IllegalArgumentException("cache.hash-threshold must not be negative");
        }
    }

    public String generateCacheKey(String text, String operation, Map<String, ?> options) {
        return generateCacheKey(text, operation, options, null);
    }

    /**
     * Generate the cache key and report how long it took.
     *
     * @param text      input text, any length (empty allowed)
     * @param operation non-blank operation identifier
     * @param options   operation options, null treated as empty
     * @param question  optional question for QA-style operations; null or empty means none
     * @return cache key including the namespace prefix
     */
    public String generateCacheKey(String text, String operation, Map<String, ?> options, String question) {
        Objects.requireNonNull(text, "text");
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be blank");
        }

        requireWellFormed(text, "text");
        requireWellFormed(operation, "operation");
        if (question != null) {
            requireWellFormed(question, "question");
        }

        long start = System.nanoTime();

        boolean hashed = text.length() > config.getHashThreshold();
        boolean hasQuestion = question != null && !question.isEmpty();

        StringBuilder key = new StringBuilder(config.getKeyPrefix())
                .append("op:").append(escape(operation))
                .append("|txt:").append(describeText(text, hashed))
                .append("|opts:").append(digestOptions(options));
        if (hasQuestion) {
            key.append("|q:").append(shortDigest(question));
        }
        String cacheKey = key.toString();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("text_tier", hashed ? "hashed" : "literal");
        extra.put("has_question", hasQuestion);
        monitor.recordKeyGenerationTime(elapsed, text.length(), operation, extra);

        log.debug("Generated cache key for {} ({} chars, {})", operation, text.length(), hashed ? "hashed" : "literal");
        return cacheKey;
    }

    /**
     * Substring that matches every key generated for the given operation, and no other.
     */
    public String operationPattern(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be blank");
        }
        return "op:" + escape(operation) + "|";
    }

    private static String describeText(String text, boolean hashed) {
        if (hashed) {
            return "hash:" + DigestUtils.sha256Hex(text) + "|len:" + text.length();
        }
        return escape(text);
    }

    private String digestOptions(Map<String, ?> options) {
        Map<String, Object> sorted = new TreeMap<>();
        if (options != null) {
            sorted.putAll(options);
        }

        try {
            String canonical = canonicalMapper.writeValueAsString(sorted);
            requireWellFormed(canonical, "options");
            return shortDigest(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Options are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String shortDigest(String value) {
        return DigestUtils.sha256Hex(value).substring(0, DIGEST_LENGTH);
    }

    /**
     * Keys and digests are computed over UTF-8, which maps an unpaired surrogate to {@code ?}.
     * Such input would share a key with its {@code ?} twin, so it is rejected.
     */
    static void requireWellFormed(String value, String name) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length()
                    && Character.isLowSurrogate(value.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                throw new IllegalArgumentException(name + " contains an unpaired surrogate at index " + i);
            }
        }
    }

    static String escape(String segment) {
        StringBuilder escaped = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            switch (c) {
                case '%':
                    escaped.append("%25");
                    break;
                case '|':
                    escaped.append("%7C");
                    break;
                case ':':
                    escaped.append("%3A");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
