package com.textcache.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.textcache.config.TextCacheProperties;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Tier-2 value envelope: {@code [1-byte marker][payload]}.
 *
 * Marker {@code 0x00} means the payload is the entry serialized as JSON; marker {@code 0x01}
 * means the JSON was deflated. Payloads larger than the compression threshold are deflated
 * at the configured level.
 */
@Component
public class PayloadCodec {

    static final byte RAW = 0x00;
    static final byte COMPRESSED = 0x01;

    private static final TypeReference<LinkedHashMap<String, Object>> ENTRY_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final int compressionThreshold;
    private final int compressionLevel;

    public PayloadCodec(ObjectMapper objectMapper, TextCacheProperties properties) {
        // Entries keep explicit nulls; the shared mapper drops them from beans.
        this.objectMapper = objectMapper.copy().setSerializationInclusion(JsonInclude.Include.ALWAYS);
        this.compressionThreshold = properties.getCache().getCompressionThreshold();
        this.compressionLevel = properties.getCache().getCompressionLevel();

        if (compressionLevel < 1 || compressionLevel > 9) {
            throw new IllegalArgumentException("cache.compression-level must be between 1 and 9, got " + compressionLevel);
        }
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException("cache.compression-threshold must not be negative");
        }
    }

    /**
     * Serialize and, above the threshold, compress an entry.
     *
     * @throws IllegalArgumentException if the entry cannot be serialized as JSON
     */
    public EncodedPayload encode(Map<String, Object> entry) {
        byte[] json = toJson(entry);

        if (json.length <= compressionThreshold) {
            return new EncodedPayload(withMarker(RAW, json), json.length, false, Duration.ZERO);
        }

        long start = System.nanoTime();
        byte[] deflated = deflate(json);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        return new EncodedPayload(withMarker(COMPRESSED, deflated), json.length, true, elapsed);
    }

    /**
     * Reverse of {@link #encode(Map)}.
     *
     * @throws CorruptedPayloadException on an unknown marker, bad deflate stream or invalid JSON
     */
    public Map<String, Object> decode(byte[] stored) {
        if (stored == null || stored.length == 0) {
            throw new CorruptedPayloadException("Empty payload");
        }

        byte[] body = Arrays.copyOfRange(stored, 1, stored.length);
        byte[] json;
        switch (stored[0]) {
            case RAW:
                json = body;
                break;
            case COMPRESSED:
                json = inflate(body);
                break;
            default:
                throw new CorruptedPayloadException("Unknown payload marker: " + stored[0]);
        }

        return fromJson(json);
    }

    /**
     * The entry as a later {@link #decode(byte[])} would return it: values reduced to their
     * JSON types ({@code Instant} becomes its ISO string, numbers become Integer/Long/Double).
     *
     * @throws IllegalArgumentException if the entry cannot be serialized as JSON
     */
    public Map<String, Object> normalize(Map<String, Object> entry) {
        return fromJson(toJson(entry));
    }

    /**
     * Size of the entry serialized as JSON, used for memory accounting.
     */
    public long serializedSize(Map<String, Object> entry) {
        return toJson(entry).length;
    }

    private byte[] toJson(Map<String, Object> entry) {
        try {
            return objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache entry is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(byte[] json) {
        Map<String, Object> entry;
        try {
            entry = objectMapper.readValue(json, ENTRY_TYPE);
        } catch (IOException e) {
            throw new CorruptedPayloadException("Payload is not a valid JSON object", e);
        }
        // a literal JSON null parses without error
        if (entry == null) {
            throw new CorruptedPayloadException("Payload is not a JSON object");
        }
        return entry;
    }

    private byte[] deflate(byte[] json) {
        Deflater deflater = new Deflater(compressionLevel);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DeflaterOutputStream deflaterOut = new DeflaterOutputStream(baos, deflater)) {

            deflaterOut.write(json);
            deflaterOut.finish();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress payload", e);
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] deflated) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(deflated);
             InflaterInputStream inflaterIn = new InflaterInputStream(bais);
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            byte[] buffer = new byte[1024];
            int len;
            while ((len = inflaterIn.read(buffer)) > 0) {
                baos.write(buffer, 0, len);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CorruptedPayloadException("Failed to decompress payload", e);
        }
    }

    private static byte[] withMarker(byte marker, byte[] payload) {
        byte[] stored = new byte[payload.length + 1];
        stored[0] = marker;
        System.arraycopy(payload, 0, stored, 1, payload.length);
        return stored;
    }

    /**
     * Bytes ready for the store plus what the compression step measured.
     */
    @Value
    public static class EncodedPayload {
        byte[] bytes;
        long originalSize;
        boolean compressed;
        Duration compressionTime;

        /**
         * Size of the payload without the marker byte.
         */
        public long getPayloadSize() {
            return bytes.length - 1L;
        }
    }

    /**
     * A stored value that cannot be decoded. Treated as a cache miss.
     */
    public static class CorruptedPayloadException extends RuntimeException {
        public CorruptedPayloadException(String message) {
            super(message);
        }

        public CorruptedPayloadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
