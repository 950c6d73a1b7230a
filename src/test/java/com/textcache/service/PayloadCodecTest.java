package com.textcache.service;

import com.textcache.config.JacksonConfiguration;
import com.textcache.config.TextCacheProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PayloadCodec.
 */
class PayloadCodecTest {

    private TextCacheProperties properties;
    private PayloadCodec codec;

    @BeforeEach
    void setUp() {
        properties = new TextCacheProperties();
        codec = new PayloadCodec(JacksonConfiguration.createObjectMapper(), properties);
    }

    @Test
    void testSmallPayloadStoredRaw() {
        Map<String, Object> entry = Map.of("result", "short");

        PayloadCodec.EncodedPayload payload = codec.encode(entry);

        assertFalse(payload.isCompressed());
        assertEquals(PayloadCodec.RAW, payload.getBytes()[0]);
        assertEquals("{\"result\":\"short\"}",
                new String(payload.getBytes(), 1, payload.getBytes().length - 1, StandardCharsets.UTF_8));
        assertEquals(entry, codec.decode(payload.getBytes()));
    }

    @Test
    void testLargePayloadCompressed() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("result", "lorem ipsum ".repeat(500));
        entry.put("tags", List.of("a", "b"));
        entry.put("score", 0.75);

        PayloadCodec.EncodedPayload payload = codec.encode(entry);

        assertTrue(payload.isCompressed());
        assertEquals(PayloadCodec.COMPRESSED, payload.getBytes()[0]);
        assertTrue(payload.getPayloadSize() < payload.getOriginalSize());
        assertEquals(entry, codec.decode(payload.getBytes()));
    }

    @Test
    void testNullValuesSurvive() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("result", null);
        entry.put("nested", new LinkedHashMap<>(Map.of("a", 1)));

        Map<String, Object> decoded = codec.decode(codec.encode(entry).getBytes());

        assertTrue(decoded.containsKey("result"));
        assertNull(decoded.get("result"));
        assertEquals(Map.of("a", 1), decoded.get("nested"));
    }

    @Test
    void testUnknownMarkerIsCorrupted() {
        byte[] stored = {0x7f, '{', '}'};

        assertThrows(PayloadCodec.CorruptedPayloadException.class, () -> codec.decode(stored));
    }

    @Test
    void testBadDeflateStreamIsCorrupted() {
        byte[] stored = {PayloadCodec.COMPRESSED, 1, 2, 3, 4, 5};

        assertThrows(PayloadCodec.CorruptedPayloadException.class, () -> codec.decode(stored));
    }

    @Test
    void testInvalidJsonIsCorrupted() {
        byte[] json = "not json".getBytes(StandardCharsets.UTF_8);
        byte[] stored = new byte[json.length + 1];
        System.arraycopy(json, 0, stored, 1, json.length);

        assertThrows(PayloadCodec.CorruptedPayloadException.class, () -> codec.decode(stored));
        assertThrows(PayloadCodec.CorruptedPayloadException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void testJsonNullIsCorrupted() {
        byte[] json = "null".getBytes(StandardCharsets.UTF_8);
        byte[] stored = new byte[json.length + 1];
        stored[0] = PayloadCodec.RAW;
        System.arraycopy(json, 0, stored, 1, json.length);

        assertThrows(PayloadCodec.CorruptedPayloadException.class, () -> codec.decode(stored));
    }

    @Test
    void testNormalizeMatchesDecodedTypes() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("created", Instant.parse("2024-05-01T12:00:00Z"));
        entry.put("count", 3L);

        Map<String, Object> normalized = codec.normalize(entry);

        assertEquals("2024-05-01T12:00:00Z", normalized.get("created"));
        assertEquals(codec.decode(codec.encode(entry).getBytes()), normalized);
    }

    @Test
    void testCompressionLevelValidated() {
        properties.getCache().setCompressionLevel(0);
        assertThrows(IllegalArgumentException.class,
                () -> new PayloadCodec(JacksonConfiguration.createObjectMapper(), properties));

        properties.getCache().setCompressionLevel(10);
        assertThrows(IllegalArgumentException.class,
                () -> new PayloadCodec(JacksonConfiguration.createObjectMapper(), properties));
    }

    @Test
    void testUnserializableEntryRejected() {
        Map<String, Object> entry = Map.of("result", new Object());

        assertThrows(IllegalArgumentException.class, () -> codec.encode(entry));
    }
}
