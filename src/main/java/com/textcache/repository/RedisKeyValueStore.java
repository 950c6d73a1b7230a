package com.textcache.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis-backed key-value store.
 *
 * The connection is verified lazily with PING and re-verified after any failed command,
 * so a Redis restart is picked up on the next operation.
 */
@Slf4j
@Repository
public class RedisKeyValueStore implements KeyValueStore {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public RedisKeyValueStore(RedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean connect() {
        if (connected.get()) {
            return true;
        }

        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            boolean ok = "PONG".equalsIgnoreCase(pong);
            connected.set(ok);
            if (ok) {
                log.info("Connected to Redis");
            } else {
                log.warn("Unexpected PING reply from Redis: {}", pong);
            }
            return ok;
        } catch (Exception e) {
            log.warn("Redis connection failed: {} - operating without the Redis tier", e.getMessage());
            return false;
        }
    }

    @Override
    public byte[] get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            connected.set(false);
            throw e;
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (RuntimeException e) {
            connected.set(false);
            throw e;
        }
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }

        try {
            Long removed = redisTemplate.delete(keys);
            return removed != null ? removed : 0;
        } catch (RuntimeException e) {
            connected.set(false);
            throw e;
        }
    }

    @Override
    public Set<String> scanKeys(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            return keys != null ? keys : Set.of();
        } catch (RuntimeException e) {
            connected.set(false);
            throw e;
        }
    }

    @Override
    public Map<String, Object> info() {
        try {
            Properties info = redisTemplate.execute(
                    (RedisCallback<Properties>) connection -> connection.serverCommands().info());

            Map<String, Object> result = new LinkedHashMap<>();
            if (info != null) {
                info.stringPropertyNames().forEach(name -> result.put(name, info.getProperty(name)));
            }
            return result;
        } catch (RuntimeException e) {
            connected.set(false);
            throw e;
        }
    }
}
