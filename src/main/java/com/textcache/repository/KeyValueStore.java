package com.textcache.repository;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * External key-value store backing the second cache tier.
 *
 * Implementations may throw on any data operation when the store is unreachable or times out;
 * callers are expected to degrade gracefully. {@link #connect()} never throws for ordinary
 * unavailability.
 */
public interface KeyValueStore {

    /**
     * Establish or verify the connection.
     *
     * @return true if the store is reachable
     */
    boolean connect();

    /**
     * @return stored bytes, or null if the key is absent or expired
     */
    byte[] get(String key);

    void set(String key, byte[] value, Duration ttl);

    /**
     * @return number of keys actually removed
     */
    long delete(Collection<String> keys);

    /**
     * Enumerate keys matching a glob-style pattern ({@code *}, {@code ?}, backslash escapes).
     */
    Set<String> scanKeys(String pattern);

    /**
     * Server information (memory usage, connected clients, ...).
     */
    Map<String, Object> info();
}
