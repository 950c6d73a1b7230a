package com.textcache.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded in-process cache tier with FIFO eviction.
 *
 * Reads never reorder entries. Overwriting an existing key moves it to the newest position.
 * When the bound is exceeded the oldest entry is dropped. A bound of zero disables the tier:
 * puts are skipped.
 */
@Slf4j
public class MemoryCacheTier {

    private final int maxSize;

    // insertion order is eviction order
    private final LinkedHashMap<String, Map<String, Object>> entries = new LinkedHashMap<>();

    public MemoryCacheTier(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("cache.memory-cache-size must not be negative, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public synchronized void put(String key, Map<String, Object> value) {
        Objects.requireNonNull(key, "key");
        if (maxSize == 0) {
            return;
        }

        entries.remove(key);
        entries.put(key, value);

        if (entries.size() > maxSize) {
            Iterator<String> oldest = entries.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Evicted oldest memory cache entry: {}", evicted);
        }
    }

    public synchronized Map<String, Object> get(String key) {
        Objects.requireNonNull(key, "key");
        return entries.get(key);
    }

    public synchronized boolean contains(String key) {
        return key != null && entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * Keys from oldest to newest.
     */
    public synchronized List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Copy of the current entries, oldest first.
     */
    public synchronized Map<String, Map<String, Object>> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * @return number of entries removed
     */
    public synchronized int clear() {
        int removed = entries.size();
        entries.clear();
        return removed;
    }

    /**
     * Remove every entry whose key contains the substring. An empty substring removes everything.
     *
     * @return number of entries removed
     */
    public synchronized int removeMatching(String substring) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.contains(substring));
        return before - entries.size();
    }
}
