package com.textcache.model.metric;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What triggered a cache invalidation.
 */
public enum InvalidationType {
    MANUAL("manual"),
    AUTOMATIC("automatic"),
    MEMORY("memory"),
    TTL_EXPIRED("ttl_expired");

    private final String value;

    InvalidationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
