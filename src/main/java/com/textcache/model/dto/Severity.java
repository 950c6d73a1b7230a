package com.textcache.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a recommendation or warning, also used as the invalidation alert level.
 */
public enum Severity {
    NORMAL("normal"),
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
