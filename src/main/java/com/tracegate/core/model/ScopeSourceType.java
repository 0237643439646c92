package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of entity a {@link ScopeDeclaration} points at.
 */
public enum ScopeSourceType {
    PROCESS_ANCHOR,
    SCENARIO,
    REQUIREMENT,
    DEVELOPMENT_ITEM;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScopeSourceType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source_type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown source_type: " + value, e);
        }
    }
}
