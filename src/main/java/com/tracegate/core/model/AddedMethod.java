package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Provenance of a suite membership: how the {@link CaseSuiteLink} was created.
 */
public enum AddedMethod {
    MANUAL,
    DERIVED_FROM_DEVELOPMENT_ITEM,
    DERIVED_FROM_PROCESS,
    IMPORTED,
    CLONED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AddedMethod fromCode(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown added_method: " + value, e);
        }
    }
}
