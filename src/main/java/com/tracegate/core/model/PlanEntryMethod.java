package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Provenance of a {@link PlanCaseEntry}.
 */
public enum PlanEntryMethod {
    MANUAL,
    SUGGESTION,
    SUITE_IMPORT,
    CLONED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PlanEntryMethod fromCode(String value) {
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
