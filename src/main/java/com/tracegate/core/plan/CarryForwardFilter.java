package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tracegate.core.model.ExecutionResult;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which results of a previous cycle are carried into the next one.
 */
public enum CarryForwardFilter {
    FAILED(EnumSet.of(ExecutionResult.FAIL)),
    BLOCKED(EnumSet.of(ExecutionResult.BLOCKED)),
    FAILED_BLOCKED(EnumSet.of(ExecutionResult.FAIL, ExecutionResult.BLOCKED)),
    ALL(EnumSet.allOf(ExecutionResult.class));

    private final Set<ExecutionResult> results;

    CarryForwardFilter(Set<ExecutionResult> results) {
        this.results = results;
    }

    public boolean matches(ExecutionResult result) {
        return results.contains(result != null ? result : ExecutionResult.NOT_RUN);
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null or blank means {@link #FAILED_BLOCKED}. */
    @JsonCreator
    public static CarryForwardFilter fromCode(String value) {
        if (value == null || value.isBlank()) {
            return FAILED_BLOCKED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown carry-forward filter: " + value, e);
        }
    }
}
