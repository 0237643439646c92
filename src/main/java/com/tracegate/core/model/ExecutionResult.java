package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionResult {
    NOT_RUN,
    PASS,
    FAIL,
    BLOCKED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionResult fromCode(String value) {
        if (value == null || value.isBlank()) {
            return NOT_RUN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution result: " + value, e);
        }
    }

    public boolean isExecuted() {
        return this != NOT_RUN;
    }
}
