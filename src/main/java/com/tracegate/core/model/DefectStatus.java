package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DefectStatus {
    NEW,
    OPEN,
    IN_PROGRESS,
    FIXED,
    RETEST,
    REOPENED,
    CLOSED,
    REJECTED,
    CANCELLED,
    DEFERRED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DefectStatus fromCode(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Everything short of closed, rejected, cancelled or deferred still blocks an exit. */
    public boolean isOpen() {
        return this != CLOSED && this != REJECTED && this != CANCELLED && this != DEFERRED;
    }
}
