package com.tracegate.core.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationStatus {
    OK,
    WARN,
    REJECT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
