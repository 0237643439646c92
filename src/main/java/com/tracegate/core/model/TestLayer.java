package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Test layer a test artifact is written for. Each layer carries the short code
 * used on the wire ({@code "sit"}, {@code "uat"}, ...).
 */
public enum TestLayer {
    COMPONENT("unit"),
    SYSTEM_INTEGRATION("sit"),
    ACCEPTANCE("uat"),
    REGRESSION("regression"),
    PERFORMANCE("performance"),
    REHEARSAL("cutover_rehearsal");

    private final String code;

    TestLayer(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a layer from its wire code or its enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no layer
     */
    @JsonCreator
    public static TestLayer fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Test layer is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TestLayer layer : values()) {
            if (layer.code.equals(normalized) || layer.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown test layer: " + value);
    }
}
