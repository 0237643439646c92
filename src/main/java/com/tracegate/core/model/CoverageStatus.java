package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cached coverage label of a scope declaration.
 */
public enum CoverageStatus {
    NOT_CALCULATED,
    FULL,
    PARTIAL,
    NONE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Derives the label from the counts behind a coverage percentage. {@code FULL} only when every
     * traceable artifact is in the plan, so that the label never disagrees with the percentage.
     */
    public static CoverageStatus fromCounts(int inPlan, int traceable) {
        if (traceable == 0 || inPlan == 0) {
            return NONE;
        }
        return inPlan >= traceable ? FULL : PARTIAL;
    }
}
