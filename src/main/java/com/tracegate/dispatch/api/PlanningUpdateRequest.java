package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Editable planning fields of a scope declaration; null leaves a field unchanged.
 */
public record PlanningUpdateRequest(
    String priority,
    @JsonProperty("risk_level") String riskLevel
) {}
