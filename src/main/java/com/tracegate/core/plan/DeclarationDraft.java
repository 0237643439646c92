package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.ScopeSourceType;

/**
 * Input for declaring a scope item on a plan.
 */
public record DeclarationDraft(
    @JsonProperty("source_type") ScopeSourceType sourceType,
    @JsonProperty("source_id") String sourceId,
    String priority,
    @JsonProperty("risk_level") String riskLevel
) {}
