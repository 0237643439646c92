package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Plan-level statement of testing intent. Unique per (planId, sourceType, sourceId).
 * <p>
 * {@code coverageStatus} is a derived cache owned by the coverage aggregator; user-facing edits
 * go through {@link #withPlanning} which leaves it untouched.
 */
public record ScopeDeclaration(
    String id,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("source_type") ScopeSourceType sourceType,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("display_code") String displayCode,
    @JsonProperty("display_title") String displayTitle,
    String priority,
    @JsonProperty("risk_level") String riskLevel,
    @JsonProperty("coverage_status") CoverageStatus coverageStatus
) implements Serializable {

    /** Label used in trace reasons: the display code when present, else the source id. */
    public String label() {
        return displayCode != null && !displayCode.isBlank() ? displayCode : sourceId;
    }

    public ScopeDeclaration withPlanning(String newPriority, String newRiskLevel) {
        return new ScopeDeclaration(id, planId, sourceType, sourceId, displayCode, displayTitle,
                newPriority != null ? newPriority : priority,
                newRiskLevel != null ? newRiskLevel : riskLevel,
                coverageStatus);
    }

    public ScopeDeclaration withCoverageStatus(CoverageStatus status) {
        return new ScopeDeclaration(id, planId, sourceType, sourceId, displayCode, displayTitle,
                priority, riskLevel, status);
    }
}
