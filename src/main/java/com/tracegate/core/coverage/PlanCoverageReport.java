package com.tracegate.core.coverage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PlanCoverageReport(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("per_declaration") List<CoverageReport> perDeclaration,
    CoverageSummary summary
) {}
