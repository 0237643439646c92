package com.tracegate.core.coverage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plan-wide roll-up. Declaration counts are per status; artifact counts are over distinct
 * artifacts, so an artifact reached from two declarations counts once.
 */
public record CoverageSummary(
    @JsonProperty("total_declarations") int totalDeclarations,
    @JsonProperty("full_coverage") int fullCoverage,
    @JsonProperty("partial_coverage") int partialCoverage,
    @JsonProperty("no_coverage") int noCoverage,
    @JsonProperty("data_incomplete") int dataIncomplete,
    @JsonProperty("total_traceable") int totalTraceable,
    @JsonProperty("in_plan") int inPlan,
    int executed,
    int passed,
    @JsonProperty("coverage_pct") double coveragePct,
    @JsonProperty("execution_pct") double executionPct,
    @JsonProperty("pass_rate") double passRate
) {}
