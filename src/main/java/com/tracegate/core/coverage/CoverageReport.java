package com.tracegate.core.coverage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.CoverageStatus;
import com.tracegate.core.model.ScopeSourceType;

/**
 * Coverage of one scope source within one plan.
 *
 * @param declarationId  declaration the row belongs to; null for an ad-hoc anchor report
 * @param dataIncomplete true when the source could not be traced; counts are then zero
 * @param note           explanation for incomplete rows; null otherwise
 */
public record CoverageReport(
    @JsonProperty("declaration_id") String declarationId,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("source_type") ScopeSourceType sourceType,
    @JsonProperty("source_id") String sourceId,
    String label,
    @JsonProperty("total_traceable") int totalTraceable,
    @JsonProperty("in_plan") int inPlan,
    int executed,
    int passed,
    @JsonProperty("failed_or_blocked") int failedOrBlocked,
    @JsonProperty("not_run") int notRun,
    @JsonProperty("coverage_pct") double coveragePct,
    @JsonProperty("execution_pct") double executionPct,
    @JsonProperty("pass_rate") double passRate,
    @JsonProperty("coverage_status") CoverageStatus coverageStatus,
    @JsonProperty("data_incomplete") boolean dataIncomplete,
    String note
) {}
