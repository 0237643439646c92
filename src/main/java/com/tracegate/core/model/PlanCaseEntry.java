package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Membership of a test artifact in a plan's working set, with planning metadata.
 * Unique per (planId, testArtifactId).
 *
 * @param priorityOverride plan-specific priority; null keeps the artifact's own
 * @param plannedOwner     tester the execution is assigned to when a cycle is populated
 * @param targetCycleId    cycle the artifact is planned for; nullable
 * @param effortHours      estimated execution effort; nullable
 * @param executionOrder   position in the plan's run order; nullable
 */
public record PlanCaseEntry(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("test_artifact_id") String testArtifactId,
    @JsonProperty("added_method") PlanEntryMethod addedMethod,
    @JsonProperty("priority_override") String priorityOverride,
    @JsonProperty("planned_owner") String plannedOwner,
    @JsonProperty("target_cycle_id") String targetCycleId,
    @JsonProperty("effort_hours") Double effortHours,
    @JsonProperty("execution_order") Integer executionOrder,
    @JsonProperty("added_at") Instant addedAt
) implements Serializable {

    public static PlanCaseEntry of(String planId, String testArtifactId, PlanEntryMethod method, Instant addedAt) {
        return new PlanCaseEntry(planId, testArtifactId, method, null, null, null, null, null, addedAt);
    }
}
