package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.PlanEntryMethod;

/**
 * Input for adding one artifact to a plan. Everything except the artifact id is optional.
 */
public record PlanEntryDraft(
    @JsonProperty("test_artifact_id") String testArtifactId,
    @JsonProperty("added_method") PlanEntryMethod addedMethod,
    @JsonProperty("priority_override") String priorityOverride,
    @JsonProperty("planned_owner") String plannedOwner,
    @JsonProperty("target_cycle_id") String targetCycleId,
    @JsonProperty("effort_hours") Double effortHours,
    @JsonProperty("execution_order") Integer executionOrder
) {
    public static PlanEntryDraft of(String testArtifactId, PlanEntryMethod method) {
        return new PlanEntryDraft(testArtifactId, method, null, null, null, null, null);
    }
}
