package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.ExecutionResult;

import java.time.Instant;

/**
 * @param executedAt defaults to now for executed results
 */
public record ExecutionDraft(
    @JsonProperty("test_artifact_id") String testArtifactId,
    ExecutionResult result,
    @JsonProperty("executed_at") Instant executedAt,
    @JsonProperty("executed_by") String executedBy
) {}
