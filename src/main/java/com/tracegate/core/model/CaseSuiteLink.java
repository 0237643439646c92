package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Junction record between a test artifact and a suite. Unique per (testArtifactId, suiteId).
 */
public record CaseSuiteLink(
    @JsonProperty("test_artifact_id") String testArtifactId,
    @JsonProperty("suite_id") String suiteId,
    @JsonProperty("added_method") AddedMethod addedMethod,
    @JsonProperty("created_at") Instant createdAt
) implements Serializable {}
