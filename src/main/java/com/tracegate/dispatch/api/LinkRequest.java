package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.AddedMethod;

/**
 * Body of a suite membership request. {@code added_method} defaults to {@code manual}.
 */
public record LinkRequest(
    @JsonProperty("test_artifact_id") String testArtifactId,
    @JsonProperty("added_method") AddedMethod addedMethod
) {}
