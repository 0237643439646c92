package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Suggestions to accept; an empty or missing list accepts every new suggestion.
 */
public record AcceptSuggestionsRequest(@JsonProperty("test_artifact_ids") List<String> testArtifactIds) {}
