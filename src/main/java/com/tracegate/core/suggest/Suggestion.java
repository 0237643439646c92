package com.tracegate.core.suggest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.TestLayer;

public record Suggestion(
    @JsonProperty("test_artifact_id") String testArtifactId,
    String code,
    String title,
    @JsonProperty("test_layer") TestLayer testLayer,
    @JsonProperty("matched_declaration_id") String matchedDeclarationId,
    String reason,
    @JsonProperty("already_in_plan") boolean alreadyInPlan
) {}
