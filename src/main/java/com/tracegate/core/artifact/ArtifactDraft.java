package com.tracegate.core.artifact;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.model.ArtifactOrigin;
import com.tracegate.core.model.TestLayer;

/**
 * Input for registering a test artifact.
 *
 * @param id      optional; generated when absent
 * @param origin  defaults to {@link ArtifactOrigin#MANUAL}
 * @param suiteId suite to place the new artifact in; optional
 */
public record ArtifactDraft(
    String id,
    String code,
    String title,
    @JsonProperty("test_layer") TestLayer testLayer,
    @JsonProperty("anchor_id") String anchorId,
    @JsonProperty("development_item_id") String developmentItemId,
    @JsonProperty("requirement_id") String requirementId,
    ArtifactOrigin origin,
    @JsonProperty("suite_id") String suiteId
) {
    public AnchorRefs refs() {
        return new AnchorRefs(anchorId, developmentItemId, requirementId);
    }
}
