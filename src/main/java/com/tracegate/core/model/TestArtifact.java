package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A test case together with its direct upstream links.
 *
 * @param anchorId          explicit process node reference (any level)
 * @param developmentItemId linked build or configuration item
 * @param requirementId     linked requirement
 * @param resolvedAnchorId  canonical level-3 node computed from the links; null when unresolved
 * @param origin            creation path
 * @param archived          archived artifacts are kept but no longer traced
 */
public record TestArtifact(
    String id,
    String code,
    String title,
    @JsonProperty("test_layer") TestLayer testLayer,
    @JsonProperty("anchor_id") String anchorId,
    @JsonProperty("development_item_id") String developmentItemId,
    @JsonProperty("requirement_id") String requirementId,
    @JsonProperty("resolved_anchor_id") String resolvedAnchorId,
    ArtifactOrigin origin,
    boolean archived
) implements Serializable {

    public AnchorRefs refs() {
        return new AnchorRefs(anchorId, developmentItemId, requirementId);
    }

    public TestArtifact withLinks(AnchorRefs refs, String resolved) {
        return new TestArtifact(id, code, title, testLayer, refs.anchorId(), refs.developmentItemId(),
                refs.requirementId(), resolved, origin, archived);
    }

    public TestArtifact withLayer(TestLayer layer, String resolved) {
        return new TestArtifact(id, code, title, layer, anchorId, developmentItemId, requirementId,
                resolved, origin, archived);
    }

    public TestArtifact asArchived() {
        return new TestArtifact(id, code, title, testLayer, anchorId, developmentItemId, requirementId,
                resolvedAnchorId, origin, true);
    }
}
