package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The set of upstream references an anchor can be resolved from. Any field may be null.
 */
public record AnchorRefs(
    @JsonProperty("anchor_id") String anchorId,
    @JsonProperty("development_item_id") String developmentItemId,
    @JsonProperty("requirement_id") String requirementId
) {

    public static AnchorRefs ofAnchor(String anchorId) {
        return new AnchorRefs(anchorId, null, null);
    }

    public static AnchorRefs ofDevelopmentItem(String developmentItemId) {
        return new AnchorRefs(null, developmentItemId, null);
    }

    public static AnchorRefs ofRequirement(String requirementId) {
        return new AnchorRefs(null, null, requirementId);
    }

    public boolean isEmpty() {
        return isBlank(anchorId) && isBlank(developmentItemId) && isBlank(requirementId);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
