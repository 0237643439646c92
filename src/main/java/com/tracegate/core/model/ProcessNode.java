package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A node of the 4-level process hierarchy (L1 value chain down to L4 process variant).
 *
 * @param id       unique identifier
 * @param level    hierarchy level, 1 (root) to 4
 * @param parentId parent node id; null only for level-1 roots
 * @param code     human-readable code (e.g. "L3-042")
 * @param title    display title
 */
public record ProcessNode(
    String id,
    int level,
    @JsonProperty("parent_id") String parentId,
    String code,
    String title
) implements Serializable {

    public boolean isAnchorLevel() {
        return level == 3;
    }
}
