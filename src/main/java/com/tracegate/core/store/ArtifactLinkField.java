package com.tracegate.core.store;

/**
 * Direct reference fields a test artifact can be looked up by.
 */
public enum ArtifactLinkField {
    ANCHOR_ID("anchor_id"),
    DEVELOPMENT_ITEM_ID("development_item_id"),
    REQUIREMENT_ID("requirement_id");

    private final String column;

    ArtifactLinkField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
