package com.tracegate.core.model;

/**
 * How a test artifact came into existence.
 */
public enum ArtifactOrigin {
    MANUAL,
    FROM_DEVELOPMENT_ITEM,
    FROM_PROCESS,
    CLONED
}
