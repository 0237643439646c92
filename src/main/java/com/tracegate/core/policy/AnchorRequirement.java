package com.tracegate.core.policy;

/**
 * How strictly a test layer needs a resolved level-3 anchor.
 */
public enum AnchorRequirement {
    /** No anchor means the artifact is rejected. */
    MANDATORY,
    /** No anchor is accepted with a warning. */
    RECOMMENDED,
    /** Never checked. */
    OPTIONAL
}
