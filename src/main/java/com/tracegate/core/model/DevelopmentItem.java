package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A custom build (WRICEF) or configuration item.
 *
 * @param requirementId back-link to the requirement this item delivers; nullable
 */
public record DevelopmentItem(
    String id,
    String code,
    String title,
    DevelopmentItemKind kind,
    @JsonProperty("requirement_id") String requirementId
) implements Serializable {}
