package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A requirement raised in a fit-to-standard workshop.
 *
 * @param anchorId          direct link to a level-3 (or level-4) process node
 * @param processStepId     process step the requirement was raised against
 * @param developmentItemId build or configuration item derived from this requirement
 */
public record Requirement(
    String id,
    String code,
    String title,
    @JsonProperty("anchor_id") String anchorId,
    @JsonProperty("process_step_id") String processStepId,
    @JsonProperty("development_item_id") String developmentItemId
) implements Serializable {}
