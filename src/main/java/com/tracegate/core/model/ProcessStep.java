package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A finer-grained execution step recorded under a level-4 process node.
 */
public record ProcessStep(
    String id,
    @JsonProperty("process_node_id") String processNodeId,
    String code,
    String title
) implements Serializable {}
