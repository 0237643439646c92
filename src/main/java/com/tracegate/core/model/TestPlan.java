package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record TestPlan(
    String id,
    @JsonProperty("project_id") String projectId,
    String name
) implements Serializable {}
