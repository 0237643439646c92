package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A defect raised during testing, scoped to a project.
 *
 * @param executionId execution that raised the defect; nullable
 */
public record Defect(
    String id,
    @JsonProperty("project_id") String projectId,
    String code,
    String title,
    DefectSeverity severity,
    DefectStatus status,
    @JsonProperty("execution_id") Long executionId
) implements Serializable {}
