package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A supporting test-data package attached to a plan.
 *
 * @param status    data-factory status; {@code "ready"} means usable
 * @param mandatory whether the exit gate waits for this package
 */
public record PlanDataSet(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("data_set_id") String dataSetId,
    String name,
    String status,
    String environment,
    boolean mandatory
) implements Serializable {

    public boolean isReady() {
        return "ready".equalsIgnoreCase(status);
    }
}
