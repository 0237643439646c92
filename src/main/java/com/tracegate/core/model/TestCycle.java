package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One execution round of a test plan.
 */
public record TestCycle(
    String id,
    @JsonProperty("plan_id") String planId,
    String name,
    int sequence
) implements Serializable {}
