package com.tracegate.core.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DataReadiness(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("all_mandatory_ready") boolean allMandatoryReady,
    @JsonProperty("data_sets") List<DataSetStatus> dataSets
) {}
