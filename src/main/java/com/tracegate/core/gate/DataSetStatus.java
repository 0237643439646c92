package com.tracegate.core.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DataSetStatus(
    @JsonProperty("data_set_id") String dataSetId,
    String name,
    String status,
    String environment,
    boolean mandatory,
    boolean ready
) {}
