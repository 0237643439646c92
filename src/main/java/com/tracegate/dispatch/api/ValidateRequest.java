package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidateRequest(
    @JsonProperty("test_layer") String testLayer,
    @JsonProperty("anchor_id") String anchorId
) {}
