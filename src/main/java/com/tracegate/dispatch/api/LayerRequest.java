package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LayerRequest(@JsonProperty("test_layer") String testLayer) {}
