package com.tracegate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CloneRequest(@JsonProperty("suite_id") String suiteId) {}
