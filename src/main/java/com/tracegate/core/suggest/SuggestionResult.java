package com.tracegate.core.suggest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SuggestionResult(
    @JsonProperty("plan_id") String planId,
    List<Suggestion> suggestions,
    int total,
    @JsonProperty("new_count") int newCount,
    @JsonProperty("already_in_plan_count") int alreadyInPlanCount,
    String message
) {}
