package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of adding several artifacts to a plan at once.
 *
 * @param skipped artifacts that were already in the plan
 */
public record BulkAddResult(
    @JsonProperty("plan_id") String planId,
    int added,
    int skipped,
    @JsonProperty("added_ids") List<String> addedIds
) {}
