package com.tracegate.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param sourceCycleId previous cycle for a carry-forward; null when populated from the plan
 * @param sourceTotal   candidate executions considered before skipping existing artifacts
 */
public record CyclePopulation(
    @JsonProperty("cycle_id") String cycleId,
    @JsonProperty("source_cycle_id") String sourceCycleId,
    int created,
    int skipped,
    @JsonProperty("source_total") int sourceTotal
) {}
