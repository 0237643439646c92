package com.tracegate.core.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw execution and defect counts behind the gates. Defect counts are null when they could not
 * be read.
 */
public record GateStats(
    @JsonProperty("total_executions") int totalExecutions,
    int passed,
    int failed,
    int blocked,
    @JsonProperty("not_run") int notRun,
    @JsonProperty("pass_rate") double passRate,
    @JsonProperty("completion_rate") double completionRate,
    @JsonProperty("open_p1") Integer openP1,
    @JsonProperty("open_p2") Integer openP2
) {}
