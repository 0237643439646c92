package com.tracegate.core.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExitGateReport(
    @JsonProperty("plan_id") String planId,
    GateVerdict overall,
    List<GateResult> gates,
    GateStats stats
) {
    public GateResult gate(String name) {
        return gates.stream()
                .filter(g -> g.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No gate named " + name));
    }
}
