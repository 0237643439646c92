package com.tracegate.core.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One exit criterion.
 *
 * @param name          stable key ({@code pass_rate}, {@code open_p1_defects}, ...)
 * @param label         human-readable criterion including its threshold
 * @param measuredValue what was measured, or {@code "unknown: ..."} when it could not be
 */
public record GateResult(
    String name,
    String label,
    @JsonProperty("measured_value") String measuredValue,
    boolean passed
) {
    public static GateResult unknown(String name, String label, String reason) {
        return new GateResult(name, label, "unknown: " + reason, false);
    }
}
