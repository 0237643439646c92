package com.tracegate.core.health;

import java.util.Map;

/**
 * Outcome of probing one component. {@link Status#DEGRADED} means the component works with
 * reduced guarantees (for example no database behind an in-memory store) and does not make the
 * service unhealthy; only {@link Status#DOWN} does.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
