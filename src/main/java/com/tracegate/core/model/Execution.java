package com.tracegate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of running one test artifact within one cycle.
 *
 * @param id         store-assigned sequence; higher means recorded later
 * @param executedAt when the run happened; null for planned, not-yet-run records
 */
public record Execution(
    Long id,
    @JsonProperty("cycle_id") String cycleId,
    @JsonProperty("test_artifact_id") String testArtifactId,
    ExecutionResult result,
    @JsonProperty("executed_at") Instant executedAt,
    @JsonProperty("executed_by") String executedBy
) implements Serializable {

    /** Oldest first: by timestamp (unrun records first), then by sequence id. */
    public static final Comparator<Execution> CHRONOLOGICAL = Comparator
            .comparing(Execution::executedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(Execution::id, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

    public static Execution planned(String cycleId, String testArtifactId, String assignee) {
        return new Execution(null, cycleId, testArtifactId, ExecutionResult.NOT_RUN, null,
                assignee != null ? assignee : "");
    }

    /**
     * Collapses executions to the latest one per artifact, ordered by artifact id.
     * Callers pass the executions of a single cycle.
     */
    public static List<Execution> latestPerArtifact(Collection<Execution> executions) {
        Map<String, Execution> latest = new TreeMap<>();
        for (Execution execution : executions) {
            latest.merge(execution.testArtifactId(), execution,
                    (a, b) -> CHRONOLOGICAL.compare(a, b) >= 0 ? a : b);
        }
        return List.copyOf(latest.values());
    }

    public Execution withId(long newId) {
        return new Execution(newId, cycleId, testArtifactId, result, executedAt, executedBy);
    }
}
