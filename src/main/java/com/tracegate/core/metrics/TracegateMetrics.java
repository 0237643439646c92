package com.tracegate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scope resolution, coverage and gate evaluation.
 */
@Service
public class TracegateMetrics {

    private final MeterRegistry registry;

    public TracegateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param path strategy that produced the anchor, or {@code "none"} on a miss
     */
    public void recordAnchorResolution(String path) {
        Counter.builder("tracegate.anchor.resolutions")
                .tag("path", path)
                .tag("outcome", "none".equals(path) ? "miss" : "hit")
                .register(registry)
                .increment();
    }

    public void recordLayerValidation(String layer, String status) {
        Counter.builder("tracegate.layer.validations")
                .tag("layer", layer)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSuggestions(int total, int newCount) {
        DistributionSummary.builder("tracegate.suggestions.total")
                .description("Candidate artifacts found per suggestion run")
                .register(registry)
                .record(total);
        DistributionSummary.builder("tracegate.suggestions.new")
                .description("Candidates not yet in the plan")
                .register(registry)
                .record(newCount);
    }

    /**
     * @param scope {@code "anchor"} or {@code "plan"}
     */
    public void recordCoverageComputation(String scope, long ms) {
        Timer.builder("tracegate.coverage.duration")
                .tag("scope", scope)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateVerdict(boolean passed) {
        Counter.builder("tracegate.gate.evaluations")
                .tag("result", passed ? "pass" : "fail")
                .register(registry)
                .increment();
    }

    /**
     * @param association {@code "suite_link"}, {@code "plan_entry"} or {@code "declaration"}
     */
    public void recordDuplicateAssociation(String association) {
        Counter.builder("tracegate.associations.duplicates")
                .description("Association writes rejected by a uniqueness constraint")
                .tag("association", association)
                .register(registry)
                .increment();
    }
}
