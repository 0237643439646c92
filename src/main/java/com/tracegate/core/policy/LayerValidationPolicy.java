package com.tracegate.core.policy;

import com.tracegate.core.error.ValidationRejectedException;
import com.tracegate.core.metrics.TracegateMetrics;
import com.tracegate.core.model.TestLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides whether an artifact on a given test layer may exist without a resolved anchor.
 * <p>
 * Component, system-integration and acceptance tests must trace to a level-3 node; regression
 * tests should; performance and cutover-rehearsal tests need not. Any layer can be overridden
 * through {@link LayerPolicyProperties}. Validation is a pure table lookup.
 */
@Service
public class LayerValidationPolicy {

    private static final Logger log = LoggerFactory.getLogger(LayerValidationPolicy.class);

    private static final Map<TestLayer, AnchorRequirement> DEFAULTS = defaults();

    private final Map<TestLayer, AnchorRequirement> table;
    private final TracegateMetrics metrics;

    public LayerValidationPolicy(LayerPolicyProperties properties, TracegateMetrics metrics) {
        this.metrics = metrics;
        var effective = new EnumMap<>(DEFAULTS);
        properties.getRequirements().forEach((layerCode, requirement) -> {
            TestLayer layer = TestLayer.fromCode(layerCode);
            if (effective.put(layer, requirement) != requirement) {
                log.info("Layer policy override: {} -> {}", layer.code(), requirement);
            }
        });
        this.table = Collections.unmodifiableMap(effective);
    }

    public ValidationOutcome validate(TestLayer layer, String anchorId) {
        if (layer == null) {
            throw new IllegalArgumentException("Test layer is required");
        }
        ValidationOutcome outcome = evaluate(layer, anchorId);
        metrics.recordLayerValidation(layer.code(), outcome.status().code());
        return outcome;
    }

    /**
     * Validates and throws on rejection.
     *
     * @return the outcome, {@code ok} or {@code warn}
     * @throws ValidationRejectedException when the layer mandates an anchor and none was resolved
     */
    public ValidationOutcome enforce(TestLayer layer, String anchorId) {
        ValidationOutcome outcome = validate(layer, anchorId);
        if (outcome.isRejected()) {
            throw new ValidationRejectedException(layer, outcome.message());
        }
        return outcome;
    }

    public AnchorRequirement requirementFor(TestLayer layer) {
        return table.getOrDefault(layer, AnchorRequirement.OPTIONAL);
    }

    public Map<TestLayer, AnchorRequirement> table() {
        return table;
    }

    private ValidationOutcome evaluate(TestLayer layer, String anchorId) {
        boolean anchored = anchorId != null && !anchorId.isBlank();
        if (anchored) {
            return ValidationOutcome.ok();
        }
        return switch (requirementFor(layer)) {
            case MANDATORY -> ValidationOutcome.reject(
                    "A level-3 process anchor is required for '" + layer.code() + "' test artifacts. "
                    + "Provide anchor_id directly, or link a development_item_id or requirement_id "
                    + "that traces to a level-3 node.");
            case RECOMMENDED -> ValidationOutcome.warn(
                    "'" + layer.code() + "' test artifacts should trace to a level-3 process anchor; "
                    + "none could be resolved from the given links.");
            case OPTIONAL -> ValidationOutcome.ok();
        };
    }

    private static Map<TestLayer, AnchorRequirement> defaults() {
        var map = new EnumMap<TestLayer, AnchorRequirement>(TestLayer.class);
        map.put(TestLayer.COMPONENT, AnchorRequirement.MANDATORY);
        map.put(TestLayer.SYSTEM_INTEGRATION, AnchorRequirement.MANDATORY);
        map.put(TestLayer.ACCEPTANCE, AnchorRequirement.MANDATORY);
        map.put(TestLayer.REGRESSION, AnchorRequirement.RECOMMENDED);
        map.put(TestLayer.PERFORMANCE, AnchorRequirement.OPTIONAL);
        map.put(TestLayer.REHEARSAL, AnchorRequirement.OPTIONAL);
        return map;
    }
}
