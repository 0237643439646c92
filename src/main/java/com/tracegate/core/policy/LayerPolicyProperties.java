package com.tracegate.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-layer anchor requirements, keyed by layer code ({@code unit}, {@code sit}, ...).
 * Layers not listed keep the built-in default of {@link LayerValidationPolicy}.
 */
@Component
@ConfigurationProperties(prefix = "tracegate.layer-policy")
public class LayerPolicyProperties {

    private Map<String, AnchorRequirement> requirements = new LinkedHashMap<>();

    public Map<String, AnchorRequirement> getRequirements() {
        return requirements;
    }

    public void setRequirements(Map<String, AnchorRequirement> requirements) {
        this.requirements = requirements;
    }
}
