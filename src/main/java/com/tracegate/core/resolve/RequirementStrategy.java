package com.tracegate.core.resolve;

import com.tracegate.core.model.AnchorRefs;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class RequirementStrategy implements AnchorResolutionStrategy {

    private final RequirementChain requirementChain;

    public RequirementStrategy(RequirementChain requirementChain) {
        this.requirementChain = requirementChain;
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public String name() {
        return "requirement";
    }

    @Override
    public Optional<String> resolve(AnchorRefs refs) {
        return requirementChain.anchorOf(refs.requirementId());
    }
}
