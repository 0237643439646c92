package com.tracegate.core.resolve;

import com.tracegate.core.model.AnchorRefs;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ExplicitNodeStrategy implements AnchorResolutionStrategy {

    private final ProcessHierarchy hierarchy;

    public ExplicitNodeStrategy(ProcessHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public String name() {
        return "explicit_node";
    }

    @Override
    public Optional<String> resolve(AnchorRefs refs) {
        if (refs.anchorId() == null || refs.anchorId().isBlank()) {
            return Optional.empty();
        }
        return hierarchy.ascendToAnchorLevel(refs.anchorId());
    }
}
