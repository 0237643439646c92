package com.tracegate.core.resolve;

import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.model.DevelopmentItem;
import com.tracegate.core.store.EntityGraphStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Development item, then the requirement it delivers, then that requirement's anchor.
 */
@Component
public class DevelopmentItemStrategy implements AnchorResolutionStrategy {

    private final EntityGraphStore store;
    private final RequirementChain requirementChain;

    public DevelopmentItemStrategy(EntityGraphStore store, RequirementChain requirementChain) {
        this.store = store;
        this.requirementChain = requirementChain;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public String name() {
        return "development_item";
    }

    @Override
    public Optional<String> resolve(AnchorRefs refs) {
        if (refs.developmentItemId() == null || refs.developmentItemId().isBlank()) {
            return Optional.empty();
        }
        return store.findDevelopmentItem(refs.developmentItemId())
                .map(DevelopmentItem::requirementId)
                .flatMap(requirementChain::anchorOf);
    }
}
