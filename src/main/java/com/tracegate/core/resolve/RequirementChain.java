package com.tracegate.core.resolve;

import com.tracegate.core.model.ProcessStep;
import com.tracegate.core.model.Requirement;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a requirement to its level-3 anchor: the direct anchor when the requirement has one,
 * otherwise the level-3 parent of the process step's level-4 node.
 */
@Component
public class RequirementChain {

    private static final Logger log = LoggerFactory.getLogger(RequirementChain.class);

    private final EntityGraphStore store;
    private final ProcessHierarchy hierarchy;

    public RequirementChain(EntityGraphStore store, ProcessHierarchy hierarchy) {
        this.store = store;
        this.hierarchy = hierarchy;
    }

    public Optional<String> anchorOf(String requirementId) {
        if (requirementId == null || requirementId.isBlank()) {
            return Optional.empty();
        }
        Optional<Requirement> requirement = store.findRequirement(requirementId);
        if (requirement.isEmpty()) {
            log.debug("Requirement {} not found", requirementId);
            return Optional.empty();
        }
        String anchorId = requirement.get().anchorId();
        if (anchorId != null && !anchorId.isBlank()) {
            return hierarchy.ascendToAnchorLevel(anchorId);
        }
        String stepId = requirement.get().processStepId();
        if (stepId == null || stepId.isBlank()) {
            return Optional.empty();
        }
        return store.findProcessStep(stepId)
                .map(ProcessStep::processNodeId)
                .flatMap(hierarchy::ascendToAnchorLevel);
    }
}
